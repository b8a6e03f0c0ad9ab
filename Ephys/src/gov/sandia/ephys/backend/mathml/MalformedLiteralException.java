/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Node;

/**
    A number could not be decoded from its element.
**/
@SuppressWarnings("serial")
public class MalformedLiteralException extends MathMLException
{
    public MalformedLiteralException (String message, Node node)
    {
        super (message, node);
    }

    public MalformedLiteralException (String message, Node node, Throwable cause)
    {
        super (message, node, cause);
    }
}
