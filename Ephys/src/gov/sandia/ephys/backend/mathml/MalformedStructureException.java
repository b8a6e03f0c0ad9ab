/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Node;

/**
    The element tree does not have the shape MathML requires, or uses a tag this importer does not know.
**/
@SuppressWarnings("serial")
public class MalformedStructureException extends MathMLException
{
    public MalformedStructureException (String message, Node node)
    {
        super (message, node);
    }

    public MalformedStructureException (String message, Node node, Throwable cause)
    {
        super (message, node, cause);
    }
}
