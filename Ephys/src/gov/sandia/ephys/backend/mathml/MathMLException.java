/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Node;

import gov.sandia.ephys.language.ParseException;

/**
    Failure to import a MathML tree. Carries the element where the problem was found.
**/
@SuppressWarnings("serial")
public class MathMLException extends ParseException
{
    public final transient Node node;  // may be null

    public MathMLException (String message, Node node)
    {
        super (message);
        this.node = node;
    }

    public MathMLException (String message, Node node, Throwable cause)
    {
        super (message, cause);
        this.node = node;
    }
}
