/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Node;

/**
    An operator received the wrong number of operands.
**/
@SuppressWarnings("serial")
public class ArityException extends MathMLException
{
    public final int    expected;  // exact count, or the minimum if atLeast is set
    public final int    actual;
    public final String context;   // tag of the operator
    public final boolean atLeast;

    public ArityException (int expected, int actual, String context, Node node)
    {
        super ("Expecting " + expected + " operand(s), got " + actual + " for " + context + ".", node);
        this.expected = expected;
        this.actual   = actual;
        this.context  = context;
        this.atLeast  = false;
    }

    /**
        For operators that take any number of operands above some minimum.
    **/
    public static ArityException atLeast (int minimum, int actual, String context, Node node)
    {
        return new ArityException (minimum, actual, context, node, minimum == 1 ? "one operand" : "two operands");
    }

    protected ArityException (int minimum, int actual, String context, Node node, String what)
    {
        super ("Operator <" + context + "> needs at least " + what + ", got " + actual + ".", node);
        this.expected = minimum;
        this.actual   = actual;
        this.context  = context;
        this.atLeast  = true;
    }
}
