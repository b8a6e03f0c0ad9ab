/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language.function;

import gov.sandia.ephys.language.Function;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.Renderer;

/**
    Logarithm. With one operand this is the natural log. A second operand gives the base.
**/
public class Log extends Function
{
    public Log (Operator operand)
    {
        super (operand);
    }

    public Log (Operator operand, Operator base)
    {
        super (operand, base);
    }

    public boolean hasBase ()
    {
        return operands.length == 2;
    }

    /**
        @return The base operand, or null for the natural log.
    **/
    public Operator getBase ()
    {
        if (operands.length < 2) return null;
        return operands[1];
    }

    public String name ()
    {
        return "log";
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }
}
