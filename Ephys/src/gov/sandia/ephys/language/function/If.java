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
    Two-way conditional: if condition then value else otherwise.
**/
public class If extends Function
{
    public If (Operator condition, Operator value, Operator otherwise)
    {
        super (condition, value, otherwise);
    }

    public Operator condition ()
    {
        return operands[0];
    }

    public Operator value ()
    {
        return operands[1];
    }

    public Operator otherwise ()
    {
        return operands[2];
    }

    /**
        @return The same conditional expressed as a piecewise with a single condition.
    **/
    public Piecewise piecewise ()
    {
        return new Piecewise (operands[0], operands[1], operands[2]);
    }

    public String name ()
    {
        return "if";
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }
}
