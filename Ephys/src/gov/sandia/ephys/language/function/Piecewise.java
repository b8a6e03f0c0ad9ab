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
    Multi-way conditional. Operands alternate condition, value, condition, value, ...
    and end with the value used when no condition holds. The first true condition wins.
**/
public class Piecewise extends Function
{
    public Piecewise (Operator... operands)
    {
        super (operands);
        if (this.operands.length < 3  ||  this.operands.length % 2 == 0)
        {
            throw new IllegalArgumentException ("Piecewise expects an odd number of operands, at least 3, got " + this.operands.length);
        }
    }

    public int conditionCount ()
    {
        return operands.length / 2;
    }

    public Operator condition (int i)
    {
        if (i < 0  ||  i >= conditionCount ()) throw new IndexOutOfBoundsException ("No condition " + i);
        return operands[2 * i];
    }

    public Operator value (int i)
    {
        if (i < 0  ||  i >= conditionCount ()) throw new IndexOutOfBoundsException ("No value " + i);
        return operands[2 * i + 1];
    }

    public Operator otherwise ()
    {
        return operands[operands.length - 1];
    }

    public String name ()
    {
        return "piecewise";
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }
}
