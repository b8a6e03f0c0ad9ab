/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language.operator;

import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.Renderer;

/**
    Exponentiation. Evaluates left to right like every other binary operator here,
    even though several target languages give their own power operator the opposite direction.
**/
public class Power extends OperatorBinary
{
    public Power (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public int precedence ()
    {
        return POWER;
    }

    /**
        A base of equal precedence (that is, another power) is always enclosed,
        so the written form keeps its meaning under either associativity.
    **/
    protected boolean bracketLeft (Operator op)
    {
        return op.precedence () >= precedence ();
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public String toString ()
    {
        return "^";
    }
}
