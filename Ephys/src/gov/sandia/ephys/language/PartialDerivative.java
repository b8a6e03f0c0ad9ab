/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Partial derivative of one variable with respect to another.
**/
public class PartialDerivative extends OperatorLHS
{
    public final AccessVariable dependent;
    public final AccessVariable independent;

    public PartialDerivative (Operator dependent, Operator independent)
    {
        this.dependent   = checkVariable (dependent,   "Partial derivative numerator");
        this.independent = checkVariable (independent, "Partial derivative denominator");
    }

    public AccessVariable getVariable ()
    {
        return dependent;
    }

    public int precedence ()
    {
        return FUNCTION;
    }

    public int getOperandCount ()
    {
        return 2;
    }

    public Operator getOperand (int index)
    {
        if (index == 0) return dependent;
        if (index == 1) return independent;
        return super.getOperand (index);
    }

    public boolean bracket (Operator op)
    {
        if (! dependent.equals (op)  &&  ! independent.equals (op)) throw notAnOperand (op);
        return false;
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof PartialDerivative)) return false;
        PartialDerivative p = (PartialDerivative) that;
        return dependent.equals (p.dependent)  &&  independent.equals (p.independent);
    }

    public int hashCode ()
    {
        return (19 + dependent.hashCode ()) * 31 + independent.hashCode ();
    }

    public String toString ()
    {
        return "diff(" + dependent + ", " + independent + ")";
    }
}
