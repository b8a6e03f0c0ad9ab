/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Time derivative of a state variable.
**/
public class Derivative extends OperatorLHS
{
    public final AccessVariable operand;

    public Derivative (Operator operand)
    {
        this.operand = checkVariable (operand, "Derivative operand");
    }

    public AccessVariable getVariable ()
    {
        return operand;
    }

    public int precedence ()
    {
        return FUNCTION;
    }

    public int getOperandCount ()
    {
        return 1;
    }

    public Operator getOperand (int index)
    {
        if (index == 0) return operand;
        return super.getOperand (index);
    }

    public boolean bracket (Operator op)
    {
        if (! operand.equals (op)) throw notAnOperand (op);
        return false;
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Derivative)) return false;
        return operand.equals (((Derivative) that).operand);
    }

    public int hashCode ()
    {
        return 17 + operand.hashCode ();
    }

    public String toString ()
    {
        return "dot(" + operand + ")";
    }
}
