/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    The value a state variable takes at the start of simulation.
**/
public class InitialValue extends OperatorLHS
{
    public final AccessVariable operand;

    public InitialValue (Operator operand)
    {
        this.operand = checkVariable (operand, "Initial value operand");
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
        if (! (that instanceof InitialValue)) return false;
        return operand.equals (((InitialValue) that).operand);
    }

    public int hashCode ()
    {
        return 23 + operand.hashCode ();
    }

    public String toString ()
    {
        return "init(" + operand + ")";
    }
}
