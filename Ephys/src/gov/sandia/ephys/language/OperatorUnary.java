/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

public abstract class OperatorUnary extends Operator
{
    public final Operator operand;

    protected OperatorUnary (Operator operand)
    {
        if (operand == null) throw new IllegalArgumentException (getClass ().getSimpleName () + " requires an operand");
        this.operand = operand;
    }

    public int precedence ()
    {
        return PREFIX;
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
        if (op != operand  &&  ! operand.equals (op)) throw notAnOperand (op);
        return op.precedence () > precedence ();
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        return operand.equals (((OperatorUnary) that).operand);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () * 31 + operand.hashCode ();
    }
}
