/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

public abstract class OperatorBinary extends Operator
{
    public final Operator operand0;
    public final Operator operand1;

    protected OperatorBinary (Operator operand0, Operator operand1)
    {
        if (operand0 == null  ||  operand1 == null) throw new IllegalArgumentException (getClass ().getSimpleName () + " requires two operands");
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public int getOperandCount ()
    {
        return 2;
    }

    public Operator getOperand (int index)
    {
        if (index == 0) return operand0;
        if (index == 1) return operand1;
        return super.getOperand (index);
    }

    public boolean bracket (Operator op)
    {
        // Check identity first, so that x-x still tells left from right.
        if (op == operand0) return bracketLeft  (op);
        if (op == operand1) return bracketRight (op);
        if (op.equals (operand0)) return bracketLeft  (op);
        if (op.equals (operand1)) return bracketRight (op);
        throw notAnOperand (op);
    }

    protected boolean bracketLeft (Operator op)
    {
        return    precedence () < op.precedence ()   // read "<" as "comes before" rather than "less"
               ||    precedence () == op.precedence ()
                  && associativity () == Associativity.RIGHT_TO_LEFT;
    }

    protected boolean bracketRight (Operator op)
    {
        return    precedence () < op.precedence ()
               ||    precedence () == op.precedence ()
                  && associativity () == Associativity.LEFT_TO_RIGHT;
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return (getClass ().hashCode () * 31 + operand0.hashCode ()) * 31 + operand1.hashCode ();
    }
}
