/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import java.util.Arrays;

/**
    A named function applied to a fixed list of positional operands.
    Functions carry their own grouping, so they never ask for operands to be bracketed.
**/
public abstract class Function extends Operator
{
    protected final Operator[] operands;  // always non-null

    protected Function (Operator... operands)
    {
        if (operands == null) throw new IllegalArgumentException (getClass ().getSimpleName () + " requires operands");
        for (Operator o : operands)
        {
            if (o == null) throw new IllegalArgumentException (getClass ().getSimpleName () + " does not accept a null operand");
        }
        this.operands = operands.clone ();
    }

    /**
        Checks the operand count during construction. Subclasses with a fixed arity call this from their constructor.
    **/
    protected void checkArity (int expected)
    {
        if (operands.length != expected)
        {
            throw new IllegalArgumentException (getClass ().getSimpleName () + " expects " + expected + " operand(s), got " + operands.length);
        }
    }

    /**
        The name by which this function is usually known in program text.
    **/
    public abstract String name ();

    public int precedence ()
    {
        return FUNCTION;
    }

    public int getOperandCount ()
    {
        return operands.length;
    }

    public Operator getOperand (int index)
    {
        if (index < 0  ||  index >= operands.length) return super.getOperand (index);
        return operands[index];
    }

    public boolean bracket (Operator op)
    {
        for (Operator o : operands) if (o == op) return false;
        for (Operator o : operands) if (o.equals (op)) return false;
        throw notAnOperand (op);
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        return Arrays.equals (operands, ((Function) that).operands);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () * 31 + Arrays.hashCode (operands);
    }

    public String toString ()
    {
        return name ();
    }
}
