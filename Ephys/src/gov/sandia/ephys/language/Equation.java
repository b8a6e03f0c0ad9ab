/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    A single model equation, lhs = rhs.
**/
public class Equation
{
    public final OperatorLHS lhs;
    public final Operator    rhs;

    public Equation (OperatorLHS lhs, Operator rhs)
    {
        if (lhs == null  ||  rhs == null) throw new IllegalArgumentException ("An equation needs both sides");
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Equation)) return false;
        Equation e = (Equation) that;
        return lhs.equals (e.lhs)  &&  rhs.equals (e.rhs);
    }

    public int hashCode ()
    {
        return lhs.hashCode () * 31 + rhs.hashCode ();
    }

    public String toString ()
    {
        return lhs + " = " + rhs;
    }
}
