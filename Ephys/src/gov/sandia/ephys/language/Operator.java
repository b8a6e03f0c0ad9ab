/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Base class of the expression tree shared by the MathML importer and by every renderer.
    Nodes are built once, either by the importer or by calling code, and never change afterward.
    Equality is structural: two trees are equal if they have the same shape and the same leaves.
**/
public abstract class Operator
{
    // Precedence classes. Read a smaller number as "binds tighter", that is, "comes before".
    public static final int ATOMIC     = 0;  ///< names and numbers
    public static final int FUNCTION   = 1;  ///< function calls and derivatives, which carry their own grouping
    public static final int POWER      = 2;
    public static final int PREFIX     = 3;
    public static final int PRODUCT    = 4;
    public static final int SUM        = 5;
    public static final int COMPARISON = 6;
    public static final int LOGICAL    = 9;

    public enum Associativity
    {
        LEFT_TO_RIGHT,
        RIGHT_TO_LEFT
    }

    public Associativity associativity ()
    {
        return Associativity.LEFT_TO_RIGHT;
    }

    public int precedence ()
    {
        return ATOMIC;
    }

    public int getOperandCount ()
    {
        return 0;
    }

    public Operator getOperand (int index)
    {
        throw new IndexOutOfBoundsException (kind () + " has no operand " + index);
    }

    /**
        Decides whether the given operand must be enclosed in grouping symbols when this
        operator is written inline. This is the single precedence oracle used by every renderer.
        @param operand One of the direct operands of this node.
        @throws IllegalArgumentException if operand is not a direct operand of this node.
    **/
    public boolean bracket (Operator operand)
    {
        throw notAnOperand (operand);
    }

    /**
        Indicates that this node produces a truth value (comparison or logic) rather than a number.
    **/
    public boolean isCondition ()
    {
        return this instanceof OperatorLogical;
    }

    /**
        Double dispatch into the renderer. Each concrete node calls the overload for its own class.
    **/
    public abstract <T> T render (Renderer<T> renderer);

    /**
        Name of the node kind, for diagnostics.
    **/
    public String kind ()
    {
        return getClass ().getSimpleName ();
    }

    protected IllegalArgumentException notAnOperand (Operator operand)
    {
        return new IllegalArgumentException ("Given operand is not in this expression: " + operand + " in " + kind ());
    }
}
