/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Something that can stand on the left side of an equation: a variable reference,
    a time derivative, a partial derivative or an initial value. Renderers resolve these
    through their naming function.
**/
public abstract class OperatorLHS extends Operator
{
    /**
        The variable this node is about. For a partial derivative, the variable being differentiated.
    **/
    public abstract AccessVariable getVariable ();

    /**
        Requires that the given operand be a plain variable reference.
    **/
    protected static AccessVariable checkVariable (Operator op, String role)
    {
        if (op instanceof AccessVariable) return (AccessVariable) op;
        throw new IllegalArgumentException (role + " must be a variable reference, not " + (op == null ? "null" : op.kind ()));
    }
}
