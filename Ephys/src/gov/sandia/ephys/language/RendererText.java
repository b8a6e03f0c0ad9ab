/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import gov.sandia.ephys.language.operator.Power;

/**
    Base for renderers whose output is flat program or markup text.
    Holds the patterns shared by every text target, each steered by the precedence oracle.
**/
public abstract class RendererText extends Renderer<String>
{
    public String write (Operator op)
    {
        return op.render (this);
    }

    public String write (Equation e)
    {
        return write (e.lhs) + " = " + write (e.rhs);
    }

    /**
        Renders an operand of the given parent, enclosing it in parentheses if the oracle says so.
    **/
    public String operand (Operator parent, Operator child)
    {
        String result = child.render (this);
        if (enclose (parent, child, result)) return "(" + result + ")";
        return result;
    }

    /**
        The oracle's answer, plus one case it can't see: a power base whose text begins with a sign,
        such as a negative number. Unary minus binds more loosely than exponentiation in the target
        languages, so -2^2 would read as -(2^2).
    **/
    public boolean enclose (Operator parent, Operator child, String text)
    {
        if (parent.bracket (child)) return true;
        return  parent instanceof Power  &&  text.startsWith ("-")  &&  child == ((Power) parent).operand0;
    }

    public String infix (OperatorBinary op, String middle)
    {
        return operand (op, op.operand0) + " " + middle + " " + operand (op, op.operand1);
    }

    /**
        A sign or negation. The result is enclosed as a whole, so "-" never runs into
        another sign, such as in "x - -y" or "--y".
    **/
    public String prefix (OperatorUnary op, String symbol)
    {
        String operand = operand (op, op.operand);
        if (operand.startsWith ("-")  ||  operand.startsWith ("+")) operand = "(" + operand + ")";
        return "(" + symbol + operand + ")";
    }

    /**
        A comparison or logical connective. These always carry their own parentheses,
        so the result can be dropped into any context.
    **/
    public String condition (OperatorBinary op, String middle)
    {
        return "(" + op.operand0.render (this) + " " + middle + " " + op.operand1.render (this) + ")";
    }

    public String function (String name, Operator... operands)
    {
        StringBuilder result = new StringBuilder ();
        result.append (name);
        result.append ("(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) result.append (", ");
            result.append (operands[i].render (this));
        }
        result.append (")");
        return result.toString ();
    }

    public String render (AccessVariable op)    {return name (op);}
    public String render (Derivative op)        {return name (op);}
    public String render (PartialDerivative op) {return name (op);}
    public String render (InitialValue op)      {return name (op);}

    /**
        Applies the number formatter if one is configured, otherwise the backend's own formatting.
    **/
    public String render (Constant op)
    {
        if (numberFormat != null) return numberFormat.format (op);
        return print (op.value);
    }

    /**
        The backend's own text for a bare double. Override to spell special values the target's way.
    **/
    public String print (double value)
    {
        return Constant.print (value);
    }
}
