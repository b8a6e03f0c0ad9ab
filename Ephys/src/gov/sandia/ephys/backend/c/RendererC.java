/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.RendererText;
import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.Acos;
import gov.sandia.ephys.language.function.Asin;
import gov.sandia.ephys.language.function.Atan;
import gov.sandia.ephys.language.function.Ceil;
import gov.sandia.ephys.language.function.Cosine;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.function.Floor;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Log10;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.Sine;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.function.Tangent;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.EQ;
import gov.sandia.ephys.language.operator.GE;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.LE;
import gov.sandia.ephys.language.operator.LT;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.NE;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.OR;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;
import gov.sandia.ephys.language.operator.Subtract;
import gov.sandia.ephys.language.operator.UnaryPlus;

/**
    Renders expressions as ANSI C. Also the shared base of the other C-family targets,
    which change function names and condition handling through math() and truth().

    <p>C's "/" and "%" truncate toward zero, so integer division and remainder are built
    from floor() to get rounding toward negative infinity.
**/
public class RendererC extends RendererText
{
    protected final Precision precision;

    public RendererC ()
    {
        this (Precision.DOUBLE);
    }

    public RendererC (Precision precision)
    {
        if (precision == null) precision = Precision.DOUBLE;
        this.precision = precision;
    }

    public Precision getPrecision ()
    {
        return precision;
    }

    public boolean single ()
    {
        return precision == Precision.SINGLE;
    }

    /**
        Name of the math library function to call. Subclasses substitute precision-specific
        or native versions here.
    **/
    public String math (String name)
    {
        return name;
    }

    /**
        Renders an operand that is used as a truth value.
    **/
    public String truth (Operator op)
    {
        return op.render (this);
    }

    public String render (Constant op)
    {
        String result = super.render (op);
        if (single ()  &&  ! Double.isNaN (op.value)  &&  ! Double.isInfinite (op.value)) result += "f";  // Tell the compiler that our type is float, not double.
        return result;
    }

    public String print (double d)
    {
        if (Double.isNaN (d)) return "NAN";
        if (Double.isInfinite (d)) return (d < 0 ? "-" : "") + "INFINITY";
        return Constant.print (d);
    }

    public String render (UnaryPlus op) {return prefix (op, "+");}
    public String render (Negate op)    {return prefix (op, "-");}
    public String render (Add op)       {return infix (op, "+");}
    public String render (Subtract op)  {return infix (op, "-");}
    public String render (Multiply op)  {return infix (op, "*");}
    public String render (Divide op)    {return infix (op, "/");}

    public String render (Quotient op)
    {
        return new Floor (new Divide (op.operand0, op.operand1)).render (this);
    }

    public String render (Modulo op)
    {
        Operator a = op.operand0;
        Operator b = op.operand1;
        Operator synthesized = new Subtract (a, new Multiply (b, new Floor (new Divide (a, b))));
        return "(" + synthesized.render (this) + ")";
    }

    public String render (Power op)
    {
        return function (math ("pow"), op.operand0, op.operand1);
    }

    public String render (EQ op) {return comparison (op, "==");}
    public String render (NE op) {return comparison (op, "!=");}
    public String render (GT op) {return comparison (op, ">");}
    public String render (LT op) {return comparison (op, "<");}
    public String render (GE op) {return comparison (op, ">=");}
    public String render (LE op) {return comparison (op, "<=");}

    public String comparison (OperatorBinary op, String middle)
    {
        return condition (op, middle);
    }

    public String render (NOT op)
    {
        return "!(" + truth (op.operand) + ")";
    }

    public String render (AND op)
    {
        return "(" + truth (op.operand0) + " && " + truth (op.operand1) + ")";
    }

    public String render (OR op)
    {
        return "(" + truth (op.operand0) + " || " + truth (op.operand1) + ")";
    }

    public String render (SquareRoot op)    {return function (math ("sqrt"),  op.getOperand (0));}
    public String render (Exp op)           {return function (math ("exp"),   op.getOperand (0));}
    public String render (Log10 op)         {return function (math ("log10"), op.getOperand (0));}
    public String render (Sine op)          {return function (math ("sin"),   op.getOperand (0));}
    public String render (Cosine op)        {return function (math ("cos"),   op.getOperand (0));}
    public String render (Tangent op)       {return function (math ("tan"),   op.getOperand (0));}
    public String render (Asin op)          {return function (math ("asin"),  op.getOperand (0));}
    public String render (Acos op)          {return function (math ("acos"),  op.getOperand (0));}
    public String render (Atan op)          {return function (math ("atan"),  op.getOperand (0));}
    public String render (Floor op)         {return function (math ("floor"), op.getOperand (0));}
    public String render (Ceil op)          {return function (math ("ceil"),  op.getOperand (0));}
    public String render (AbsoluteValue op) {return function (math ("fabs"),  op.getOperand (0));}

    public String render (Log op)
    {
        if (! op.hasBase ()) return function (math ("log"), op.getOperand (0));
        // Change of base
        String log = math ("log");
        return "(" + function (log, op.getOperand (0)) + " / " + function (log, op.getBase ()) + ")";
    }

    public String render (If op)
    {
        return conditional (op.condition (), op.value (), op.otherwise ().render (this));
    }

    public String render (Piecewise op)
    {
        String result = op.otherwise ().render (this);
        for (int i = op.conditionCount () - 1; i >= 0; i--)
        {
            result = conditional (op.condition (i), op.value (i), result);
        }
        return result;
    }

    /**
        One level of a conditional chain, either as the inline ternary or as a call to the
        configured condition function.
    **/
    public String conditional (Operator condition, Operator value, String otherwise)
    {
        String c = truth (condition);
        String v = value.render (this);
        if (conditionFunction != null) return conditionFunction + "(" + c + ", " + v + ", " + otherwise + ")";
        return "(" + c + " ? " + v + " : " + otherwise + ")";
    }
}
