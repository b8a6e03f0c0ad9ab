/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.python;

import gov.sandia.ephys.language.Operator;
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
    Renders expressions as Python using the standard math module.
    Also the shared base of the other scripting and numeric targets.

    <p>Python's "//" and "%" on floats already round toward negative infinity, so integer
    division and remainder map straight onto them. "**" groups right to left, while Power
    here groups left to right. The precedence rules always enclose a base that is itself
    a power, which keeps the two in agreement.
**/
public class RendererPython extends RendererText
{
    protected String functionPrefix = "math.";

    /**
        Qualified name of a library function.
    **/
    public String math (String name)
    {
        return functionPrefix + name;
    }

    public String print (double d)
    {
        if (Double.isNaN (d)) return math ("nan");
        if (Double.isInfinite (d)) return (d < 0 ? "-" : "") + math ("inf");
        return super.print (d);
    }

    public String render (UnaryPlus op) {return prefix (op, "+");}
    public String render (Negate op)    {return prefix (op, "-");}
    public String render (Add op)       {return infix (op, "+");}
    public String render (Subtract op)  {return infix (op, "-");}
    public String render (Multiply op)  {return infix (op, "*");}
    public String render (Divide op)    {return infix (op, "/");}
    public String render (Quotient op)  {return infix (op, "//");}
    public String render (Modulo op)    {return infix (op, "%");}
    public String render (Power op)     {return infix (op, "**");}

    public String render (EQ op) {return condition (op, "==");}
    public String render (NE op) {return condition (op, "!=");}
    public String render (GT op) {return condition (op, ">");}
    public String render (LT op) {return condition (op, "<");}
    public String render (GE op) {return condition (op, ">=");}
    public String render (LE op) {return condition (op, "<=");}

    public String render (AND op) {return condition (op, "and");}
    public String render (OR op)  {return condition (op, "or");}
    public String render (NOT op) {return negation (op, "not ");}

    /**
        Logical negation, enclosed as a whole so it can't capture a neighboring comparison.
    **/
    public String negation (NOT op, String symbol)
    {
        String operand;
        if (op.operand.isCondition ()) operand = op.operand.render (this);  // already enclosed
        else                           operand = operand (op, op.operand);
        return "(" + symbol + operand + ")";
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
    public String render (AbsoluteValue op) {return function ("abs",          op.getOperand (0));}

    public String render (Log op)
    {
        if (op.hasBase ()) return function (math ("log"), op.getOperand (0), op.getBase ());
        return function (math ("log"), op.getOperand (0));
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

    public String conditional (Operator condition, Operator value, String otherwise)
    {
        String c = condition.render (this);
        String v = value.render (this);
        if (conditionFunction != null) return conditionFunction + "(" + c + ", " + v + ", " + otherwise + ")";
        return "(" + v + " if " + c + " else " + otherwise + ")";
    }

    /**
        Logarithm in an arbitrary base, for targets whose log takes a single argument.
    **/
    public String changeOfBase (Log op)
    {
        String log = math ("log");
        return "(" + function (log, op.getOperand (0)) + " / " + function (log, op.getBase ()) + ")";
    }
}
