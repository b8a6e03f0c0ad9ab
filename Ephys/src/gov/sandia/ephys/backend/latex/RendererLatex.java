/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.latex;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.InitialValue;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.OperatorLHS;
import gov.sandia.ephys.language.OperatorUnary;
import gov.sandia.ephys.language.PartialDerivative;
import gov.sandia.ephys.language.RendererText;
import gov.sandia.ephys.language.Units;
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
    Renders expressions as LaTeX math markup, for reading rather than execution.
    Conditionals have no mathematical notation here, so they appear as \text{if}(...) and
    \text{piecewise}(...) calls.
**/
public class RendererLatex extends RendererText
{
    protected String timeVariable = "t";

    public RendererLatex ()
    {
        nameFunction = this::latexName;
    }

    /**
        Sets the naming function. Passing null restores the built-in naming, which sets names in
        upright text and writes derivatives as fractions.
    **/
    public void setNameFunction (NameFunction nameFunction)
    {
        if (nameFunction == null) this.nameFunction = this::latexName;
        else                      this.nameFunction = nameFunction;
    }

    /**
        Name of the time variable, used when the built-in naming writes a derivative or initial value.
    **/
    public void setTimeVariable (String timeVariable)
    {
        if (timeVariable == null  ||  timeVariable.isEmpty ()) timeVariable = "t";
        this.timeVariable = timeVariable;
    }

    public String getTimeVariable ()
    {
        return timeVariable;
    }

    public static String escape (String text)
    {
        return text.replace ("_", "\\_");
    }

    public static String text (String name)
    {
        return "\\text{" + escape (name) + "}";
    }

    public String latexName (OperatorLHS lhs)
    {
        String v = text (lhs.getVariable ().name);
        if (lhs instanceof AccessVariable) return v;
        String t = text (timeVariable);
        if (lhs instanceof Derivative)   return "\\frac{d" + v + "}{d" + t + "}";
        if (lhs instanceof InitialValue) return v + "(" + t + " = 0)";
        if (lhs instanceof PartialDerivative)
        {
            return "\\frac{\\partial" + v + "}{\\partial" + text (((PartialDerivative) lhs).independent.name) + "}";
        }
        throw unsupported (lhs);
    }

    public String operand (Operator parent, Operator child)
    {
        String result = child.render (this);
        if (enclose (parent, child, result)) return "\\left(" + result + "\\right)";
        return result;
    }

    public String prefix (OperatorUnary op, String symbol)
    {
        String operand = operand (op, op.operand);
        if (operand.startsWith ("-")  ||  operand.startsWith ("+")) operand = "\\left(" + operand + "\\right)";
        return symbol + operand;
    }

    public String condition (OperatorBinary op, String middle)
    {
        return "\\left(" + op.operand0.render (this) + " " + middle + " " + op.operand1.render (this) + "\\right)";
    }

    public String function (String name, Operator... operands)
    {
        StringBuilder result = new StringBuilder ();
        result.append (name);
        result.append ("\\left(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) result.append (", ");
            result.append (operands[i].render (this));
        }
        result.append ("\\right)");
        return result.toString ();
    }

    public String render (Constant op)
    {
        String result = super.render (op);
        if (! op.isDimensionless ()) result += " \\text{" + Units.format (op.unit) + "}";
        return result;
    }

    public String print (double d)
    {
        if (Double.isNaN (d)) return "\\text{NaN}";
        if (Double.isInfinite (d)) return d < 0 ? "-\\infty" : "\\infty";
        return Constant.print (d);
    }

    public String render (UnaryPlus op) {return prefix (op, "+");}
    public String render (Negate op)    {return prefix (op, "-");}
    public String render (Add op)       {return infix (op, "+");}
    public String render (Subtract op)  {return infix (op, "-");}
    public String render (Multiply op)  {return infix (op, "\\cdot");}
    public String render (Modulo op)    {return infix (op, "\\bmod");}

    public String render (Divide op)
    {
        return "\\frac{" + op.operand0.render (this) + "}{" + op.operand1.render (this) + "}";
    }

    public String render (Quotient op)
    {
        return "\\left\\lfloor\\frac{" + op.operand0.render (this) + "}{" + op.operand1.render (this) + "}\\right\\rfloor";
    }

    public String render (Power op)
    {
        // The exponent is set as a superscript group, so it never needs parentheses of its own.
        return operand (op, op.operand0) + "^{" + op.operand1.render (this) + "}";
    }

    public String render (EQ op)  {return condition (op, "=");}
    public String render (NE op)  {return condition (op, "\\neq");}
    public String render (GT op)  {return condition (op, ">");}
    public String render (LT op)  {return condition (op, "<");}
    public String render (GE op)  {return condition (op, "\\geq");}
    public String render (LE op)  {return condition (op, "\\leq");}
    public String render (AND op) {return condition (op, "\\and");}
    public String render (OR op)  {return condition (op, "\\or");}

    public String render (NOT op)
    {
        return "\\left(\\not " + op.operand.render (this) + "\\right)";
    }

    public String render (SquareRoot op)
    {
        return "\\sqrt{" + op.getOperand (0).render (this) + "}";
    }

    public String render (Exp op)     {return function ("\\exp",    op.getOperand (0));}
    public String render (Sine op)    {return function ("\\sin",    op.getOperand (0));}
    public String render (Cosine op)  {return function ("\\cos",    op.getOperand (0));}
    public String render (Tangent op) {return function ("\\tan",    op.getOperand (0));}
    public String render (Asin op)    {return function ("\\arcsin", op.getOperand (0));}
    public String render (Acos op)    {return function ("\\arccos", op.getOperand (0));}
    public String render (Atan op)    {return function ("\\arctan", op.getOperand (0));}

    public String render (Log op)
    {
        if (op.hasBase ()) return function ("\\log_{" + op.getBase ().render (this) + "}", op.getOperand (0));
        return function ("\\log", op.getOperand (0));
    }

    public String render (Log10 op)
    {
        return function ("\\log_{10}", op.getOperand (0));
    }

    public String render (Floor op)
    {
        return "\\left\\lfloor{" + op.getOperand (0).render (this) + "}\\right\\rfloor";
    }

    public String render (Ceil op)
    {
        return "\\left\\lceil{" + op.getOperand (0).render (this) + "}\\right\\rceil";
    }

    public String render (AbsoluteValue op)
    {
        return "\\lvert{" + op.getOperand (0).render (this) + "}\\rvert";
    }

    public String render (If op)
    {
        return function ("\\text{if}", op.condition (), op.value (), op.otherwise ());
    }

    public String render (Piecewise op)
    {
        Operator[] operands = new Operator[op.getOperandCount ()];
        for (int i = 0; i < operands.length; i++) operands[i] = op.getOperand (i);
        return function ("\\text{piecewise}", operands);
    }
}
