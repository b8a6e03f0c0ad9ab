/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Element;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.Function;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.OperatorUnary;
import gov.sandia.ephys.language.PartialDerivative;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Log10;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.Power;

/**
    Presentation MathML: layout only. Rows of identifiers and operators, with fractions,
    superscripts and fenced groups where the precedence rules call for them.
**/
class PresentationBuilder extends MathMLBuilder
{
    public PresentationBuilder (RendererMathML renderer)
    {
        super (renderer);
    }

    /**
        Renders an operand, wrapped in a fenced group if its parent needs it enclosed.
    **/
    protected Element operand (Operator parent, Operator child)
    {
        Element result = child.render (renderer);
        if (! parent.bracket (child)) return result;
        Element fenced = renderer.element ("mfenced");
        fenced.appendChild (result);
        return fenced;
    }

    protected Element fenced (Operator... operands)
    {
        Element result = renderer.element ("mfenced");
        for (Operator o : operands) result.appendChild (o.render (renderer));
        return result;
    }

    public Element name (AccessVariable op)
    {
        return renderer.element ("mi", renderer.name (op));
    }

    public Element number (Constant op)
    {
        double value = op.value;
        if (Double.isNaN (value)) return renderer.element ("mi", "NaN");
        if (Double.isInfinite (value)) return renderer.element ("mn", value < 0 ? "-∞" : "∞");
        return renderer.element ("mn", renderer.numberText (op));
    }

    public Element derivative (Derivative op)
    {
        return fraction ("d", renderer.name (op.operand), renderer.timeVariable);
    }

    public Element partial (PartialDerivative op)
    {
        return fraction ("∂", renderer.name (op.dependent), renderer.name (op.independent));
    }

    protected Element fraction (String d, String top, String bottom)
    {
        Element result = renderer.element ("mfrac");
        Element row = renderer.child (result, "mrow");
        renderer.child (row, "mo", d);
        renderer.child (row, "mi", top);
        row = renderer.child (result, "mrow");
        renderer.child (row, "mo", d);
        renderer.child (row, "mi", bottom);
        return result;
    }

    public Element prefix (OperatorUnary op, String tag, String symbol)
    {
        Element result = renderer.element ("mrow");
        renderer.child (result, "mo", symbol);
        result.appendChild (operand (op, op.operand));
        return result;
    }

    public Element infix (OperatorBinary op, String tag, String symbol)
    {
        Element result = renderer.element ("mrow");
        result.appendChild (operand (op, op.operand0));
        renderer.child (result, "mo", symbol);
        result.appendChild (operand (op, op.operand1));
        return result;
    }

    // The fraction bar groups both parts, so neither needs fences.
    public Element divide (Divide op)
    {
        Element result = renderer.element ("mfrac");
        result.appendChild (op.operand0.render (renderer));
        result.appendChild (op.operand1.render (renderer));
        return result;
    }

    public Element power (Power op)
    {
        Element result = renderer.element ("msup");
        Element base = operand (op, op.operand0);
        if (XMLutility.localName (base).equals ("mn")  &&  XMLutility.getText (base).startsWith ("-"))  // so a negative base doesn't read as -(2^2)
        {
            Element fenced = renderer.element ("mfenced");
            fenced.appendChild (base);
            base = fenced;
        }
        result.appendChild (base);
        result.appendChild (op.operand1.render (renderer));
        return result;
    }

    public Element function (Function op, String tag, String symbol)
    {
        Operator[] operands = new Operator[op.getOperandCount ()];
        for (int i = 0; i < operands.length; i++) operands[i] = op.getOperand (i);
        Element result = renderer.element ("mrow");
        renderer.child (result, "mi", symbol);
        result.appendChild (fenced (operands));
        return result;
    }

    public Element delimited (Function op, String tag, String open, String close)
    {
        Element result = renderer.element ("mrow");
        renderer.child (result, "mo", open);
        result.appendChild (op.getOperand (0).render (renderer));
        renderer.child (result, "mo", close);
        return result;
    }

    public Element sqrt (SquareRoot op)
    {
        Element result = renderer.element ("msqrt");
        result.appendChild (op.getOperand (0).render (renderer));
        return result;
    }

    public Element exp (Exp op)
    {
        Element result = renderer.element ("msup");
        renderer.child (result, "mi", "e");
        result.appendChild (op.getOperand (0).render (renderer));
        return result;
    }

    public Element log (Log op)
    {
        Element result = renderer.element ("mrow");
        if (op.hasBase ())
        {
            Element sub = renderer.child (result, "msub");
            renderer.child (sub, "mi", "log");
            sub.appendChild (op.getBase ().render (renderer));
        }
        else
        {
            renderer.child (result, "mi", "ln");
        }
        result.appendChild (fenced (op.getOperand (0)));
        return result;
    }

    public Element log10 (Log10 op)
    {
        Element result = renderer.element ("mrow");
        Element sub = renderer.child (result, "msub");
        renderer.child (sub, "mi", "log");
        renderer.child (sub, "mn", "10");
        result.appendChild (fenced (op.getOperand (0)));
        return result;
    }

    /**
        A brace followed by a table with one row per case: value, then "if" and the condition.
    **/
    public Element piecewise (Piecewise op)
    {
        Element result = renderer.element ("mrow");
        renderer.child (result, "mo", "{");
        Element table = renderer.child (result, "mtable");
        int count = op.conditionCount ();
        for (int i = 0; i < count; i++)
        {
            Element row = renderer.child (table, "mtr");
            renderer.child (row, "mtd").appendChild (op.value (i).render (renderer));
            renderer.child (renderer.child (row, "mtd"), "mtext", "if");
            renderer.child (row, "mtd").appendChild (op.condition (i).render (renderer));
        }
        Element row = renderer.child (table, "mtr");
        renderer.child (row, "mtd").appendChild (op.otherwise ().render (renderer));
        renderer.child (renderer.child (row, "mtd"), "mtext", "otherwise");
        return result;
    }

    public Element equation (Element lhs, Element rhs)
    {
        Element result = renderer.element ("mrow");
        result.appendChild (lhs);
        renderer.child (result, "mo", "=");
        result.appendChild (rhs);
        return result;
    }
}
