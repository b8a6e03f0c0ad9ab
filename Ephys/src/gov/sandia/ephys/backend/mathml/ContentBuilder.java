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
import gov.sandia.ephys.language.Units;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Log10;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.Power;

/**
    Content MathML: one apply element per operator, with the operator tag first and the operands after it.
**/
class ContentBuilder extends MathMLBuilder
{
    public ContentBuilder (RendererMathML renderer)
    {
        super (renderer);
    }

    protected Element apply (String tag, Operator... operands)
    {
        Element result = renderer.element ("apply");
        renderer.child (result, tag);
        for (Operator o : operands) result.appendChild (o.render (renderer));
        return result;
    }

    public Element name (AccessVariable op)
    {
        return renderer.element ("ci", renderer.name (op));
    }

    public Element number (Constant op)
    {
        double value = op.value;
        Element result;
        if (Double.isNaN (value))
        {
            result = renderer.element ("notanumber");
        }
        else if (Double.isInfinite (value))
        {
            result = renderer.element ("infinity");
            if (value < 0)
            {
                Element minus = renderer.element ("apply");
                renderer.child (minus, "minus");
                minus.appendChild (result);
                result = minus;
            }
        }
        else
        {
            result = renderer.element ("cn");
            String text = renderer.numberText (op);
            int e = text.toLowerCase ().indexOf ('e');
            if (e < 0)
            {
                result.setTextContent (text);
            }
            else
            {
                String mantissa = text.substring (0, e);
                String exponent = text.substring (e + 1);
                if (exponent.startsWith ("+")) exponent = exponent.substring (1);
                result.setAttribute ("type", "e-notation");
                result.appendChild (renderer.doc.createTextNode (mantissa));
                renderer.child (result, "sep");
                result.appendChild (renderer.doc.createTextNode (exponent));
            }
            if (! op.isDimensionless ()) result.setAttribute ("units", Units.format (op.unit));
        }
        return result;
    }

    public Element derivative (Derivative op)
    {
        Element result = renderer.element ("apply");
        renderer.child (result, "diff");
        Element bvar = renderer.child (result, "bvar");
        renderer.child (bvar, "ci", renderer.timeVariable);
        result.appendChild (op.operand.render (renderer));
        return result;
    }

    public Element partial (PartialDerivative op)
    {
        Element result = renderer.element ("apply");
        renderer.child (result, "partialdiff");
        Element bvar = renderer.child (result, "bvar");
        bvar.appendChild (op.independent.render (renderer));
        result.appendChild (op.dependent.render (renderer));
        return result;
    }

    public Element prefix (OperatorUnary op, String tag, String symbol)
    {
        return apply (tag, op.operand);
    }

    public Element infix (OperatorBinary op, String tag, String symbol)
    {
        return apply (tag, op.operand0, op.operand1);
    }

    public Element divide (Divide op)
    {
        return apply ("divide", op.operand0, op.operand1);
    }

    public Element power (Power op)
    {
        return apply ("power", op.operand0, op.operand1);
    }

    public Element function (Function op, String tag, String symbol)
    {
        Operator[] operands = new Operator[op.getOperandCount ()];
        for (int i = 0; i < operands.length; i++) operands[i] = op.getOperand (i);
        return apply (tag, operands);
    }

    public Element delimited (Function op, String tag, String open, String close)
    {
        return apply (tag, op.getOperand (0));
    }

    public Element sqrt (SquareRoot op)
    {
        return apply ("root", op.getOperand (0));
    }

    public Element exp (Exp op)
    {
        return apply ("exp", op.getOperand (0));
    }

    public Element log (Log op)
    {
        if (! op.hasBase ()) return apply ("ln", op.getOperand (0));
        return logarithm (op.getBase ().render (renderer), op.getOperand (0));
    }

    /**
        Always states the base. A bare log element is read back as the natural log.
    **/
    public Element log10 (Log10 op)
    {
        return logarithm (renderer.element ("cn", "10"), op.getOperand (0));
    }

    protected Element logarithm (Element base, Operator operand)
    {
        Element result = renderer.element ("apply");
        renderer.child (result, "log");
        Element logbase = renderer.child (result, "logbase");
        logbase.appendChild (base);
        result.appendChild (operand.render (renderer));
        return result;
    }

    public Element piecewise (Piecewise op)
    {
        Element result = renderer.element ("piecewise");
        int count = op.conditionCount ();
        for (int i = 0; i < count; i++)
        {
            Element piece = renderer.child (result, "piece");
            piece.appendChild (op.value (i).render (renderer));
            piece.appendChild (op.condition (i).render (renderer));
        }
        Element otherwise = renderer.child (result, "otherwise");
        otherwise.appendChild (op.otherwise ().render (renderer));
        return result;
    }

    public Element equation (Element lhs, Element rhs)
    {
        Element result = renderer.element ("apply");
        renderer.child (result, "eq");
        result.appendChild (lhs);
        result.appendChild (rhs);
        return result;
    }
}
