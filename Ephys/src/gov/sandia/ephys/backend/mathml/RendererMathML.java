/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.Equation;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.PartialDerivative;
import gov.sandia.ephys.language.Renderer;
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
    Renders expressions as MathML 2 element trees, either Content MathML (the default) or
    Presentation MathML. Both modes go through the same dispatch below. Each overload hands
    the node to a builder, which produces the elements for the selected mode.

    <p>Use one of the write() methods. Each call renders through a private working copy bound
    to the target document, so a configured instance may serve several threads.
    The initial-value form of a variable has no MathML counterpart and is rejected.
**/
public class RendererMathML extends Renderer<Element>
{
    public static final String NS = "http://www.w3.org/1998/Math/MathML";

    protected boolean presentation;
    protected String  timeVariable = "time";

    // Only set on the working copy used during a single write.
    protected Document      doc;
    protected MathMLBuilder builder;

    public RendererMathML ()
    {
    }

    public RendererMathML (boolean presentation)
    {
        this.presentation = presentation;
    }

    protected RendererMathML (RendererMathML config, Document doc)
    {
        nameFunction      = config.nameFunction;
        numberFormat      = config.numberFormat;
        conditionFunction = config.conditionFunction;
        presentation      = config.presentation;
        timeVariable      = config.timeVariable;
        this.doc          = doc;
        if (presentation) builder = new PresentationBuilder (this);
        else              builder = new ContentBuilder (this);
    }

    public void setPresentation (boolean presentation)
    {
        this.presentation = presentation;
    }

    public boolean getPresentation ()
    {
        return presentation;
    }

    /**
        Name of the variable that derivatives are taken with respect to.
    **/
    public void setTimeVariable (String timeVariable)
    {
        if (timeVariable == null  ||  timeVariable.isEmpty ()) timeVariable = "time";
        this.timeVariable = timeVariable;
    }

    public String getTimeVariable ()
    {
        return timeVariable;
    }

    /**
        Renders the expression inside a new math element, which belongs to a new document.
    **/
    public Element write (Operator op)
    {
        RendererMathML work = new RendererMathML (this, XMLutility.newDocument ());
        Element math = work.element ("math");
        work.doc.appendChild (math);
        math.appendChild (op.render (work));
        return math;
    }

    /**
        Renders the expression and appends it to the given element.
    **/
    public void write (Operator op, Element parent)
    {
        RendererMathML work = new RendererMathML (this, parent.getOwnerDocument ());
        parent.appendChild (op.render (work));
    }

    public Element write (Equation e)
    {
        RendererMathML work = new RendererMathML (this, XMLutility.newDocument ());
        Element math = work.element ("math");
        work.doc.appendChild (math);
        math.appendChild (work.equation (e));
        return math;
    }

    public void write (Equation e, Element parent)
    {
        RendererMathML work = new RendererMathML (this, parent.getOwnerDocument ());
        parent.appendChild (work.equation (e));
    }

    /**
        Convenience for callers that want text rather than a tree.
    **/
    public String writeString (Operator op)
    {
        return XMLutility.toString (write (op));
    }

    public String writeString (Equation e)
    {
        return XMLutility.toString (write (e));
    }

    protected Element equation (Equation e)
    {
        return builder ().equation (e.lhs.render (this), e.rhs.render (this));
    }

    protected MathMLBuilder builder ()
    {
        if (builder == null) throw new IllegalStateException ("MathML rendering must go through write()");
        return builder;
    }

    // Element construction, used by the builders

    public Element element (String tag)
    {
        return doc.createElementNS (NS, tag);
    }

    public Element element (String tag, String text)
    {
        Element result = element (tag);
        result.setTextContent (text);
        return result;
    }

    public Element child (Element parent, String tag)
    {
        Element result = element (tag);
        parent.appendChild (result);
        return result;
    }

    public Element child (Element parent, String tag, String text)
    {
        Element result = element (tag, text);
        parent.appendChild (result);
        return result;
    }

    /**
        Text of a numeric literal, before any mode-specific encoding.
    **/
    public String numberText (Constant c)
    {
        if (numberFormat != null) return numberFormat.format (c);
        return Constant.print (c.value);
    }

    // Dispatch

    public Element render (AccessVariable op)    {return builder ().name (op);}
    public Element render (Derivative op)        {return builder ().derivative (op);}
    public Element render (PartialDerivative op) {return builder ().partial (op);}
    public Element render (Constant op)          {return builder ().number (op);}

    public Element render (UnaryPlus op) {return builder ().prefix (op, "plus",  "+");}
    public Element render (Negate op)    {return builder ().prefix (op, "minus", "-");}
    public Element render (NOT op)       {return builder ().prefix (op, "not",   "¬");}

    public Element render (Add op)      {return builder ().infix (op, "plus",     "+");}
    public Element render (Subtract op) {return builder ().infix (op, "minus",    "-");}
    public Element render (Multiply op) {return builder ().infix (op, "times",    "·");}
    public Element render (Quotient op) {return builder ().infix (op, "quotient", "//");}
    public Element render (Modulo op)   {return builder ().infix (op, "rem",      "%");}
    public Element render (Divide op)   {return builder ().divide (op);}
    public Element render (Power op)    {return builder ().power (op);}

    public Element render (EQ op)  {return builder ().infix (op, "eq",  "=");}
    public Element render (NE op)  {return builder ().infix (op, "neq", "≠");}
    public Element render (GT op)  {return builder ().infix (op, "gt",  ">");}
    public Element render (LT op)  {return builder ().infix (op, "lt",  "<");}
    public Element render (GE op)  {return builder ().infix (op, "geq", "≥");}
    public Element render (LE op)  {return builder ().infix (op, "leq", "≤");}
    public Element render (AND op) {return builder ().infix (op, "and", "∧");}
    public Element render (OR op)  {return builder ().infix (op, "or",  "∨");}

    public Element render (SquareRoot op) {return builder ().sqrt (op);}
    public Element render (Exp op)        {return builder ().exp (op);}
    public Element render (Log op)        {return builder ().log (op);}
    public Element render (Log10 op)      {return builder ().log10 (op);}
    public Element render (Sine op)       {return builder ().function (op, "sin",    "sin");}
    public Element render (Cosine op)     {return builder ().function (op, "cos",    "cos");}
    public Element render (Tangent op)    {return builder ().function (op, "tan",    "tan");}
    public Element render (Asin op)       {return builder ().function (op, "arcsin", "arcsin");}
    public Element render (Acos op)       {return builder ().function (op, "arccos", "arccos");}
    public Element render (Atan op)       {return builder ().function (op, "arctan", "arctan");}

    public Element render (Floor op)         {return builder ().delimited (op, "floor",   "⌊", "⌋");}
    public Element render (Ceil op)          {return builder ().delimited (op, "ceiling", "⌈", "⌉");}
    public Element render (AbsoluteValue op) {return builder ().delimited (op, "abs",     "|", "|");}

    public Element render (If op)        {return builder ().piecewise (op.piecewise ());}
    public Element render (Piecewise op) {return builder ().piecewise (op);}
}
