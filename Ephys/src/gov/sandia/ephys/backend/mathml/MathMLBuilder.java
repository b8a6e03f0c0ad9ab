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
    Produces the elements for one MathML mode. Each method receives the node and returns
    a detached element. Operands are rendered by calling back into the renderer.
    The content tag and the presentation symbol are both passed in, and each mode uses the one it needs.
**/
abstract class MathMLBuilder
{
    protected final RendererMathML renderer;

    protected MathMLBuilder (RendererMathML renderer)
    {
        this.renderer = renderer;
    }

    public abstract Element name       (AccessVariable op);
    public abstract Element number     (Constant op);
    public abstract Element derivative (Derivative op);
    public abstract Element partial    (PartialDerivative op);
    public abstract Element prefix     (OperatorUnary op,  String tag, String symbol);
    public abstract Element infix      (OperatorBinary op, String tag, String symbol);
    public abstract Element divide     (Divide op);
    public abstract Element power      (Power op);
    public abstract Element function   (Function op, String tag, String symbol);
    public abstract Element delimited  (Function op, String tag, String open, String close);
    public abstract Element sqrt       (SquareRoot op);
    public abstract Element exp        (Exp op);
    public abstract Element log        (Log op);
    public abstract Element log10      (Log10 op);
    public abstract Element piecewise  (Piecewise op);
    public abstract Element equation   (Element lhs, Element rhs);
}
