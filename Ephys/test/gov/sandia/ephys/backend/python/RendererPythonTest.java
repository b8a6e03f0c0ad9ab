/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.python;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Evaluator;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.Asin;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.Sine;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.LT;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;

public class RendererPythonTest
{
    static AccessVariable a = new AccessVariable ("a");
    static AccessVariable b = new AccessVariable ("b");
    static AccessVariable c = new AccessVariable ("c");

    static Constant n (double value)
    {
        return new Constant (value);
    }

    static Operator ifPositive   = new If (new GT (a, n (0)), a, b);
    static Operator twoConditions = new Piecewise (new GT (a, n (0)), a, new LT (a, n (-1)), b, n (0));

    @Test
    public void python ()
    {
        RendererPython py = new RendererPython ();
        assertEquals ("a // b",             py.write (new Quotient (a, b)));
        assertEquals ("a % b",              py.write (new Modulo (a, b)));
        assertEquals ("a ** b",             py.write (new Power (a, b)));
        assertEquals ("(a ** b) ** c",      py.write (new Power (new Power (a, b), c)));
        assertEquals ("a ** (b ** c)",      py.write (new Power (a, new Power (b, c))));
        assertEquals ("(-a ** 2.0)",        py.write (new Negate (new Power (a, n (2)))));
        assertEquals ("math.nan",           py.write (n (Double.NaN)));
        assertEquals ("-math.inf",          py.write (n (Double.NEGATIVE_INFINITY)));
        assertEquals ("abs(a)",             py.write (new AbsoluteValue (a)));
        assertEquals ("math.asin(a)",       py.write (new Asin (a)));
        assertEquals ("math.log(a, 2.0)",   py.write (new Log (a, n (2))));
    }

    @Test
    public void negativeBase ()
    {
        // Unary minus binds more loosely than ** in Python, so a negative base needs brackets.
        Operator square = new Power (n (-2), n (2));
        assertEquals (4.0, new Evaluator ().evaluate (square), 0);
        assertEquals ("(-2.0) ** 2.0",            new RendererPython ().write (square));
        assertEquals ("(-2.0) ** 2.0",            new RendererNumPy  ().write (square));
        assertEquals ("(-math.inf) ** 2.0",       new RendererPython ().write (new Power (n (Double.NEGATIVE_INFINITY), n (2))));
        assertEquals ("2.0 ** -2.0",              new RendererPython ().write (new Power (n (2), n (-2))));
        assertEquals ("((-2.0) ** 2.0) ** a",     new RendererPython ().write (new Power (square, a)));
    }

    @Test
    public void pythonConditions ()
    {
        RendererPython py = new RendererPython ();
        assertEquals ("(not (a > b))",                    py.write (new NOT (new GT (a, b))));
        assertEquals ("(not a)",                          py.write (new NOT (a)));
        assertEquals ("((a > 0.0) and (b < 1.0))",        py.write (new AND (new GT (a, n (0)), new LT (b, n (1)))));
        assertEquals ("(a if (a > 0.0) else b)",          py.write (ifPositive));
        assertEquals ("(a if (a > 0.0) else (b if (a < -1.0) else 0.0))", py.write (twoConditions));

        py.setConditionFunction ("where");
        assertEquals ("where((a > 0.0), a, b)", py.write (ifPositive));
    }

    @Test
    public void numPy ()
    {
        RendererNumPy np = new RendererNumPy ();
        assertEquals ("numpy.sin(a)",                          np.write (new Sine (a)));
        assertEquals ("numpy.arcsin(a)",                       np.write (new Asin (a)));
        assertEquals ("(numpy.log(a) / numpy.log(2.0))",       np.write (new Log (a, n (2))));
        assertEquals ("numpy.nan",                             np.write (n (Double.NaN)));
        assertEquals ("numpy.select([(a > 0.0)], [a], b)",     np.write (ifPositive));
        assertEquals ("numpy.select([(a > 0.0), (a < -1.0)], [a, b], 0.0)", np.write (twoConditions));

        // select() is always used, even with a condition function configured.
        np.setConditionFunction ("where");
        assertEquals ("numpy.select([(a > 0.0)], [a], b)", np.write (ifPositive));
    }
}
