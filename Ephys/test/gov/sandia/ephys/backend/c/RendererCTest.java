/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.Equation;
import gov.sandia.ephys.language.Evaluator;
import gov.sandia.ephys.language.Mystery;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.UnsupportedKindException;
import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Log10;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.LT;
import gov.sandia.ephys.language.operator.Modulo;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;
import gov.sandia.ephys.language.operator.Subtract;

public class RendererCTest
{
    static AccessVariable a = new AccessVariable ("a");
    static AccessVariable b = new AccessVariable ("b");
    static AccessVariable c = new AccessVariable ("c");

    static Constant n (double value)
    {
        return new Constant (value);
    }

    RendererC renderer;

    @Before
    public void setup ()
    {
        renderer = new RendererC ();
        renderer.setNameFunction (lhs -> "c." + lhs.getVariable ().name);
    }

    @Test
    public void arithmetic ()
    {
        assertEquals ("12.0",                   renderer.write (n (12)));
        assertEquals ("(c.a + c.b) * c.c",      renderer.write (new Multiply (new Add (a, b), c)));
        assertEquals ("c.a * c.b + c.c",        renderer.write (new Add (new Multiply (a, b), c)));
        assertEquals ("c.a - (c.b - c.c)",      renderer.write (new Subtract (a, new Subtract (b, c))));
        assertEquals ("c.a - c.b - c.c",        renderer.write (new Subtract (new Subtract (a, b), c)));
        assertEquals ("pow(c.a, 12.0)",         renderer.write (new Power (a, n (12))));
        assertEquals ("pow(pow(c.a, c.b), c.c)", renderer.write (new Power (new Power (a, b), c)));
    }

    @Test
    public void signs ()
    {
        assertEquals ("(-c.a)",          renderer.write (new Negate (a)));
        assertEquals ("(-(-c.a))",       renderer.write (new Negate (new Negate (a))));
        assertEquals ("(-(-3.0))",       renderer.write (new Negate (n (-3))));
        assertEquals ("c.a - (-c.b)",    renderer.write (new Subtract (a, new Negate (b))));
        assertEquals ("(-(c.a + c.b))",  renderer.write (new Negate (new Add (a, b))));
    }

    @Test
    public void flooringDivision ()
    {
        assertEquals ("floor(c.a / 12.0)",                 renderer.write (new Quotient (a, n (12))));
        assertEquals ("floor(5.0 / -3.0)",                 renderer.write (new Quotient (n (5), n (-3))));
        assertEquals ("(c.a - c.b * floor(c.a / c.b))",    renderer.write (new Modulo (a, b)));
        assertEquals ("(-5.0 - 3.0 * floor(-5.0 / 3.0))",  renderer.write (new Modulo (n (-5), n (3))));

        // Rounding goes toward negative infinity, not toward zero.
        Evaluator e = new Evaluator ();
        assertEquals (-2, e.evaluate (new Quotient (n (5), n (-3))), 0);
        assertEquals ( 1, e.evaluate (new Modulo (n (-5), n (3))), 0);
    }

    @Test
    public void conditions ()
    {
        assertEquals ("(c.a > 5.0)",                           renderer.write (new GT (a, n (5))));
        assertEquals ("!((5.0 > 3.0))",                        renderer.write (new NOT (new GT (n (5), n (3)))));
        assertEquals ("((c.a > 0.0) && (c.b < 1.0))",          renderer.write (new AND (new GT (a, n (0)), new LT (b, n (1)))));
        assertEquals ("((c.a > 0.0) ? c.a : c.b)",             renderer.write (new If (new GT (a, n (0)), a, b)));

        Operator p = new Piecewise (new GT (a, n (0)), a, new LT (a, n (-1)), b, n (0));
        assertEquals ("((c.a > 0.0) ? c.a : ((c.a < -1.0) ? c.b : 0.0))", renderer.write (p));

        renderer.setConditionFunction ("ifelse");
        assertEquals ("ifelse((c.a > 0.0), c.a, c.b)", renderer.write (new If (new GT (a, n (0)), a, b)));
        assertEquals ("ifelse((c.a > 0.0), c.a, ifelse((c.a < -1.0), c.b, 0.0))", renderer.write (p));
    }

    @Test
    public void functions ()
    {
        assertEquals ("sqrt(c.a)",               renderer.write (new SquareRoot (a)));
        assertEquals ("fabs(c.a)",               renderer.write (new AbsoluteValue (a)));
        assertEquals ("log(c.a)",                renderer.write (new Log (a)));
        assertEquals ("log10(c.a)",              renderer.write (new Log10 (a)));
        assertEquals ("(log(c.a) / log(2.0))",   renderer.write (new Log (a, n (2))));
        assertEquals ("sqrt(c.a + c.b)",         renderer.write (new SquareRoot (new Add (a, b))));
    }

    @Test
    public void specialValues ()
    {
        assertEquals ("NAN",       renderer.write (n (Double.NaN)));
        assertEquals ("INFINITY",  renderer.write (n (Double.POSITIVE_INFINITY)));
        assertEquals ("-INFINITY", renderer.write (n (Double.NEGATIVE_INFINITY)));
    }

    @Test
    public void singlePrecision ()
    {
        RendererC single = new RendererC (Precision.SINGLE);
        assertEquals ("12.0f",          single.write (n (12)));
        assertEquals ("0.5f",           single.write (n (0.5)));
        assertEquals ("NAN",            single.write (n (Double.NaN)));
        assertEquals ("a * 2.0f",       single.write (new Multiply (a, n (2))));
        assertEquals ("pow(a, 2.0f)",   single.write (new Power (a, n (2))));
    }

    @Test
    public void formatting ()
    {
        renderer.setNumberFormat (k -> "N");
        assertEquals ("c.a * N", renderer.write (new Multiply (a, n (0.5))));
        renderer.setNameFunction (null);
        assertEquals ("dot(a) = (-a)", renderer.write (new Equation (new Derivative (a), new Negate (a))));
    }

    @Test
    public void unknownKind ()
    {
        try
        {
            renderer.write (new Add (a, new Mystery ()));
            fail ("Should refuse a node it has no form for");
        }
        catch (UnsupportedKindException e)
        {
            assertEquals ("RendererC cannot render Mystery", e.getMessage ());
        }
    }

    @Test
    public void cpp ()
    {
        RendererCpp cpp = new RendererCpp ();
        assertEquals ("pow(a, 2.0)",               cpp.write (new Power (a, n (2))));
        assertEquals ("((a > 0.0) ? a : 0.0)",     cpp.write (new If (new GT (a, n (0)), a, n (0))));
        assertEquals ("2.0f", new RendererCpp (Precision.SINGLE).write (n (2)));
    }
}
