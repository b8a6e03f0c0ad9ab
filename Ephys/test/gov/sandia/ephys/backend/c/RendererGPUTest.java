/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Sine;
import gov.sandia.ephys.language.function.SquareRoot;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.EQ;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Quotient;

public class RendererGPUTest
{
    static AccessVariable a = new AccessVariable ("a");
    static AccessVariable b = new AccessVariable ("b");
    static AccessVariable c = new AccessVariable ("c");

    static Constant n (double value)
    {
        return new Constant (value);
    }

    static <R extends RendererC> R named (R renderer)
    {
        renderer.setNameFunction (lhs -> "c." + lhs.getVariable ().name);
        return renderer;
    }

    @Test
    public void cudaSingle ()
    {
        RendererCuda cuda = named (new RendererCuda ());
        assertFalse (cuda.getNativeMath ());
        assertEquals ("12.0f",                  cuda.write (n (12)));
        assertEquals ("sinf(c.a)",              cuda.write (new Sine (a)));
        assertEquals ("fabsf(c.a)",             cuda.write (new AbsoluteValue (a)));
        assertEquals ("powf(c.a, 3.0f)",        cuda.write (new Power (a, n (3))));
        assertEquals ("(c.a * c.a)",            cuda.write (new Power (a, n (2))));
        assertEquals ("floorf(c.a / 12.0f)",    cuda.write (new Quotient (a, n (12))));
    }

    @Test
    public void cudaNative ()
    {
        RendererCuda cuda = named (new RendererCuda (Precision.SINGLE, true));
        assertEquals ("__sinf(c.a)",            cuda.write (new Sine (a)));
        assertEquals ("sqrtf(c.a)",             cuda.write (new SquareRoot (a)));
        assertEquals ("__powf(c.a, 3.0f)",      cuda.write (new Power (a, n (3))));
        assertEquals ("(__logf(c.a) / __logf(2.0f))", cuda.write (new Log (a, n (2))));
    }

    @Test
    public void cudaDouble ()
    {
        RendererCuda cuda = named (new RendererCuda (Precision.DOUBLE, true));
        assertEquals ("12.0",             cuda.write (n (12)));
        assertEquals ("sin(c.a)",         cuda.write (new Sine (a)));
        assertEquals ("pow(c.a, 3.0)",    cuda.write (new Power (a, n (3))));
        assertEquals ("(c.a * c.a)",      cuda.write (new Power (a, n (2))));
    }

    @Test
    public void truthValues ()
    {
        RendererCuda cuda = named (new RendererCuda ());
        assertEquals ("!((c.a != 0.0f))",                          cuda.write (new NOT (a)));
        assertEquals ("((c.a != 0.0f) && (c.b > 1.0f))",           cuda.write (new AND (a, new GT (b, n (1)))));
        assertEquals ("((c.a != 0.0f) ? c.b : c.c)",               cuda.write (new If (a, b, c)));
        assertEquals ("((c.a > c.b) == (1.0f != 0.0f))",           cuda.write (new EQ (new GT (a, b), n (1))));
        assertEquals ("(c.a == c.b)",                              cuda.write (new EQ (a, b)));
    }

    @Test
    public void openCL ()
    {
        RendererOpenCL cl = named (new RendererOpenCL ());
        assertFalse (cl.getNativeMath ());  // native_ functions are less accurate, so they must be asked for
        assertEquals ("12.0f",                                 cl.write (n (12)));
        assertEquals ("sin(c.a)",                              cl.write (new Sine (a)));
        assertEquals ("floor(c.a / 12.0f)",                    cl.write (new Quotient (a, n (12))));
        assertEquals ("(c.a * c.a)",                           cl.write (new Power (a, n (2))));
        assertEquals ("((c.a + 12.0f) * (c.a + 12.0f))",       cl.write (new Power (new Add (a, n (12)), n (2))));
        assertEquals ("pow(c.a, 3.0f)",                        cl.write (new Power (a, n (3))));
        assertEquals ("((c.a > c.b) == (1.0f != 0.0f))",       cl.write (new EQ (new GT (a, b), n (1))));
    }

    @Test
    public void openCLNative ()
    {
        RendererOpenCL cl = named (new RendererOpenCL (Precision.SINGLE, true));
        assertEquals ("native_sqrt(12.0f)",                       cl.write (new SquareRoot (n (12))));
        assertEquals ("(native_log(c.a) / native_log(12.0f))",    cl.write (new Log (a, n (12))));
        assertEquals ("fabs(12.0f)",                              cl.write (new AbsoluteValue (n (12))));
        assertEquals ("pow(c.a, 3.0f)",                           cl.write (new Power (a, n (3))));
    }

    @Test
    public void openCLDouble ()
    {
        RendererOpenCL cl = named (new RendererOpenCL (Precision.DOUBLE, false));
        assertEquals ("12.0",            cl.write (n (12)));
        assertEquals ("pow(c.a, 3.0)",   cl.write (new Power (a, n (3))));
    }
}
