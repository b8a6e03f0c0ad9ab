/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.sandia.ephys.language.function.If;
import gov.sandia.ephys.language.function.Log;
import gov.sandia.ephys.language.function.Piecewise;
import gov.sandia.ephys.language.function.Sine;
import gov.sandia.ephys.language.operator.AND;
import gov.sandia.ephys.language.operator.Add;
import gov.sandia.ephys.language.operator.Divide;
import gov.sandia.ephys.language.operator.GT;
import gov.sandia.ephys.language.operator.LT;
import gov.sandia.ephys.language.operator.Multiply;
import gov.sandia.ephys.language.operator.NOT;
import gov.sandia.ephys.language.operator.Negate;
import gov.sandia.ephys.language.operator.OR;
import gov.sandia.ephys.language.operator.Power;
import gov.sandia.ephys.language.operator.Subtract;

public class OperatorTest
{
    static AccessVariable a = new AccessVariable ("a");
    static AccessVariable b = new AccessVariable ("b");
    static AccessVariable c = new AccessVariable ("c");

    @Test
    public void sumOperands ()
    {
        // a - (b - c) needs its right side enclosed, (a - b) - c does not need its left.
        Subtract inner = new Subtract (b, c);
        Subtract outer = new Subtract (a, inner);
        assertTrue  (outer.bracket (inner));
        assertFalse (outer.bracket (a));

        Subtract left = new Subtract (a, b);
        outer = new Subtract (left, c);
        assertFalse (outer.bracket (left));
    }

    @Test
    public void mixedPrecedence ()
    {
        Add      sum     = new Add (a, b);
        Multiply product = new Multiply (sum, c);
        assertTrue (product.bracket (sum));

        Multiply m = new Multiply (a, b);
        Add      s = new Add (m, c);
        assertFalse (s.bracket (m));

        Divide d = new Divide (a, new Multiply (b, c));
        assertTrue (d.bracket (d.operand1));
    }

    @Test
    public void powerBase ()
    {
        Power inner = new Power (a, b);
        Power outer = new Power (inner, c);
        assertTrue  (outer.bracket (inner));
        assertFalse (outer.bracket (c));

        Power right = new Power (a, new Power (b, c));
        assertTrue (right.bracket (right.operand1));

        Negate n = new Negate (a);
        Power  p = new Power (n, b);
        assertTrue (p.bracket (n));

        // The power binds tighter than the sign.
        Negate sign = new Negate (new Power (a, b));
        assertFalse (sign.bracket (sign.operand));
    }

    @Test
    public void unaryOperands ()
    {
        Negate n = new Negate (new Add (a, b));
        assertTrue (n.bracket (n.operand));
        n = new Negate (a);
        assertFalse (n.bracket (a));
        NOT not = new NOT (new GT (a, b));
        assertTrue (not.bracket (not.operand));
    }

    @Test
    public void functionsNeverBracket ()
    {
        Add  sum = new Add (a, b);
        Sine s   = new Sine (sum);
        assertFalse (s.bracket (sum));
        Log  l   = new Log (sum, new Add (b, c));
        assertFalse (l.bracket (l.getBase ()));
        Derivative d = new Derivative (a);
        assertFalse (d.bracket (a));
    }

    @Test
    public void identityBeforeEquality ()
    {
        // Both operands are equal, but the oracle must still tell the sides apart.
        Subtract left  = new Subtract (b, c);
        Subtract right = new Subtract (b, c);
        Subtract outer = new Subtract (left, right);
        assertFalse (outer.bracket (left));
        assertTrue  (outer.bracket (right));
        // An equal but distinct tree resolves to the first matching side.
        assertFalse (outer.bracket (new Subtract (b, c)));
    }

    @Test
    public void notAnOperand ()
    {
        Add sum = new Add (a, b);
        try
        {
            sum.bracket (c);
            fail ("Should reject a node that is not a direct operand");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Sine (a).bracket (b);
            fail ("Should reject a node that is not a direct operand");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Negate (a).bracket (b);
            fail ("Should reject a node that is not a direct operand");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Constant (1).bracket (a);
            fail ("A leaf has no operands");
        }
        catch (IllegalArgumentException expected) {}
    }

    @Test
    public void conditions ()
    {
        assertTrue  (new GT (a, b).isCondition ());
        assertTrue  (new AND (new GT (a, b), new LT (a, c)).isCondition ());
        assertTrue  (new OR (a, b).isCondition ());
        assertTrue  (new NOT (a).isCondition ());
        assertFalse (new Add (a, b).isCondition ());
        assertFalse (a.isCondition ());
        assertEquals (Operator.LOGICAL,    new AND (a, b).precedence ());
        assertEquals (Operator.COMPARISON, new GT  (a, b).precedence ());
    }

    @Test
    public void structuralEquality ()
    {
        Operator x = new Add (new Multiply (a, new Constant (2)), new Sine (b));
        Operator y = new Add (new Multiply (new AccessVariable ("a"), new Constant (2)), new Sine (new AccessVariable ("b")));
        assertEquals (x, y);
        assertEquals (x.hashCode (), y.hashCode ());
        assertNotEquals (x, new Subtract (new Multiply (a, new Constant (2)), new Sine (b)));
        assertNotEquals (new Constant (0.0), new Constant (-0.0));
        assertEquals (new Constant (Double.NaN), new Constant (Double.NaN));

        // Same name bound to different model objects is a different reference.
        Object v1 = new Object ();
        Object v2 = new Object ();
        AccessVariable r1 = new AccessVariable ("V", v1);
        AccessVariable r2 = new AccessVariable ("V", v2);
        assertNotEquals (r1, r2);
        assertSame (v1, r1.getReference ());
        assertNull (a.getReference ());
    }

    @Test
    public void constructorChecks ()
    {
        try
        {
            new AccessVariable ("");
            fail ("Empty name");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Add (a, null);
            fail ("Null operand");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Derivative (new Constant (1));
            fail ("Derivative of a number");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new InitialValue (new Add (a, b));
            fail ("Initial value of an expression");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Piecewise (a, b);
            fail ("Even operand count");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Log (a, null);
            fail ("Null base");
        }
        catch (IllegalArgumentException expected) {}

        try
        {
            new Equation (a, null);
            fail ("Missing right side");
        }
        catch (IllegalArgumentException expected) {}
    }

    @Test
    public void piecewiseParts ()
    {
        Piecewise p = new Piecewise (new GT (a, b), a, new LT (a, c), c, b);
        assertEquals (2, p.conditionCount ());
        assertEquals (new LT (a, c), p.condition (1));
        assertEquals (c, p.value (1));
        assertEquals (b, p.otherwise ());

        If f = new If (new GT (a, b), a, b);
        assertEquals (new Piecewise (new GT (a, b), a, b), f.piecewise ());
    }

    @Test
    public void printNumbers ()
    {
        assertEquals ("12.0",      Constant.print (12));
        assertEquals ("-3.0",      Constant.print (-3));
        assertEquals ("0.0",       Constant.print (0));
        assertEquals ("0.5",       Constant.print (0.5));
        assertEquals ("1.0e-5",    Constant.print (1e-5));
        assertEquals ("1.0e20",    Constant.print (1e20));
        assertEquals ("NaN",       Constant.print (Double.NaN));
        assertEquals ("Infinity",  Constant.print (Double.POSITIVE_INFINITY));
        assertEquals ("-Infinity", Constant.print (Double.NEGATIVE_INFINITY));
        assertEquals (0.1, Double.parseDouble (Constant.print (0.1)), 0);
    }

    @Test
    public void units ()
    {
        assertNull (Units.parse (null));
        assertNull (Units.parse (" "));
        assertNull (Units.parse ("dimensionless"));
        Constant c = new Constant (5, Units.parse ("mV"));
        assertFalse (c.isDimensionless ());
        assertTrue (new Constant (5).isDimensionless ());
        assertEquals (c.unit, Units.parse (Units.format (c.unit)));
    }

    @Test
    public void unsupportedKind ()
    {
        Renderer<String> empty = new Renderer<String> () {};
        try
        {
            new Add (a, b).render (empty);
            fail ("Should refuse a kind it has no form for");
        }
        catch (UnsupportedKindException e)
        {
            assertEquals (new Add (a, b), e.op);
            assertTrue (e.getMessage ().endsWith ("cannot render Add"));
        }
    }
}
