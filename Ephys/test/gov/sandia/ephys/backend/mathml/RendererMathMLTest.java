/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import javax.measure.Unit;

import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.Equation;
import gov.sandia.ephys.language.InitialValue;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.PartialDerivative;
import gov.sandia.ephys.language.Units;
import gov.sandia.ephys.language.UnsupportedKindException;
import gov.sandia.ephys.language.function.AbsoluteValue;
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
import gov.sandia.ephys.language.operator.GE;
import gov.sandia.ephys.language.operator.GT;
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

public class RendererMathMLTest
{
    static AccessVariable a = new AccessVariable ("a");
    static AccessVariable b = new AccessVariable ("b");
    static AccessVariable V = new AccessVariable ("V");

    static Constant n (double value)
    {
        return new Constant (value);
    }

    /**
        Checks the tag of an element and returns its child elements.
    **/
    static List<Element> expect (Element e, String tag, int childCount)
    {
        assertEquals (tag, XMLutility.localName (e));
        List<Element> children = XMLutility.children (e);
        assertEquals (childCount, children.size ());
        return children;
    }

    static Element content (Operator op)
    {
        Element math = new RendererMathML ().write (op);
        assertEquals (RendererMathML.NS, math.getNamespaceURI ());
        return expect (math, "math", 1).get (0);
    }

    @Test
    public void contentApply ()
    {
        List<Element> parts = expect (content (new Add (a, n (2))), "apply", 3);
        expect (parts.get (0), "plus", 0);
        expect (parts.get (1), "ci", 0);
        assertEquals ("a",   XMLutility.getText (parts.get (1)));
        assertEquals ("2.0", XMLutility.getText (parts.get (2)));

        parts = expect (content (new Negate (a)), "apply", 2);
        expect (parts.get (0), "minus", 0);

        parts = expect (content (new Modulo (a, b)), "apply", 3);
        expect (parts.get (0), "rem", 0);
    }

    @Test
    public void contentNumbers ()
    {
        expect (content (n (Double.NaN)), "notanumber", 0);
        expect (content (n (Double.POSITIVE_INFINITY)), "infinity", 0);
        List<Element> parts = expect (content (n (Double.NEGATIVE_INFINITY)), "apply", 2);
        expect (parts.get (0), "minus", 0);
        expect (parts.get (1), "infinity", 0);

        Element cn = content (n (1e-5));
        expect (cn, "cn", 1);
        assertEquals ("e-notation", cn.getAttribute ("type"));
        assertEquals ("1.0-5", XMLutility.getText (cn));  // mantissa, then exponent after <sep/>

        Unit<?> mV = Units.parse ("mV");
        cn = content (new Constant (5, mV));
        assertEquals (Units.format (mV), cn.getAttribute ("units"));
        cn = content (n (5));
        assertEquals ("", cn.getAttribute ("units"));
    }

    @Test
    public void contentDerivatives ()
    {
        Element math = new RendererMathML ().write (new Equation (new Derivative (V), new Negate (V)));
        List<Element> eq = expect (expect (math, "math", 1).get (0), "apply", 3);
        expect (eq.get (0), "eq", 0);
        List<Element> diff = expect (eq.get (1), "apply", 3);
        expect (diff.get (0), "diff", 0);
        Element ci = expect (diff.get (1), "bvar", 1).get (0);
        assertEquals ("time", XMLutility.getText (ci));
        assertEquals ("V",    XMLutility.getText (diff.get (2)));

        RendererMathML r = new RendererMathML ();
        r.setTimeVariable ("t");
        math = r.write (new Derivative (V));
        ci = XMLutility.children (XMLutility.children (XMLutility.children (math).get (0)).get (1)).get (0);
        assertEquals ("t", XMLutility.getText (ci));

        List<Element> partial = expect (content (new PartialDerivative (V, a)), "apply", 3);
        expect (partial.get (0), "partialdiff", 0);
        assertEquals ("a", XMLutility.getText (expect (partial.get (1), "bvar", 1).get (0)));
    }

    @Test
    public void contentLogarithms ()
    {
        List<Element> parts = expect (content (new Log10 (a)), "apply", 3);
        expect (parts.get (0), "log", 0);
        Element base = expect (parts.get (1), "logbase", 1).get (0);
        assertEquals ("10", XMLutility.getText (base));

        parts = expect (content (new Log (a)), "apply", 2);
        expect (parts.get (0), "ln", 0);

        parts = expect (content (new SquareRoot (a)), "apply", 2);
        expect (parts.get (0), "root", 0);
    }

    @Test
    public void contentConditionals ()
    {
        List<Element> pieces = expect (content (new If (new GT (a, n (0)), a, b)), "piecewise", 2);
        List<Element> piece = expect (pieces.get (0), "piece", 2);
        assertEquals ("a", XMLutility.getText (piece.get (0)));  // value first
        expect (piece.get (1), "apply", 3);                      // then condition
        expect (pieces.get (1), "otherwise", 1);
    }

    @Test
    public void initialValueRejected ()
    {
        try
        {
            new RendererMathML ().write (new Add (a, new InitialValue (V)));
            fail ("MathML has no initial-value form");
        }
        catch (UnsupportedKindException e)
        {
            assertTrue (e.op instanceof InitialValue);
        }
        try
        {
            new RendererMathML (true).write (new InitialValue (V));
            fail ("MathML has no initial-value form");
        }
        catch (UnsupportedKindException expected) {}
    }

    @Test
    public void renderOutsideWrite ()
    {
        try
        {
            a.render (new RendererMathML ());
            fail ("Rendering needs a target document");
        }
        catch (IllegalStateException expected) {}
    }

    @Test
    public void appendToParent ()
    {
        Document doc = XMLutility.newDocument ();
        Element parent = doc.createElementNS (RendererMathML.NS, "math");
        doc.appendChild (parent);
        RendererMathML r = new RendererMathML ();
        r.write (new Equation (V, n (1)), parent);
        r.write (new Equation (a, b), parent);
        assertEquals (2, XMLutility.children (parent).size ());
    }

    @Test
    public void presentation ()
    {
        RendererMathML r = new RendererMathML (true);
        Element math = r.write (new Multiply (new Add (a, b), n (2)));
        List<Element> row = expect (expect (math, "math", 1).get (0), "mrow", 3);
        expect (expect (row.get (0), "mfenced", 1).get (0), "mrow", 3);
        assertEquals ("·", XMLutility.getText (row.get (1)));
        expect (row.get (2), "mn", 0);

        math = r.write (new Divide (new Add (a, b), n (2)));
        List<Element> frac = expect (XMLutility.children (math).get (0), "mfrac", 2);
        expect (frac.get (0), "mrow", 3);  // no fences under a fraction bar

        math = r.write (new Power (new Power (a, b), n (2)));
        List<Element> sup = expect (XMLutility.children (math).get (0), "msup", 2);
        expect (sup.get (0), "mfenced", 1);

        math = r.write (new Power (n (-2), n (2)));
        sup = expect (XMLutility.children (math).get (0), "msup", 2);
        assertEquals ("-2.0", XMLutility.getText (expect (sup.get (0), "mfenced", 1).get (0)));
        math = r.write (new Power (a, n (-2)));
        sup = expect (XMLutility.children (math).get (0), "msup", 2);
        expect (sup.get (1), "mn", 0);

        math = r.write (new Sine (a));
        List<Element> call = expect (XMLutility.children (math).get (0), "mrow", 2);
        assertEquals ("sin", XMLutility.getText (call.get (0)));
        expect (call.get (1), "mfenced", 1);

        math = r.write (new Piecewise (new GT (a, n (0)), a, new LT (a, n (-1)), b, n (0)));
        List<Element> brace = expect (XMLutility.children (math).get (0), "mrow", 2);
        assertEquals ("{", XMLutility.getText (brace.get (0)));
        expect (brace.get (1), "mtable", 3);

        math = r.write (new Equation (new Derivative (V), a));
        List<Element> eq = expect (XMLutility.children (math).get (0), "mrow", 3);
        expect (eq.get (0), "mfrac", 2);
        assertEquals ("=", XMLutility.getText (eq.get (1)));
    }

    @Test
    public void serialized ()
    {
        String text = new RendererMathML ().writeString (new Add (a, n (2)));
        assertTrue (text.startsWith ("<math"));
        assertTrue (text.contains (RendererMathML.NS));
        assertTrue (text.contains ("<ci>a</ci>"));
    }

    /**
        Writing then reading gives back the same tree, both as elements and as text.
    **/
    @Test
    public void roundTrip () throws Exception
    {
        Operator[] trees =
        {
            new Add (new Multiply (a, n (2)), new Subtract (b, n (0.5))),
            new Divide (new UnaryPlus (a), new Negate (b)),
            new Quotient (a, b),
            new Modulo (a, b),
            new Power (new Power (a, b), n (3)),
            new AND (new GE (a, b), new OR (new NE (a, n (1)), new NOT (new LT (b, a)))),
            new Exp (new Log (a)),
            new Log (a, n (2)),
            new Log10 (new SquareRoot (a)),
            new Sine (new Cosine (new Tangent (a))),
            new Floor (new Ceil (new AbsoluteValue (a))),
            new Piecewise (new GT (a, n (0)), a, new LT (a, n (-1)), b, n (0)),
            new Derivative (V),
            new PartialDerivative (V, a),
            n (1e-5),
            n (6.02e23),
            n (Double.NaN),
            n (Double.POSITIVE_INFINITY),
        };
        RendererMathML writer = new RendererMathML ();
        ImportMathML   reader = new ImportMathML ();
        for (Operator op : trees)
        {
            assertEquals (op, reader.parse (writer.write (op)));
            assertEquals (op, reader.parse (writer.writeString (op)));
        }

        // A logarithm in base ten comes back in its own form.
        assertEquals (new Log10 (a), reader.parse (writer.write (new Log (a, n (10)))));

        // With units carried in the markup
        Constant c = new Constant (-80, Units.parse ("mV"));
        assertEquals (c, new ImportMathML (null, new UnitNumberFactory ()).parse (writer.write (c)));
    }
}
