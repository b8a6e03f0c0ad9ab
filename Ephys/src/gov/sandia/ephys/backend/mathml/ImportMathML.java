/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import gov.sandia.ephys.language.AccessVariable;
import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Derivative;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.OperatorUnary;
import gov.sandia.ephys.language.ParseException;
import gov.sandia.ephys.language.PartialDerivative;
import gov.sandia.ephys.language.function.AbsoluteValue;
import gov.sandia.ephys.language.function.Acos;
import gov.sandia.ephys.language.function.Asin;
import gov.sandia.ephys.language.function.Atan;
import gov.sandia.ephys.language.function.Ceil;
import gov.sandia.ephys.language.function.Cosine;
import gov.sandia.ephys.language.function.Exp;
import gov.sandia.ephys.language.function.Floor;
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
    Reads Content MathML into an expression tree.

    <p>Works on DOM elements, with or without namespaces. An apply element names its operator
    in the first child. The remaining children are read in order through a cursor, because
    qualifiers such as logbase, degree and bvar come before the operands.
    Operators outside the core set (hyperbolic functions, reciprocal trig, xor) are rewritten
    into core operators. Anything that can't be read exactly as written is an error.

    <p>Holds nothing but its factories, so one instance may be used from several threads,
    as long as the free-variable set (if any) is safe for that.
**/
public class ImportMathML
{
    private static Logger logger = Logger.getLogger (ImportMathML.class);

    // Plain decimal notation. Double.parseDouble also takes hex floats, type suffixes and NaN, which MathML doesn't have.
    protected static final Pattern decimal  = Pattern.compile ("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    protected static final Pattern mantissa = Pattern.compile ("[+-]?(\\d+\\.?\\d*|\\.\\d+)");
    protected static final Pattern exponent = Pattern.compile ("[+-]?\\d+");

    /**
        Resolves the text of a ci element (or the definitionURL of a csymbol) to a variable reference.
    **/
    public interface NameFactory
    {
        public AccessVariable create (String name, Element element) throws Exception;
    }

    /**
        Creates a number. The element is the cn that held it, or null for numbers
        implied by the markup, such as the 0 of a piecewise without otherwise.
    **/
    public interface NumberFactory
    {
        public Constant create (double value, Element element) throws Exception;
    }

    public static final NameFactory   defaultNames   = (name, element) -> new AccessVariable (name);
    public static final NumberFactory defaultNumbers = (value, element) -> new Constant (value);

    protected final NameFactory         nameFactory;
    protected final NumberFactory       numberFactory;
    protected final Set<AccessVariable> freeVariables;  // null if the caller doesn't want them

    public ImportMathML ()
    {
        this (defaultNames, defaultNumbers, null);
    }

    public ImportMathML (NameFactory nameFactory, NumberFactory numberFactory)
    {
        this (nameFactory, numberFactory, null);
    }

    /**
        @param freeVariables Receives the variable of every bvar in a derivative. May be null.
    **/
    public ImportMathML (NameFactory nameFactory, NumberFactory numberFactory, Set<AccessVariable> freeVariables)
    {
        this.nameFactory   = nameFactory   == null ? defaultNames   : nameFactory;
        this.numberFactory = numberFactory == null ? defaultNumbers : numberFactory;
        this.freeVariables = freeVariables;
    }

    /**
        Reads MathML text. The root element may be math or any single expression element.
    **/
    public Operator parse (String xml) throws ParseException
    {
        Document doc;
        try
        {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
            factory.setNamespaceAware (true);
            factory.setCoalescing (true);
            factory.setIgnoringComments (true);
            doc = factory.newDocumentBuilder ().parse (new InputSource (new StringReader (xml)));
        }
        catch (ParserConfigurationException | SAXException | IOException e)
        {
            throw new ParseException ("Unable to read MathML text: " + e.getMessage (), e);
        }
        return parse (doc.getDocumentElement ());
    }

    /**
        Reads a single expression. If the element is math, its first child element is read.
    **/
    public Operator parse (Element element) throws MathMLException
    {
        if (XMLutility.localName (element).equals ("math"))
        {
            List<Element> children = XMLutility.children (element);
            if (children.isEmpty ()) throw new MalformedStructureException ("Empty <math> element.", element);
            element = children.get (0);
        }
        return parseAtomic (element);
    }

    /**
        Reads an expression that is entirely contained in the given element.
    **/
    protected Operator parseAtomic (Element element) throws MathMLException
    {
        String tag = XMLutility.localName (element);
        switch (tag)
        {
            case "apply":        return parseApply (element);
            case "ci":           return parseName (element);
            case "cn":           return parseNumber (element);
            case "csymbol":      return parseSymbol (element);
            case "piecewise":    return parsePiecewise (element);
            case "pi":           return constant (Math.PI, element);
            case "exponentiale": return new Exp (constant (1, element));  // exact, rather than a rounded literal
            case "true":         return constant (1, element);
            case "false":        return constant (0, element);
            case "notanumber":   return constant (Double.NaN, element);
            case "infinity":     return constant (Double.POSITIVE_INFINITY, element);
        }
        throw new MalformedStructureException ("Unsupported element: <" + tag + ">.", element);
    }

    protected Operator parseApply (Element apply) throws MathMLException
    {
        List<Element> children = XMLutility.children (apply);
        if (children.isEmpty ()) throw new MalformedStructureException ("Apply must contain at least one child element.", apply);

        Iterator<Element> it = children.iterator ();
        Element element = it.next ();
        String  tag     = XMLutility.localName (element);
        switch (tag)
        {
            case "diff":        return parseDerivative (element, it, false);
            case "partialdiff": return parseDerivative (element, it, true);

            case "plus":   return parseNary (element, it, Add::new,      UnaryPlus::new);
            case "minus":  return parseNary (element, it, Subtract::new, Negate::new);
            case "times":  return parseNary (element, it, Multiply::new, null);
            case "divide": return parseNary (element, it, Divide::new,   null);
            case "and":    return parseNary (element, it, AND::new,      null);
            case "or":     return parseNary (element, it, OR::new,       null);

            case "exp":     return new Exp           (eat (element, it));
            case "ln":      return new Log           (eat (element, it));
            case "log":     return parseLog  (element, it);
            case "root":    return parseRoot (element, it);
            case "floor":   return new Floor         (eat (element, it));
            case "ceiling": return new Ceil          (eat (element, it));
            case "abs":     return new AbsoluteValue (eat (element, it));
            case "not":     return new NOT           (eat (element, it));
            case "sin":     return new Sine          (eat (element, it));
            case "cos":     return new Cosine        (eat (element, it));
            case "tan":     return new Tangent       (eat (element, it));
            case "arcsin":  return new Asin          (eat (element, it));
            case "arccos":  return new Acos          (eat (element, it));
            case "arctan":  return new Atan          (eat (element, it));

            case "power":      return binary (element, it, Power::new);
            case "quotient":   return binary (element, it, Quotient::new);
            case "rem":        return binary (element, it, Modulo::new);
            case "eq":
            case "equivalent": return binary (element, it, EQ::new);
            case "neq":        return binary (element, it, NE::new);
            case "gt":         return binary (element, it, GT::new);
            case "lt":         return binary (element, it, LT::new);
            case "geq":        return binary (element, it, GE::new);
            case "leq":        return binary (element, it, LE::new);
            case "xor":
            {
                List<Operator> ops = eat (element, it, 2);
                Operator x = ops.get (0);
                Operator y = ops.get (1);
                desugared (tag);
                return new AND (new OR (x, y), new NOT (new AND (x, y)));
            }
        }

        Operator result = parseExtended (tag, element, it);
        if (result != null) return result;

        if (children.size () == 1) return parseAtomic (element);
        throw new MalformedStructureException ("Unsupported element in apply: <" + tag + ">.", element);
    }

    /**
        Rewrites reciprocal trig, hyperbolic and inverse hyperbolic functions into core operators.
        @return null if tag is not one of these.
    **/
    protected Operator parseExtended (String tag, Element element, Iterator<Element> it) throws MathMLException
    {
        Operator x;
        switch (tag)
        {
            case "csc":
            case "sec":
            case "cot":
            case "arccsc":
            case "arcsec":
            case "arccot":
            case "sinh":
            case "cosh":
            case "tanh":
            case "arcsinh":
            case "arccosh":
            case "arctanh":
            case "csch":
            case "sech":
            case "coth":
            case "arccsch":
            case "arcsech":
            case "arccoth":
                x = eat (element, it);
                desugared (tag);
                break;
            default:
                return null;
        }

        Constant one  = constant (1,   null);
        Constant two  = constant (2,   null);
        Constant half = constant (0.5, null);
        switch (tag)
        {
            case "csc":    return new Divide (one, new Sine    (x));
            case "sec":    return new Divide (one, new Cosine  (x));
            case "cot":    return new Divide (one, new Tangent (x));
            case "arccsc": return new Asin (new Divide (one, x));
            case "arcsec": return new Acos (new Divide (one, x));
            case "arccot": return new Atan (new Divide (one, x));

            case "sinh": return new Multiply (half, new Subtract (new Exp (x), new Exp (new Negate (x))));
            case "cosh": return new Multiply (half, new Add      (new Exp (x), new Exp (new Negate (x))));
            case "csch": return new Divide   (two,  new Subtract (new Exp (x), new Exp (new Negate (x))));
            case "sech": return new Divide   (two,  new Add      (new Exp (x), new Exp (new Negate (x))));
            case "tanh":
            {
                Operator e2x = new Exp (new Multiply (two, x));
                return new Divide (new Subtract (e2x, one), new Add (e2x, one));
            }
            case "coth":
            {
                Operator e2x = new Exp (new Multiply (two, x));
                return new Divide (new Add (e2x, one), new Subtract (e2x, one));
            }

            case "arcsinh": return new Log (new Add (x, new SquareRoot (new Add      (new Multiply (x, x), one))));
            case "arccosh": return new Log (new Add (x, new SquareRoot (new Subtract (new Multiply (x, x), one))));
            case "arctanh": return new Multiply (half, new Log (new Divide (new Add (one, x), new Subtract (one, x))));
            case "arccoth": return new Multiply (half, new Log (new Divide (new Add (x, one), new Subtract (x, one))));
            case "arccsch":
            {
                Operator inverseSquare = new Divide (one, new Multiply (x, x));
                return new Log (new Add (new Divide (one, x), new SquareRoot (new Add (inverseSquare, one))));
            }
            default:  // arcsech
            {
                Operator inverseSquare = new Divide (one, new Multiply (x, x));
                return new Log (new Add (new Divide (one, x), new SquareRoot (new Subtract (inverseSquare, one))));
            }
        }
    }

    protected void desugared (String tag)
    {
        if (logger.isDebugEnabled ()) logger.debug ("Rewrote <" + tag + "> in terms of core operators");
    }

    /**
        Reads all remaining operands, which must number exactly count.
    **/
    protected List<Operator> eat (Element element, Iterator<Element> it, int count) throws MathMLException
    {
        List<Operator> result = new ArrayList<Operator> ();
        while (it.hasNext ()) result.add (parseAtomic (it.next ()));
        if (result.size () != count) throw new ArityException (count, result.size (), XMLutility.localName (element), element);
        return result;
    }

    /**
        Reads exactly one remaining operand.
    **/
    protected Operator eat (Element element, Iterator<Element> it) throws MathMLException
    {
        return eat (element, it, 1).get (0);
    }

    protected interface BinaryFactory
    {
        public OperatorBinary create (Operator operand0, Operator operand1);
    }

    protected interface UnaryFactory
    {
        public OperatorUnary create (Operator operand);
    }

    protected Operator binary (Element element, Iterator<Element> it, BinaryFactory binary) throws MathMLException
    {
        List<Operator> ops = eat (element, it, 2);
        return binary.create (ops.get (0), ops.get (1));
    }

    /**
        Folds any number of operands, left to right, into a chain of binary operators.
        @param unary Form to use when there is a single operand. If null, one operand is an error.
    **/
    protected Operator parseNary (Element element, Iterator<Element> it, BinaryFactory binary, UnaryFactory unary) throws MathMLException
    {
        List<Operator> ops = new ArrayList<Operator> ();
        while (it.hasNext ()) ops.add (parseAtomic (it.next ()));

        String tag = XMLutility.localName (element);
        int n = ops.size ();
        if (n < 1) throw ArityException.atLeast (1, n, tag, element);
        if (n < 2)
        {
            if (unary == null) throw ArityException.atLeast (2, n, tag, element);
            return unary.create (ops.get (0));
        }

        Operator result = binary.create (ops.get (0), ops.get (1));
        for (int i = 2; i < n; i++) result = binary.create (result, ops.get (i));
        return result;
    }

    protected Operator parseDerivative (Element element, Iterator<Element> it, boolean partial) throws MathMLException
    {
        String tag = XMLutility.localName (element);
        Element bvar = next (it, "bvar");
        if (bvar == null) throw new MalformedStructureException ("<" + tag + "> element must contain a <bvar>.", element);
        Element ci = next (XMLutility.children (bvar).iterator (), "ci");
        if (ci == null) throw new MalformedStructureException ("<bvar> element must contain a <ci>.", bvar);
        AccessVariable independent = parseName (ci);
        if (freeVariables != null) freeVariables.add (independent);

        Element degree = next (XMLutility.children (bvar).iterator (), "degree");
        if (degree != null)
        {
            Element cn = next (XMLutility.children (degree).iterator (), "cn");
            if (cn == null) throw new MalformedStructureException ("<degree> element must contain a <cn>.", degree);
            Constant d = parseNumber (cn);
            if (d.value != 1) throw new MalformedStructureException ("Only derivatives of degree one are supported.", cn);
        }

        ci = next (it, "ci");
        if (ci == null)
        {
            throw new MalformedStructureException ("<" + tag + "> element must contain a <ci> after its <bvar> element (derivatives of expressions are not supported).", element);
        }
        AccessVariable dependent = parseName (ci);

        if (partial) return new PartialDerivative (dependent, independent);
        return new Derivative (dependent);
    }

    /**
        Advances the cursor to the next element with the given tag.
        @return The element, or null if the cursor ran out first.
    **/
    protected Element next (Iterator<Element> it, String tag)
    {
        while (it.hasNext ())
        {
            Element e = it.next ();
            if (XMLutility.localName (e).equals (tag)) return e;
        }
        return null;
    }

    /**
        A logbase that evaluates to 10 gives Log10. Any other base gives a two-operand Log.
        No logbase at all gives the natural log.
    **/
    protected Operator parseLog (Element element, Iterator<Element> it) throws MathMLException
    {
        List<Element> ops = new ArrayList<Element> ();
        while (it.hasNext ()) ops.add (it.next ());
        if (ops.isEmpty ()) throw new ArityException (1, 0, "log", element);

        Element first = ops.get (0);
        if (! XMLutility.localName (first).equals ("logbase"))
        {
            if (ops.size () != 1) throw new ArityException (1, ops.size (), "log", element);
            return new Log (parseAtomic (first));
        }

        List<Element> contents = XMLutility.children (first);
        if (contents.size () != 1) throw new MalformedStructureException ("Expecting a single operand inside <logbase> element.", first);
        Operator base = parseAtomic (contents.get (0));
        if (ops.size () != 2) throw new ArityException (1, ops.size () - 1, "log", element);
        Operator operand = parseAtomic (ops.get (1));

        Double b = ConstantFolder.fold (base);
        if (b != null  &&  b == 10) return new Log10 (operand);
        return new Log (operand, base);
    }

    /**
        A degree of 2, or none, gives the square root. Any other degree d gives x^(1/d).
    **/
    protected Operator parseRoot (Element element, Iterator<Element> it) throws MathMLException
    {
        List<Element> ops = new ArrayList<Element> ();
        while (it.hasNext ()) ops.add (it.next ());
        if (ops.isEmpty ()) throw new ArityException (1, 0, "root", element);

        Element first = ops.get (0);
        if (! XMLutility.localName (first).equals ("degree"))
        {
            if (ops.size () != 1) throw new ArityException (1, ops.size (), "root", element);
            return new SquareRoot (parseAtomic (first));
        }

        List<Element> contents = XMLutility.children (first);
        if (contents.size () != 1) throw new MalformedStructureException ("Expecting a single operand inside <degree> element.", first);
        Operator degree = parseAtomic (contents.get (0));
        if (ops.size () != 2) throw new ArityException (1, ops.size () - 1, "root", element);
        Operator operand = parseAtomic (ops.get (1));

        Double d = ConstantFolder.fold (degree);
        if (d != null  &&  d == 2) return new SquareRoot (operand);
        return new Power (operand, new Divide (constant (1, null), degree));
    }

    protected Operator parsePiecewise (Element element) throws MathMLException
    {
        List<Operator> ops = new ArrayList<Operator> ();
        Operator otherwise = null;
        for (Element child : XMLutility.children (element))
        {
            String tag = XMLutility.localName (child);
            List<Element> parts = XMLutility.children (child);
            if (tag.equals ("piece"))
            {
                if (parts.size () != 2) throw new MalformedStructureException ("<piece> element must have exactly 2 children.", child);
                ops.add (parseAtomic (parts.get (1)));  // condition
                ops.add (parseAtomic (parts.get (0)));  // value
            }
            else if (tag.equals ("otherwise"))
            {
                if (otherwise != null) throw new MalformedStructureException ("Found more than one <otherwise> inside a <piecewise> element.", child);
                if (parts.size () != 1) throw new MalformedStructureException ("<otherwise> element must have exactly 1 child.", child);
                otherwise = parseAtomic (parts.get (0));
            }
            else
            {
                throw new MalformedStructureException ("Unexpected content in <piecewise>. Expecting <piece> or <otherwise>, found <" + tag + ">.", child);
            }
        }
        if (ops.isEmpty ()) throw new MalformedStructureException ("<piecewise> element must contain at least one <piece>.", element);

        if (otherwise == null)
        {
            logger.debug ("<piecewise> has no <otherwise>, so using 0");
            otherwise = constant (0, null);
        }
        ops.add (otherwise);
        return new Piecewise (ops.toArray (new Operator[ops.size ()]));
    }

    protected AccessVariable parseName (Element element) throws MathMLException
    {
        String name = XMLutility.getText (element).trim ();
        if (name.isEmpty ()) throw new MalformedStructureException ("<ci> element must contain a variable name.", element);
        return name (name, element);
    }

    protected AccessVariable parseSymbol (Element element) throws MathMLException
    {
        String url = XMLutility.getAttribute (element, "definitionURL").trim ();
        if (url.isEmpty ()) throw new MalformedStructureException ("<csymbol> element must contain a definitionURL attribute.", element);
        return name (url, element);
    }

    protected AccessVariable name (String name, Element element) throws MathMLException
    {
        AccessVariable result;
        try
        {
            result = nameFactory.create (name, element);
        }
        catch (Exception e)
        {
            throw new MalformedStructureException ("Unable to create name \"" + name + "\": " + e.getMessage (), element, e);
        }
        if (result == null) throw new MalformedStructureException ("Unable to create name \"" + name + "\".", element);
        return result;
    }

    protected Constant constant (double value, Element element) throws MathMLException
    {
        Constant result;
        try
        {
            result = numberFactory.create (value, element);
        }
        catch (Exception e)
        {
            throw new MalformedLiteralException ("Unable to create number: " + e.getMessage (), element, e);
        }
        if (result == null) throw new MalformedLiteralException ("Unable to create number.", element);
        return result;
    }

    /**
        Decodes a cn element in any of the encodings real, integer, double, e-notation or rational.
    **/
    protected Constant parseNumber (Element element) throws MathMLException
    {
        String type = XMLutility.getAttribute (element, "type", "real").trim ();
        double value;
        switch (type)
        {
            case "real":
            {
                String base = XMLutility.getAttribute (element, "base", "10").trim ();
                double b = parseDecimal (base, element, "Invalid base specified on <cn> element: \"" + base + "\"");
                if (b != 10) throw new MalformedLiteralException ("Numbers in bases other than 10 are not supported.", element);
                value = parseDouble (element);
                break;
            }
            case "double":
                value = parseDouble (element);
                break;
            case "integer":
            {
                String base = XMLutility.getAttribute (element, "base", "10").trim ();
                int b;
                try {b = Integer.parseInt (base);}
                catch (NumberFormatException e) {throw new MalformedLiteralException ("Unable to parse base of <cn> element: \"" + base + "\"", element, e);}
                String text = text (element);
                try {value = new BigInteger (text, b).doubleValue ();}
                catch (NumberFormatException e) {throw new MalformedLiteralException ("Unable to convert contents of <cn> to an integer: \"" + text + "\"", element, e);}
                break;
            }
            case "e-notation":
            {
                String[] parts = separated (element, "e-notation");
                String text = parts[0] + "e" + parts[1];
                if (! mantissa.matcher (parts[0]).matches ()  ||  ! exponent.matcher (parts[1]).matches ())
                {
                    throw new MalformedLiteralException ("Unable to parse number in e-notation \"" + text + "\".", element);
                }
                value = Double.parseDouble (text);
                break;
            }
            case "rational":
            {
                String[] parts = separated (element, "rational");
                String message = "Unable to parse rational number \"" + parts[0] + " / " + parts[1] + "\".";
                value = parseDecimal (parts[0], element, message) / parseDecimal (parts[1], element, message);
                break;
            }
            default:
                throw new MalformedLiteralException ("Unsupported <cn> type: " + type, element);
        }
        return constant (value, element);
    }

    protected String text (Element element) throws MalformedLiteralException
    {
        String result = XMLutility.getText (element).trim ();
        if (result.isEmpty ()) throw new MalformedLiteralException ("Empty <cn> element.", element);
        return result;
    }

    protected double parseDouble (Element element) throws MalformedLiteralException
    {
        String text = text (element);
        return parseDecimal (text, element, "Unable to convert contents of <cn> to a real number: \"" + text + "\"");
    }

    protected double parseDecimal (String text, Element element, String message) throws MalformedLiteralException
    {
        if (! decimal.matcher (text).matches ()) throw new MalformedLiteralException (message, element);
        return Double.parseDouble (text);
    }

    /**
        Splits the contents of a cn around its sep element.
        @return Two non-empty strings: the text before sep and the text after it.
    **/
    protected String[] separated (Element element, String type) throws MalformedLiteralException
    {
        List<Element> children = XMLutility.children (element);
        if (children.size () != 1  ||  ! XMLutility.localName (children.get (0)).equals ("sep"))
        {
            throw new MalformedLiteralException ("Number of type " + type + " should have the format number<sep/>number.", element);
        }

        String before = "";
        String after  = "";
        boolean passed = false;
        for (Node child = element.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            short nodeType = child.getNodeType ();
            if (nodeType == Node.ELEMENT_NODE) passed = true;
            else if (nodeType == Node.TEXT_NODE  ||  nodeType == Node.CDATA_SECTION_NODE)
            {
                if (passed) after  += child.getNodeValue ();
                else        before += child.getNodeValue ();
            }
        }
        before = before.trim ();
        after  = after.trim ();
        if (before.isEmpty ()) throw new MalformedLiteralException ("Unable to parse " + type + " number: missing part before the separator.", element);
        if (after .isEmpty ()) throw new MalformedLiteralException ("Unable to parse " + type + " number: missing part after the separator.",  element);
        return new String[] {before, after};
    }
}
