/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

public class XMLutility
{
    public static Document newDocument ()
    {
        try
        {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
            factory.setNamespaceAware (true);
            return factory.newDocumentBuilder ().newDocument ();
        }
        catch (ParserConfigurationException e)
        {
            throw new IllegalStateException ("XML parser is not available", e);
        }
    }

    /**
        Serializes the given node and everything under it, without an XML declaration.
    **/
    public static String toString (Node node)
    {
        return toString (node, false);
    }

    public static String toString (Node node, boolean indent)
    {
        StringWriter result = new StringWriter ();
        TransformerFactory factoryXform = TransformerFactory.newInstance ();
        try
        {
            if (indent) factoryXform.setAttribute ("indent-number", 4);
            javax.xml.transform.Transformer xform = factoryXform.newTransformer ();
            xform.setOutputProperty (OutputKeys.OMIT_XML_DECLARATION, "yes");
            xform.setOutputProperty (OutputKeys.INDENT, indent ? "yes" : "no");
            xform.transform (new DOMSource (node), new StreamResult (result));
        }
        catch (IllegalArgumentException | TransformerException e)
        {
            throw new IllegalStateException ("Failed to serialize XML", e);
        }
        return result.toString ();
    }

    /**
        Name of an element without any namespace prefix.
    **/
    public static String localName (Node node)
    {
        String result = node.getLocalName ();
        if (result != null) return result;
        result = node.getNodeName ();
        int colon = result.indexOf (':');
        if (colon >= 0) result = result.substring (colon + 1);
        return result;
    }

    /**
        Child elements in document order, skipping text, comments and processing instructions.
    **/
    public static List<Element> children (Node node)
    {
        List<Element> result = new ArrayList<Element> ();
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (child.getNodeType () == Node.ELEMENT_NODE) result.add ((Element) child);
        }
        return result;
    }

    public static String getText (Node node)
    {
        String result = "";
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            short type = child.getNodeType ();
            if (type == Node.TEXT_NODE  ||  type == Node.CDATA_SECTION_NODE) result = result + child.getNodeValue ();
        }
        return result;
    }

    public static String getAttribute (Node node, String name)
    {
        return getAttribute (node, name, "");
    }

    public static String getAttribute (Node node, String name, String defaultValue)
    {
        NamedNodeMap attributes = node.getAttributes ();
        if (attributes == null) return defaultValue;
        Node attribute = attributes.getNamedItem (name);
        if (attribute == null)
        {
            // Fall back on a prefixed attribute with the same local name, such as cellml:units
            for (int i = 0; i < attributes.getLength (); i++)
            {
                Node a = attributes.item (i);
                if (name.equals (localName (a))) return a.getNodeValue ();
            }
            return defaultValue;
        }
        return attribute.getNodeValue ();
    }
}
