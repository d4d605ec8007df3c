/**
 *
 */
package org.signalq.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.jaxen.JaxenException;
import org.jaxen.dom.DOMXPath;
import org.signalq.network.AnnotationSet;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * This object provides XPath queries over a namespace-aware DOM document.  The compiled paths are cached,
 * and every path may use the namespace prefixes registered with the helper.  It also knows how to convert
 * an RDF annotation block into an annotation set.
 *
 */
public class XmlHelper {

    // FIELDS
    /** map of namespace prefixes to URIs */
    private Map<String, String> namespaces;
    /** cache of compiled paths */
    private Map<String, DOMXPath> xpaths;

    /** RDF namespace */
    public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    /** biology qualifier namespace */
    public static final String BQBIOL_NS = "http://biomodels.net/biology-qualifiers/";
    /** model qualifier namespace */
    public static final String BQMODEL_NS = "http://biomodels.net/model-qualifiers/";

    /**
     * Create an XML helper.
     *
     * @param namespaces	map of namespace prefixes to URIs
     */
    public XmlHelper(Map<String, String> namespaces) {
        this.namespaces = new HashMap<String, String>(namespaces);
        this.namespaces.put("rdf", RDF_NS);
        this.namespaces.put("bqbiol", BQBIOL_NS);
        this.namespaces.put("bqmodel", BQMODEL_NS);
        this.xpaths = new HashMap<String, DOMXPath>();
    }

    /**
     * Parse an XML file into a namespace-aware document.
     *
     * @param inFile	file to parse
     *
     * @return the document read
     *
     * @throws IOException
     */
    public static Document parse(File inFile) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(inFile);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Error parsing XML file " + inFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the compiled version of a path
     *
     * @param path	XPath expression to compile
     */
    private DOMXPath compile(String path) {
        DOMXPath retVal = this.xpaths.get(path);
        if (retVal == null) {
            try {
                retVal = new DOMXPath(path);
                for (Map.Entry<String, String> ns : this.namespaces.entrySet())
                    retVal.addNamespace(ns.getKey(), ns.getValue());
            } catch (JaxenException e) {
                throw new IllegalArgumentException("Invalid XPath expression \"" + path + "\".", e);
            }
            this.xpaths.put(path, retVal);
        }
        return retVal;
    }

    /**
     * Find all the elements matching a path.
     *
     * @param context	starting node
     * @param path		XPath expression
     *
     * @return a list of the matching elements, in document order
     */
    public List<Element> select(Node context, String path) {
        List<Element> retVal = new ArrayList<Element>();
        try {
            // Jaxen returns a raw list.
            for (Object found : this.compile(path).selectNodes(context)) {
                if (found instanceof Element)
                    retVal.add((Element) found);
            }
        } catch (JaxenException e) {
            throw new IllegalArgumentException("Error evaluating XPath expression \"" + path + "\".", e);
        }
        return retVal;
    }

    /**
     * Find the first element matching a path.
     *
     * @param context	starting node
     * @param path		XPath expression
     *
     * @return the first matching element, or NULL if there is none
     */
    public Element first(Node context, String path) {
        List<Element> found = this.select(context, path);
        return (found.isEmpty() ? null : found.get(0));
    }

    /**
     * Get the text of the first element matching a path.
     *
     * @param context	starting node
     * @param path		XPath expression
     * @param def		value to return if there is no match
     *
     * @return the trimmed text of the first matching element, or the default
     */
    public String text(Node context, String path, String def) {
        Element found = this.first(context, path);
        return (found == null ? def : found.getTextContent().trim());
    }

    /**
     * @return the value of an attribute, or NULL if it is absent
     *
     * @param element	element containing the attribute
     * @param name		attribute name
     */
    public static String attr(Element element, String name) {
        return (element.hasAttribute(name) ? element.getAttribute(name) : null);
    }

    /**
     * @return the numeric value of an attribute, or 0 if it is absent or invalid
     *
     * @param element	element containing the attribute
     * @param name		attribute name
     */
    public static double number(Element element, String name) {
        double retVal = 0.0;
        String value = attr(element, name);
        if (value != null) {
            try {
                retVal = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                retVal = 0.0;
            }
        }
        return retVal;
    }

    /**
     * Add the qualified resources in an RDF block to an annotation set.  Each qualifier is keyed by its
     * standard prefix ("bqbiol" or "bqmodel") and local name.
     *
     * @param rdf			RDF element to scan (may be NULL)
     * @param annotations	annotation set to update
     */
    public void readAnnotations(Element rdf, AnnotationSet annotations) {
        if (rdf != null) {
            for (Element qualifier : this.select(rdf, "./rdf:Description/*")) {
                String prefix = this.qualifierPrefix(qualifier.getNamespaceURI());
                if (prefix != null) {
                    String key = prefix + ":" + qualifier.getLocalName();
                    for (Element li : this.select(qualifier, ".//rdf:li")) {
                        String resource = li.getAttributeNS(RDF_NS, "resource");
                        if (! resource.isEmpty())
                            annotations.add(key, resource);
                    }
                }
            }
        }
    }

    /**
     * @return the standard prefix for a qualifier namespace, or NULL if it is not a qualifier namespace
     *
     * @param uri	namespace URI
     */
    private String qualifierPrefix(String uri) {
        String retVal = null;
        if (BQBIOL_NS.equals(uri))
            retVal = "bqbiol";
        else if (BQMODEL_NS.equals(uri))
            retVal = "bqmodel";
        return retVal;
    }

}
