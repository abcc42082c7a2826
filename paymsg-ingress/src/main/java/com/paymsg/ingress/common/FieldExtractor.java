package com.paymsg.ingress.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Null-safe, namespace-agnostic lookups over a parsed ISO 20022 document.
 *
 * <p>Location expressions are XPath written with an {@code ns:} prefix on
 * every element step, e.g. {@code .//ns:GrpHdr/ns:MsgId}. When the document
 * has a namespace the prefix is bound to it; when it has none the prefix is
 * stripped, so the same expression works for both.</p>
 *
 * <p>A {@code " | "} separated expression is a list of alternatives tried
 * left to right; the first one yielding a non-empty result wins. This is
 * deliberately not an XPath union, which would return matches in document
 * order.</p>
 *
 * <p>Lookups never throw: an invalid expression, a missing context or an
 * unparseable document all yield null or an empty list.</p>
 */
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    static final String PREFIX = "ns";
    private static final String ALTERNATIVE_SEPARATOR = "\\s+\\|\\s+";

    private final Element context;
    private final String namespace;
    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public FieldExtractor(Element context, String namespace) {
        this.context = context;
        this.namespace = namespace != null && !namespace.isEmpty() ? namespace : null;
        this.xpath = XPathFactory.newInstance().newXPath();
        if (this.namespace != null) {
            this.xpath.setNamespaceContext(new SinglePrefixContext(this.namespace));
        }
    }

    /**
     * Extractor over nothing: every lookup yields null or an empty list.
     */
    public static FieldExtractor empty() {
        return new FieldExtractor(null, null);
    }

    /**
     * Extractor for an element, bound to the namespace that element lives in.
     */
    public static FieldExtractor forElement(Element element) {
        return new FieldExtractor(element, XmlDocuments.namespaceOf(element));
    }

    public Element getContext() {
        return context;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isEmpty() {
        return context == null;
    }

    /**
     * Trimmed text of the first match relative to the document context.
     */
    public String text(String path) {
        return text(context, path);
    }

    /**
     * Trimmed text of the first match relative to {@code node}; null when
     * nothing matches or the match is blank.
     */
    public String text(Node node, String path) {
        if (node == null || path == null) {
            return null;
        }
        for (String alternative : path.split(ALTERNATIVE_SEPARATOR)) {
            NodeList matches = evaluate(node, alternative);
            if (matches != null && matches.getLength() > 0) {
                String value = clean(matches.item(0).getTextContent());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Elements matching {@code path} relative to the document context.
     */
    public List<Element> nodes(String path) {
        return nodes(context, path);
    }

    /**
     * Elements matching the first non-empty alternative, in document order.
     */
    public List<Element> nodes(Node node, String path) {
        if (node == null || path == null) {
            return Collections.emptyList();
        }
        for (String alternative : path.split(ALTERNATIVE_SEPARATOR)) {
            NodeList matches = evaluate(node, alternative);
            List<Element> elements = new ArrayList<>();
            if (matches != null) {
                for (int i = 0; i < matches.getLength(); i++) {
                    if (matches.item(i).getNodeType() == Node.ELEMENT_NODE) {
                        elements.add((Element) matches.item(i));
                    }
                }
            }
            if (!elements.isEmpty()) {
                return elements;
            }
        }
        return Collections.emptyList();
    }

    /**
     * Trimmed, non-blank texts of every match of the first non-empty alternative.
     */
    public List<String> texts(Node node, String path) {
        if (node == null || path == null) {
            return Collections.emptyList();
        }
        for (String alternative : path.split(ALTERNATIVE_SEPARATOR)) {
            NodeList matches = evaluate(node, alternative);
            List<String> values = new ArrayList<>();
            if (matches != null) {
                for (int i = 0; i < matches.getLength(); i++) {
                    String value = clean(matches.item(i).getTextContent());
                    if (value != null) {
                        values.add(value);
                    }
                }
            }
            if (!values.isEmpty()) {
                return values;
            }
        }
        return Collections.emptyList();
    }

    private NodeList evaluate(Node node, String expression) {
        String effective = namespace != null ? expression.trim() : expression.trim().replace(PREFIX + ":", "");
        if (effective.isEmpty()) {
            return null;
        }
        try {
            XPathExpression xpathExpression = compiled.get(effective);
            if (xpathExpression == null) {
                xpathExpression = xpath.compile(effective);
                compiled.put(effective, xpathExpression);
            }
            return (NodeList) xpathExpression.evaluate(node, XPathConstants.NODESET);
        } catch (XPathExpressionException | ClassCastException e) {
            log.warn("Cannot evaluate location expression '{}': {}", expression, e.getMessage());
            return null;
        }
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Binds the single {@code ns} prefix to the document namespace.
     */
    private static final class SinglePrefixContext implements NamespaceContext {

        private final String namespaceUri;

        private SinglePrefixContext(String namespaceUri) {
            this.namespaceUri = namespaceUri;
        }

        @Override
        public String getNamespaceURI(String prefix) {
            if (PREFIX.equals(prefix)) {
                return namespaceUri;
            }
            if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
                return XMLConstants.XML_NS_URI;
            }
            return XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String uri) {
            return namespaceUri.equals(uri) ? PREFIX : null;
        }

        @Override
        public Iterator<String> getPrefixes(String uri) {
            return namespaceUri.equals(uri)
                ? Collections.singletonList(PREFIX).iterator()
                : Collections.emptyIterator();
        }
    }
}
