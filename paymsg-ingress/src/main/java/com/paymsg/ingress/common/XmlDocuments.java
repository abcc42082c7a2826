package com.paymsg.ingress.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Namespace-aware, XXE-hardened DOM parsing shared by the readers and the
 * validator, plus a few element helpers.
 */
public final class XmlDocuments {

    private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY;

    static {
        DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
        DOCUMENT_BUILDER_FACTORY.setNamespaceAware(true);
        // Security: Disable external entity resolution to prevent XXE attacks
        try {
            DOCUMENT_BUILDER_FACTORY.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-general-entities", false);
            DOCUMENT_BUILDER_FACTORY.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            log.warn("Failed to configure XML parser security features", e);
        }
        DOCUMENT_BUILDER_FACTORY.setExpandEntityReferences(false);
    }

    private static final ErrorHandler QUIET_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parse warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlDocuments() {
    }

    /**
     * Parses raw bytes into a DOM document. The encoding declared in the XML
     * prolog is honoured.
     *
     * @throws XmlParseException if the bytes are not well-formed XML
     */
    public static Document parse(byte[] raw) throws XmlParseException {
        if (raw == null || raw.length == 0) {
            throw new XmlParseException("XML message cannot be null or empty");
        }
        try (InputStream inputStream = new ByteArrayInputStream(raw)) {
            DocumentBuilder documentBuilder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            documentBuilder.setErrorHandler(QUIET_ERROR_HANDLER);
            Document document = documentBuilder.parse(inputStream);
            if (document.getDocumentElement() == null) {
                throw new XmlParseException("XML document has no root element");
            }
            return document;
        } catch (ParserConfigurationException e) {
            throw new XmlParseException("Failed to configure XML parser", e);
        } catch (SAXException e) {
            throw new XmlParseException("Failed to parse XML message: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new XmlParseException("Failed to read XML message", e);
        }
    }

    /**
     * Local name of an element, without any namespace prefix.
     */
    public static String localName(Element element) {
        if (element == null) {
            return null;
        }
        String localName = element.getLocalName();
        String name = localName != null && !localName.isEmpty() ? localName : element.getTagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * Gets the first child element (skipping text nodes and other non-element nodes).
     */
    public static Element firstChildElement(Element parent) {
        if (parent == null) {
            return null;
        }
        Node node = parent.getFirstChild();
        while (node != null) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                return (Element) node;
            }
            node = node.getNextSibling();
        }
        return null;
    }

    /**
     * Finds the first descendant (or the element itself) with the given local
     * name, in document order.
     */
    public static Element findFirst(Element scope, String localName) {
        if (scope == null) {
            return null;
        }
        if (localName.equals(localName(scope))) {
            return scope;
        }
        org.w3c.dom.NodeList matches = scope.getElementsByTagNameNS("*", localName);
        return matches.getLength() > 0 ? (Element) matches.item(0) : null;
    }

    /**
     * Namespace governing an element: its resolved namespace URI, else an
     * explicit default namespace declaration, else none.
     */
    public static String namespaceOf(Element element) {
        if (element == null) {
            return null;
        }
        String namespaceUri = element.getNamespaceURI();
        if (namespaceUri != null && !namespaceUri.isEmpty()) {
            return namespaceUri;
        }
        String declared = element.getAttribute("xmlns");
        return declared.isEmpty() ? null : declared;
    }

    /**
     * Exception thrown when raw bytes cannot be parsed as XML.
     */
    public static class XmlParseException extends Exception {
        public XmlParseException(String message) {
            super(message);
        }

        public XmlParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
