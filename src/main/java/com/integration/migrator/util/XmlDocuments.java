package com.integration.migrator.util;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import lombok.experimental.UtilityClass;

/**
 * DOM helpers shared by the orchestration and binding parsers.
 */
@UtilityClass
public class XmlDocuments {

    private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

    /**
     * Parses an XML string with a namespace-aware builder that rejects DOCTYPE declarations.
     * The XML declaration's encoding is ignored since the input is already decoded.
     */
    public static Document parse(String xml) throws SAXException, IOException {
        DocumentBuilder builder;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            builder = factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration is not supported", e);
        }
        builder.setErrorHandler(new RethrowingErrorHandler());
        return builder.parse(new InputSource(new StringReader(xml)));
    }

    /**
     * Direct element children, optionally restricted to a local name.
     */
    public static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && (localName == null || localName.equals(localNameOf(node)))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * All descendant elements with the given local name, in document order.
     */
    public static List<Element> descendants(Element root, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = root.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static Element firstChild(Element parent, String localName) {
        List<Element> children = childElements(parent, localName);
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Trimmed text of the first child with the given local name, or null when absent or blank.
     */
    public static String childText(Element parent, String localName) {
        Element child = firstChild(parent, localName);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /**
     * Attribute value, or null when absent or blank.
     */
    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isBlank() ? null : value;
    }

    private static String localNameOf(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
