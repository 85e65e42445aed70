package org.text2bpmn.generation.bpmn;

import org.text2bpmn.generation.bpmn.models.BoundsRect;
import org.text2bpmn.generation.exceptions.ValidationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMN_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.DC_NS;

/**
 * DOM plumbing for BPMN documents: parsing, serialization and diagram interchange lookups.
 */
public class BpmnDocumentHelper {

    /**
     * Parses BPMN text into a namespace-aware DOM with canonical prefixes.
     *
     * @throws ValidationException if the text is not well-formed XML
     */
    public static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(new InputSource(new StringReader(xml)));
            BpmnNamespaces.canonicalize(doc);
            return doc;
        } catch (SAXException | IOException e) {
            throw new ValidationException("BPMN document is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Serializes a document as indented UTF-8 text with an XML declaration.
     */
    public static String toXml(Document doc) {
        removeWhitespaceNodes(doc.getDocumentElement());
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            String xmlContent = stringWriter.toString();
            xmlContent = xmlContent.replaceAll(" standalone=\"(yes|no)\"", "");
            // the JDK serializer puts the root element on the declaration line
            xmlContent = xmlContent.replaceFirst("\\?><", "?>\n<");
            xmlContent = xmlContent.replaceAll("(\r?\n)\\s*\r?\n", "$1");
            return xmlContent;
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize BPMN document", e);
        }
    }

    /**
     * Writes a coordinate the way diagram tools do: integral values without a fraction.
     */
    public static String formatCoordinate(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static Element firstElement(Node parent, String namespaceUri, String localName) {
        NodeList nodes = parent instanceof Document doc
                ? doc.getElementsByTagNameNS(namespaceUri, localName)
                : ((Element) parent).getElementsByTagNameNS(namespaceUri, localName);
        return nodes.getLength() > 0 ? (Element) nodes.item(0) : null;
    }

    public static List<Element> elements(Node parent, String namespaceUri, String localName) {
        NodeList nodes = parent instanceof Document doc
                ? doc.getElementsByTagNameNS(namespaceUri, localName)
                : ((Element) parent).getElementsByTagNameNS(namespaceUri, localName);
        // copy, the live list shifts when nodes are removed
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Element findProcess(Document doc) {
        return firstElement(doc, BPMN_NS, "process");
    }

    public static Element findPlane(Document doc) {
        return firstElement(doc, BPMNDI_NS, "BPMNPlane");
    }

    /**
     * Shapes of a plane keyed by the id of the element they depict.
     */
    public static Map<String, Element> shapesByElementId(Element plane) {
        Map<String, Element> shapes = new HashMap<>();
        for (Element shape : elements(plane, BPMNDI_NS, "BPMNShape")) {
            String elementId = shape.getAttribute("bpmnElement");
            if (!elementId.isEmpty()) {
                shapes.putIfAbsent(elementId, shape);
            }
        }
        return shapes;
    }

    /**
     * Reads the {@code dc:Bounds} child of a shape or label.
     *
     * @return the bounds, or {@code null} if the shape has none or they are unreadable
     */
    public static BoundsRect readBounds(Element shape) {
        Element boundsEl = directChild(shape, DC_NS, "Bounds");
        if (boundsEl == null) {
            return null;
        }
        try {
            return new BoundsRect(
                    parseCoordinate(boundsEl.getAttribute("x")),
                    parseCoordinate(boundsEl.getAttribute("y")),
                    parseCoordinate(boundsEl.getAttribute("width")),
                    parseCoordinate(boundsEl.getAttribute("height")));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Replaces the bounds of a shape, creating the {@code dc:Bounds} child when missing.
     */
    public static void writeBounds(Element shape, BoundsRect bounds) {
        Element boundsEl = directChild(shape, DC_NS, "Bounds");
        if (boundsEl == null) {
            boundsEl = shape.getOwnerDocument().createElementNS(DC_NS, BpmnNamespaces.qualified(DC_NS, "Bounds"));
            shape.insertBefore(boundsEl, shape.getFirstChild());
        }
        boundsEl.setAttribute("x", formatCoordinate(bounds.x()));
        boundsEl.setAttribute("y", formatCoordinate(bounds.y()));
        boundsEl.setAttribute("width", formatCoordinate(bounds.width()));
        boundsEl.setAttribute("height", formatCoordinate(bounds.height()));
    }

    public static Element directChild(Element parent, String namespaceUri, String localName) {
        for (Element child : childElements(parent)) {
            if (namespaceUri.equals(child.getNamespaceURI()) && localName.equals(child.getLocalName())) {
                return child;
            }
        }
        return null;
    }

    static double parseCoordinate(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        return Double.parseDouble(value.trim());
    }

    private static void removeWhitespaceNodes(Element element) {
        Node child = element.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().isBlank()) {
                element.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceNodes((Element) child);
            }
            child = next;
        }
    }
}
