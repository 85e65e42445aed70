package org.text2bpmn.generation.bpmn;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The namespace prefix bindings shared by every document the pipeline reads or writes.
 * Fragments rendered independently may use other prefixes for the same namespaces;
 * they are rewritten to these before merging so nodes can move between documents.
 */
public final class BpmnNamespaces {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;

    private static final Map<String, String> PREFIX_BY_NAMESPACE;

    static {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put(BPMN_NS, "bpmn");
        prefixes.put(BPMNDI_NS, "bpmndi");
        prefixes.put(DC_NS, "dc");
        prefixes.put(DI_NS, "di");
        prefixes.put(XSI_NS, "xsi");
        PREFIX_BY_NAMESPACE = Map.copyOf(prefixes);
    }

    private BpmnNamespaces() {
    }

    public static String prefixOf(String namespaceUri) {
        return namespaceUri == null ? null : PREFIX_BY_NAMESPACE.get(namespaceUri);
    }

    /**
     * Qualified name for a new element or attribute, e.g. {@code bpmndi:BPMNShape}.
     */
    public static String qualified(String namespaceUri, String localName) {
        return prefixOf(namespaceUri) + ":" + localName;
    }

    /**
     * Rewrites element and attribute prefixes to the shared bindings and declares all of
     * them on the document element.
     */
    public static void canonicalize(Document doc) {
        NodeList all = doc.getElementsByTagNameNS("*", "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element el = (Element) all.item(i);
            String prefix = prefixOf(el.getNamespaceURI());
            if (prefix != null && !prefix.equals(el.getPrefix())) {
                el.setPrefix(prefix);
            }
            if (el.hasAttributeNS(XSI_NS, "type")) {
                Attr typeAttr = el.getAttributeNodeNS(XSI_NS, "type");
                if (!"xsi".equals(typeAttr.getPrefix())) {
                    typeAttr.setPrefix("xsi");
                }
                typeAttr.setValue(canonicalTypeName(el, typeAttr.getValue()));
            }
        }

        Element root = doc.getDocumentElement();
        // declared last, the old declarations are still needed to resolve xsi:type values above
        PREFIX_BY_NAMESPACE.forEach((uri, prefix) ->
                root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + prefix, uri));
    }

    // xsi:type holds a QName whose prefix must survive the move into another document
    private static String canonicalTypeName(Element el, String typeName) {
        int colon = typeName.indexOf(':');
        String prefix = colon > 0 ? typeName.substring(0, colon) : null;
        String namespaceUri = el.lookupNamespaceURI(prefix);
        String canonical = prefixOf(namespaceUri);
        if (canonical == null) {
            return typeName;
        }
        return canonical + ":" + typeName.substring(colon + 1);
    }
}
