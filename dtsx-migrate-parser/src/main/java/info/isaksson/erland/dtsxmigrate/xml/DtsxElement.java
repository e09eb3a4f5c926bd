package info.isaksson.erland.dtsxmigrate.xml;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read-only view of one element of a package document.
 *
 * <p>Names are given as {@code prefix:local}, the prefix resolved through the document's
 * {@link DtsxNamespaces}. A name without prefix matches the local name in any namespace
 * (case-insensitively for elements), which is how task-specific payloads are addressed.</p>
 */
public final class DtsxElement {

    private static final String PROPERTY = "DTS:Property";

    private final Element element;
    private final DtsxNamespaces namespaces;

    DtsxElement(Element element, DtsxNamespaces namespaces) {
        this.element = element;
        this.namespaces = namespaces;
    }

    public String localName() {
        String local = element.getLocalName();
        return local == null ? element.getNodeName() : local;
    }

    public String namespaceUri() {
        return element.getNamespaceURI();
    }

    public boolean is(String qname) {
        return matches(element, qname);
    }

    public Optional<DtsxElement> child(String qname) {
        for (DtsxElement c : children()) {
            if (c.is(qname)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public List<DtsxElement> children(String qname) {
        List<DtsxElement> out = new ArrayList<>();
        for (DtsxElement c : children()) {
            if (c.is(qname)) out.add(c);
        }
        return out;
    }

    public List<DtsxElement> children() {
        List<DtsxElement> out = new ArrayList<>();
        NodeList nl = element.getChildNodes();
        for (int i = 0; i < nl.getLength(); i++) {
            Node n = nl.item(i);
            if (n instanceof Element e) out.add(new DtsxElement(e, namespaces));
        }
        return out;
    }

    /** Follow a chain of child names, e.g. {@code path("DTS:ObjectData", "pipeline", "components")}. */
    public Optional<DtsxElement> path(String... qnames) {
        Optional<DtsxElement> cur = Optional.of(this);
        for (String q : qnames) {
            cur = cur.flatMap(e -> e.child(q));
            if (cur.isEmpty()) return cur;
        }
        return cur;
    }

    /** All descendants (excluding this element) matching {@code qname}, in document order. */
    public List<DtsxElement> descendants(String qname) {
        List<DtsxElement> out = new ArrayList<>();
        for (DtsxElement c : children()) {
            c.walk(e -> {
                if (e.is(qname)) out.add(e);
            });
        }
        return out;
    }

    /** Depth-first, pre-order traversal starting with this element. */
    public void walk(Consumer<DtsxElement> visitor) {
        visitor.accept(this);
        for (DtsxElement c : children()) {
            c.walk(visitor);
        }
    }

    public Optional<DtsxElement> parent() {
        Node p = element.getParentNode();
        return p instanceof Element e ? Optional.of(new DtsxElement(e, namespaces)) : Optional.empty();
    }

    /**
     * Attribute value, or null when absent.
     *
     * <p>{@code "DTS:ObjectName"} requires the DTS namespace; {@code "ObjectName"} matches the local
     * name in any namespace or none.</p>
     */
    public String attr(String qname) {
        int colon = qname.indexOf(':');
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String local = a.getLocalName() == null ? a.getName() : a.getLocalName();
            if (colon < 0) {
                if (local.equals(qname) && !"http://www.w3.org/2000/xmlns/".equals(a.getNamespaceURI())) return a.getValue();
            } else if (local.equals(qname.substring(colon + 1))
                    && DtsxNamespaces.sameNamespace(a.getNamespaceURI(), namespaces.uri(qname.substring(0, colon)))) {
                return a.getValue();
            }
        }
        return null;
    }

    /** Attribute by local name in any namespace, falling back to {@code fallback} when absent or blank. */
    public String attr(String qname, String fallback) {
        String v = attr(qname);
        return v == null || v.isBlank() ? fallback : v;
    }

    /** All attributes keyed by local name, in document order. */
    public Map<String, String> attributes() {
        Map<String, String> out = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if ("http://www.w3.org/2000/xmlns/".equals(a.getNamespaceURI())) continue;
            out.put(a.getLocalName() == null ? a.getName() : a.getLocalName(), a.getValue());
        }
        return out;
    }

    /** Text of the child {@code <DTS:Property DTS:Name="name">}, or null. */
    public String property(String name) {
        for (DtsxElement p : children(PROPERTY)) {
            if (name.equals(p.attr("Name"))) return p.text();
        }
        return null;
    }

    /** Child {@code DTS:Property} elements keyed by their name, in document order. */
    public Map<String, DtsxElement> properties() {
        Map<String, DtsxElement> out = new LinkedHashMap<>();
        for (DtsxElement p : children(PROPERTY)) {
            String n = p.attr("Name");
            if (n != null) out.putIfAbsent(n, p);
        }
        return out;
    }

    /**
     * The {@code DTS:<name>} attribute, falling back to the {@code <DTS:Property DTS:Name="<name>">}
     * child used by older package formats.
     */
    public String attrOrProperty(String name) {
        String v = attr("DTS:" + name);
        if (v == null) v = attr(name);
        if (v == null) v = property(name);
        return v;
    }

    /** Trimmed text content, never null. */
    public String text() {
        String t = element.getTextContent();
        return t == null ? "" : t.trim();
    }

    /** Text content with whitespace preserved. */
    public String rawText() {
        String t = element.getTextContent();
        return t == null ? "" : t;
    }

    private boolean matches(Element e, String qname) {
        String local = e.getLocalName() == null ? e.getNodeName() : e.getLocalName();
        int colon = qname.indexOf(':');
        if (colon < 0) return local.equalsIgnoreCase(qname);
        return local.equals(qname.substring(colon + 1))
                && DtsxNamespaces.sameNamespace(e.getNamespaceURI(), namespaces.uri(qname.substring(0, colon)));
    }

    @Override
    public String toString() {
        return "<" + element.getNodeName() + ">";
    }
}
