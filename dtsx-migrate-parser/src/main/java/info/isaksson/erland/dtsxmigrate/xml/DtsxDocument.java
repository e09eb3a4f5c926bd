package info.isaksson.erland.dtsxmigrate.xml;

import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Namespace-aware tree over one package document.
 *
 * <p>Parsing is strict: anything that is not well-formed XML fails with
 * {@link MalformedDocumentException}. DOCTYPE declarations and external entities are rejected.</p>
 */
public final class DtsxDocument {

    private final String sourceName;
    private final DtsxNamespaces namespaces;
    private final DtsxElement root;

    private DtsxDocument(String sourceName, DtsxNamespaces namespaces, DtsxElement root) {
        this.sourceName = sourceName;
        this.namespaces = namespaces;
        this.root = root;
    }

    public static DtsxDocument parse(String sourceName, byte[] content) throws MalformedDocumentException {
        return parse(sourceName, content, DtsxNamespaces.defaults());
    }

    public static DtsxDocument parse(String sourceName, byte[] content, DtsxNamespaces namespaces) throws MalformedDocumentException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(namespaces, "namespaces");
        if (content == null || content.length == 0) {
            throw new MalformedDocumentException(sourceName, "Document is empty");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            Document doc = builder.parse(new ByteArrayInputStream(content));
            if (doc.getDocumentElement() == null) {
                throw new MalformedDocumentException(sourceName, "Document has no root element");
            }
            return new DtsxDocument(sourceName, namespaces, new DtsxElement(doc.getDocumentElement(), namespaces));
        } catch (SAXParseException e) {
            throw new MalformedDocumentException(sourceName,
                    "Not well-formed at line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException(sourceName, "Cannot parse document: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public String sourceName() {
        return sourceName;
    }

    public DtsxNamespaces namespaces() {
        return namespaces;
    }

    public DtsxElement root() {
        return root;
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);
        return dbf;
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            // Warnings do not affect well-formedness.
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
