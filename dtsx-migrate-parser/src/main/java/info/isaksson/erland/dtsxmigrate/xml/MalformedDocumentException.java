package info.isaksson.erland.dtsxmigrate.xml;

/** The package document is not well-formed XML, or its root is not a package executable. */
public class MalformedDocumentException extends Exception {

    private final String sourceName;

    public MalformedDocumentException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public MalformedDocumentException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
