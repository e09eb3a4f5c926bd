package info.isaksson.erland.dtsxmigrate.extract;

/**
 * Options for extracting one package.
 */
public final class ExtractOptions {
    /** Password or key material for sensitive values; null means redact. */
    public String decryptionCredential = null;

    public SensitiveValueDecryptor decryptor = null;

    /** Expressions longer than this many characters are flagged for manual review. */
    public int complexExpressionThreshold = 100;

    public ExtractOptions() {}

    public static ExtractOptions defaults() {
        return new ExtractOptions();
    }
}
