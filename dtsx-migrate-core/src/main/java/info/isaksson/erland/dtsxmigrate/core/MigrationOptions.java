package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.extract.ExtractOptions;
import info.isaksson.erland.dtsxmigrate.extract.SensitiveValueDecryptor;
import info.isaksson.erland.dtsxmigrate.mapping.sql.TargetDialect;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for a migration run.
 *
 * <p>Structured like command-line flags; every field has a usable default.</p>
 */
public final class MigrationOptions {
    /** Credential for packages saved with a password protection level. Never logged. */
    public String decryptionCredential = null;

    /** Decrypts sensitive values with {@link #decryptionCredential}; null redacts them. */
    public SensitiveValueDecryptor decryptor = null;

    /** Worker threads for per-package parsing. */
    public int parallelism = Runtime.getRuntime().availableProcessors();

    public boolean rewriteSqlDialect = true;
    public TargetDialect targetDialect = TargetDialect.SNOWFLAKE;

    /** Expressions longer than this many characters get a {@code COMPLEX_EXPRESSION} advisory. */
    public int complexExpressionThreshold = 100;

    /** Glob patterns, relative to the project root, of packages to skip when scanning a directory. */
    public List<String> excludeGlobs = new ArrayList<>();

    ExtractOptions toExtractOptions() {
        ExtractOptions o = new ExtractOptions();
        o.decryptionCredential = decryptionCredential;
        o.decryptor = decryptor;
        o.complexExpressionThreshold = complexExpressionThreshold;
        return o;
    }
}
