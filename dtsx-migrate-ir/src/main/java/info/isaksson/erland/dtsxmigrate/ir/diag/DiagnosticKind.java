package info.isaksson.erland.dtsxmigrate.ir.diag;

/** Error taxonomy of the pipeline. */
public enum DiagnosticKind {
    /** The document is not a well-formed package; fatal for that package. */
    MALFORMED_DOCUMENT,
    /** Duplicate id, dangling edge reference or cycle. */
    INVARIANT_VIOLATION,
    /** Degraded into an {@code Unknown} node or a downgraded edge; never fatal. */
    UNSUPPORTED_CONSTRUCT,
    REDACTED_SENSITIVE_VALUE,
    /** Cross-package cycle; fails the project merge only. */
    PROJECT_CYCLE_DETECTED,
    /** Manual-review and security hints that do not change the IR. */
    ADVISORY,
    PROCESSING_FAILURE
}
