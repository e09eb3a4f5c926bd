package info.isaksson.erland.dtsxmigrate.ir.diag;

import static info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticKind.*;
import static info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticSeverity.*;

/** Stable diagnostic codes. Each code belongs to exactly one {@link DiagnosticKind}. */
public enum DiagnosticCode {
    MALFORMED_DOCUMENT_ERROR(MALFORMED_DOCUMENT, ERROR),

    DUPLICATE_EXECUTABLE_ID(INVARIANT_VIOLATION, ERROR),
    DANGLING_PRECEDENCE_REFERENCE(INVARIANT_VIOLATION, ERROR),
    PRECEDENCE_CYCLE(INVARIANT_VIOLATION, ERROR),
    DUPLICATE_COMPONENT_ID(INVARIANT_VIOLATION, ERROR),
    DANGLING_PATH(INVARIANT_VIOLATION, ERROR),
    DUPLICATE_INPUT_PATH(INVARIANT_VIOLATION, ERROR),
    DATAFLOW_CYCLE(INVARIANT_VIOLATION, ERROR),

    UNKNOWN_EXECUTABLE(UNSUPPORTED_CONSTRUCT, WARNING),
    UNKNOWN_COMPONENT(UNSUPPORTED_CONSTRUCT, WARNING),
    UNKNOWN_CONNECTION_KIND(UNSUPPORTED_CONSTRUCT, WARNING),
    UNKNOWN_PROTECTION_LEVEL(UNSUPPORTED_CONSTRUCT, WARNING),
    EXPRESSION_DOWNGRADED(UNSUPPORTED_CONSTRUCT, WARNING),
    UNRECOGNIZED_PRECEDENCE_VALUE(UNSUPPORTED_CONSTRUCT, WARNING),
    MALFORMED_CONSTRAINT(UNSUPPORTED_CONSTRUCT, WARNING),
    UNRESOLVED_REFERENCE(UNSUPPORTED_CONSTRUCT, WARNING),
    UNRESOLVED_CONNECTION_REFERENCE(UNSUPPORTED_CONSTRUCT, WARNING),
    UNRESOLVED_PACKAGE_REFERENCE(UNSUPPORTED_CONSTRUCT, WARNING),
    DUPLICATE_PACKAGE_NAME(UNSUPPORTED_CONSTRUCT, WARNING),
    PROJECT_SCOPE_CONFLICT(UNSUPPORTED_CONSTRUCT, WARNING),
    MIXED_TRIGGER_CONDITIONS(UNSUPPORTED_CONSTRUCT, WARNING),

    REDACTED_VALUE(REDACTED_SENSITIVE_VALUE, INFO),
    DECRYPTION_FAILED(REDACTED_SENSITIVE_VALUE, WARNING),

    PROJECT_CYCLE(PROJECT_CYCLE_DETECTED, ERROR),

    ENCRYPTED_PACKAGE(ADVISORY, WARNING),
    MANUAL_REVIEW(ADVISORY, INFO),
    COMPLEX_EXPRESSION(ADVISORY, INFO),
    HARDCODED_CREDENTIAL(ADVISORY, WARNING),
    CLASSIFICATION_SKIPPED(ADVISORY, WARNING),

    INTERNAL_ERROR(PROCESSING_FAILURE, ERROR),
    INTERRUPTED(PROCESSING_FAILURE, ERROR);

    public final DiagnosticKind kind;
    public final DiagnosticSeverity defaultSeverity;

    DiagnosticCode(DiagnosticKind kind, DiagnosticSeverity defaultSeverity) {
        this.kind = kind;
        this.defaultSeverity = defaultSeverity;
    }
}
