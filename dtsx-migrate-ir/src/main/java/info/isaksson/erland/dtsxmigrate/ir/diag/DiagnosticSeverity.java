package info.isaksson.erland.dtsxmigrate.ir.diag;

public enum DiagnosticSeverity {
    INFO,
    WARNING,
    ERROR
}
