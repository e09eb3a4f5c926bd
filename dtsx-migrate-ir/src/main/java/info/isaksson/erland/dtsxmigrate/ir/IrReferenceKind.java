package info.isaksson.erland.dtsxmigrate.ir;

public enum IrReferenceKind {
    VARIABLE,
    PACKAGE_PARAMETER,
    PROJECT_PARAMETER,
    SYSTEM
}
