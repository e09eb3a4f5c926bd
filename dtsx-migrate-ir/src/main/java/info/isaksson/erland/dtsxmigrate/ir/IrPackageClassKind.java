package info.isaksson.erland.dtsxmigrate.ir;

public enum IrPackageClassKind {
    TRANSFORM,
    INGESTION,
    MIXED
}
