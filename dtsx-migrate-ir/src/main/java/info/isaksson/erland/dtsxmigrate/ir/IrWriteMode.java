package info.isaksson.erland.dtsxmigrate.ir;

public enum IrWriteMode {
    /** Bulk (fast-load) append. */
    APPEND,
    /** Row-by-row insert. */
    INSERT
}
