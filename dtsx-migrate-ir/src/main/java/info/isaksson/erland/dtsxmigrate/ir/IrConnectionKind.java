package info.isaksson.erland.dtsxmigrate.ir;

public enum IrConnectionKind {
    RELATIONAL,
    FILE,
    HTTP,
    WAREHOUSE,
    UNKNOWN;

    /** File and HTTP connections move data across the warehouse boundary. */
    public boolean external() {
        return this == FILE || this == HTTP;
    }
}
