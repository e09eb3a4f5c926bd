package info.isaksson.erland.dtsxmigrate.ir;

/** What a data-flow source or destination reads from or writes to. */
public enum IrEndpointBinding {
    WAREHOUSE,
    FILE,
    API,
    UNKNOWN;

    public boolean external() {
        return this == FILE || this == API;
    }
}
