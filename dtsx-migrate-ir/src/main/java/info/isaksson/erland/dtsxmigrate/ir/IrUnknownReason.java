package info.isaksson.erland.dtsxmigrate.ir;

public enum IrUnknownReason {
    /** The type tag is not one of the supported variants. */
    UNRECOGNIZED_TYPE,
    /** A data flow whose component graph is cyclic or mis-wired. */
    DATAFLOW_INVALID
}
