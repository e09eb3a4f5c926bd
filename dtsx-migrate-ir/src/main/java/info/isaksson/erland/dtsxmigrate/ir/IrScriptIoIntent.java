package info.isaksson.erland.dtsxmigrate.ir;

/** Whether a script task reaches outside the warehouse (files, network, mail). */
public enum IrScriptIoIntent {
    EXTERNAL_IO,
    NONE,
    UNKNOWN
}
