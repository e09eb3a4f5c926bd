package info.isaksson.erland.dtsxmigrate.ir;

public enum IrExecutableKind {
    EXECUTE_SQL,
    DATA_FLOW,
    SCRIPT,
    SEQUENCE_CONTAINER,
    FOR_EACH_LOOP,
    EXECUTE_PACKAGE,
    UNKNOWN
}
