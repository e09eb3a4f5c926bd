package info.isaksson.erland.dtsxmigrate.ir;

public enum IrExpressionScope {
    PACKAGE,
    EXECUTABLE,
    CONNECTION,
    VARIABLE
}
