package info.isaksson.erland.dtsxmigrate.ir;

public enum IrPrecedenceCondition {
    SUCCESS,
    FAILURE,
    COMPLETION,
    EXPRESSION
}
