package info.isaksson.erland.dtsxmigrate.ir;

/** How a precedence constraint combines its constraint value with its expression. */
public enum IrPrecedenceEvalOp {
    CONSTRAINT,
    EXPRESSION,
    EXPRESSION_AND_CONSTRAINT,
    EXPRESSION_OR_CONSTRAINT;

    public boolean usesExpression() {
        return this != CONSTRAINT;
    }
}
