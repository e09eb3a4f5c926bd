package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A precedence constraint between two executables of the same package.
 *
 * <p>{@link #condition} is {@link IrPrecedenceCondition#EXPRESSION} whenever the constraint is
 * evaluated with an expression; {@link #constraintValue} keeps the execution-result part
 * (Success/Failure/Completion) that {@code EXPRESSION_AND_CONSTRAINT} and
 * {@code EXPRESSION_OR_CONSTRAINT} combine with it.</p>
 */
@JsonPropertyOrder({"id","from","to","condition","expression","evalOp","constraintValue","logicalAnd"})
public final class IrPrecedenceEdge {
    public final String id;
    public final String from;
    public final String to;
    public final IrPrecedenceCondition condition;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String expression;

    public final IrPrecedenceEvalOp evalOp;
    public final IrPrecedenceCondition constraintValue;
    public final boolean logicalAnd;

    @JsonCreator
    public IrPrecedenceEdge(
            @JsonProperty("id") String id,
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("condition") IrPrecedenceCondition condition,
            @JsonProperty("expression") String expression,
            @JsonProperty("evalOp") IrPrecedenceEvalOp evalOp,
            @JsonProperty("constraintValue") IrPrecedenceCondition constraintValue,
            @JsonProperty("logicalAnd") Boolean logicalAnd
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.id = id == null || id.isBlank() ? from + "->" + to : id;
        this.condition = condition == null ? IrPrecedenceCondition.SUCCESS : condition;
        this.expression = expression == null || expression.isBlank() ? null : expression;
        this.evalOp = evalOp == null ? IrPrecedenceEvalOp.CONSTRAINT : evalOp;
        this.constraintValue = constraintValue == null ? IrPrecedenceCondition.SUCCESS : constraintValue;
        this.logicalAnd = logicalAnd == null || logicalAnd;
    }

    /** Convenience for plain constraint edges. */
    public static IrPrecedenceEdge of(String from, String to, IrPrecedenceCondition condition) {
        IrPrecedenceCondition value = condition == IrPrecedenceCondition.EXPRESSION ? IrPrecedenceCondition.SUCCESS : condition;
        return new IrPrecedenceEdge(null, from, to, condition, null, null, value, true);
    }

    public IrPrecedenceEdge withId(String newId) {
        return new IrPrecedenceEdge(newId, from, to, condition, expression, evalOp, constraintValue, logicalAnd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPrecedenceEdge)) return false;
        IrPrecedenceEdge that = (IrPrecedenceEdge) o;
        return logicalAnd == that.logicalAnd
                && id.equals(that.id) && from.equals(that.from) && to.equals(that.to)
                && condition == that.condition && Objects.equals(expression, that.expression)
                && evalOp == that.evalOp && constraintValue == that.constraintValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, from, to, condition, expression);
    }

    @Override
    public String toString() {
        return from + " -[" + condition + "]-> " + to;
    }
}
