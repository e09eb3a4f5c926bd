package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition;

import java.util.Objects;

/** An upstream/downstream edge between two tasks of one DAG, mapped from a precedence edge. */
@JsonPropertyOrder({"upstream","downstream","condition","expression"})
public final class WorkflowDependency {
    public final String upstream;
    public final String downstream;
    public final IrPrecedenceCondition condition;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String expression;

    public WorkflowDependency(String upstream, String downstream, IrPrecedenceCondition condition, String expression) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.expression = expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDependency)) return false;
        WorkflowDependency that = (WorkflowDependency) o;
        return upstream.equals(that.upstream) && downstream.equals(that.downstream)
                && condition == that.condition && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(upstream, downstream, condition, expression);
    }

    @Override
    public String toString() {
        return upstream + " >> " + downstream;
    }
}
