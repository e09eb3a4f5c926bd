package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One task of a workflow DAG, derived from one executable.
 *
 * <p>{@link #groupId} is the task id of the enclosing container task, null at top level.
 * {@link #branchCondition} carries the precedence expression(s) that gate the task; the target
 * workflow has to evaluate it before running the task.</p>
 */
@JsonPropertyOrder({"id","executableId","name","operator","groupId","triggerRule","branchCondition","lowConfidence","disabled","params"})
public final class WorkflowTask {
    public final String id;
    public final String executableId;
    public final String name;
    public final OperatorKind operator;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String groupId;

    public final TriggerRule triggerRule;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String branchCondition;

    public final boolean lowConfidence;
    public final boolean disabled;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> params;

    public WorkflowTask(String id, String executableId, String name, OperatorKind operator, String groupId,
                        TriggerRule triggerRule, String branchCondition, boolean lowConfidence, boolean disabled,
                        Map<String, String> params) {
        this.id = Objects.requireNonNull(id, "id");
        this.executableId = Objects.requireNonNull(executableId, "executableId");
        this.name = name;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.groupId = groupId;
        this.triggerRule = triggerRule == null ? TriggerRule.ALL_SUCCESS : triggerRule;
        this.branchCondition = branchCondition;
        this.lowConfidence = lowConfidence;
        this.disabled = disabled;
        this.params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(params));
    }

    @Override
    public String toString() {
        return id + " (" + operator + ")";
    }
}
