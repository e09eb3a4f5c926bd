package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A task of one DAG that triggers another DAG. */
@JsonPropertyOrder({"dagId","taskId","triggeredDagId"})
public final class WorkflowTrigger {
    public final String dagId;
    public final String taskId;
    public final String triggeredDagId;

    public WorkflowTrigger(String dagId, String taskId, String triggeredDagId) {
        this.dagId = Objects.requireNonNull(dagId, "dagId");
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.triggeredDagId = Objects.requireNonNull(triggeredDagId, "triggeredDagId");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowTrigger)) return false;
        WorkflowTrigger that = (WorkflowTrigger) o;
        return dagId.equals(that.dagId) && taskId.equals(that.taskId) && triggeredDagId.equals(that.triggeredDagId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dagId, taskId, triggeredDagId);
    }
}
