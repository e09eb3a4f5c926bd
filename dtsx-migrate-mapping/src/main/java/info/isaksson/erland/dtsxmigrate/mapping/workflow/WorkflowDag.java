package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** The workflow generated for one package. Tasks follow the package's executable order. */
@JsonPropertyOrder({"dagId","packageName","tasks","dependencies"})
public final class WorkflowDag {
    public final String dagId;
    public final String packageName;
    public final List<WorkflowTask> tasks;
    public final List<WorkflowDependency> dependencies;

    public WorkflowDag(String dagId, String packageName, List<WorkflowTask> tasks, List<WorkflowDependency> dependencies) {
        this.dagId = Objects.requireNonNull(dagId, "dagId");
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.tasks = List.copyOf(tasks);
        this.dependencies = List.copyOf(dependencies);
    }

    public Optional<WorkflowTask> task(String taskId) {
        return tasks.stream().filter(t -> t.id.equals(taskId)).findFirst();
    }

    public Optional<WorkflowTask> taskFor(String executableId) {
        return tasks.stream().filter(t -> t.executableId.equals(executableId)).findFirst();
    }
}
