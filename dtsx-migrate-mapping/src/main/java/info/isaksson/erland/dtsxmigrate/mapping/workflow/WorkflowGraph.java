package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategy;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Output of {@link WorkflowGraphMapper}: one DAG per package plus the DAG-to-DAG triggers. */
@JsonPropertyOrder({"strategy","dags","triggers","diagnostics"})
public final class WorkflowGraph {
    public final IrStrategy strategy;
    public final List<WorkflowDag> dags;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<WorkflowTrigger> triggers;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrDiagnostic> diagnostics;

    public WorkflowGraph(IrStrategy strategy, List<WorkflowDag> dags, List<WorkflowTrigger> triggers, List<IrDiagnostic> diagnostics) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.dags = List.copyOf(dags);
        this.triggers = List.copyOf(triggers);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Optional<WorkflowDag> dagFor(String packageName) {
        return dags.stream().filter(d -> d.packageName.equals(packageName)).findFirst();
    }
}
