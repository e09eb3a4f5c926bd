package info.isaksson.erland.dtsxmigrate.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrProjectGraph;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategyDecision;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import info.isaksson.erland.dtsxmigrate.mapping.sql.SqlProject;
import info.isaksson.erland.dtsxmigrate.mapping.workflow.WorkflowGraph;
import info.isaksson.erland.dtsxmigrate.project.ProjectCycle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Outcome of migrating a whole project. */
@JsonPropertyOrder({"status","packages","projectParameters","graph","cycle","decision","workflow","sqlProject","diagnostics"})
public final class ProjectResult {
    public final ProjectStatus status;

    /** One result per input package, in input order. */
    public final List<PackageResult> packages;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrParameter> projectParameters;

    public final IrProjectGraph graph;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final ProjectCycle cycle;

    public final IrStrategyDecision decision;

    /** Null when the strategy needs no workflow or the project graph has a cycle. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final WorkflowGraph workflow;

    /** Null when the strategy needs no SQL project or the project graph has a cycle. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final SqlProject sqlProject;

    /** Project-scope diagnostics; package diagnostics stay on their {@link PackageResult}. */
    public final List<IrDiagnostic> diagnostics;

    ProjectResult(
            ProjectStatus status,
            List<PackageResult> packages,
            List<IrParameter> projectParameters,
            IrProjectGraph graph,
            ProjectCycle cycle,
            IrStrategyDecision decision,
            WorkflowGraph workflow,
            SqlProject sqlProject,
            List<IrDiagnostic> diagnostics
    ) {
        this.status = status;
        this.packages = List.copyOf(packages);
        this.projectParameters = projectParameters == null ? List.of() : List.copyOf(projectParameters);
        this.graph = graph;
        this.cycle = cycle;
        this.decision = decision;
        this.workflow = workflow;
        this.sqlProject = sqlProject;
        this.diagnostics = diagnostics == null ? List.of() : Diagnostics.sorted(diagnostics);
    }

    public Optional<ProjectCycle> projectCycle() {
        return Optional.ofNullable(cycle);
    }

    public Optional<PackageResult> packageNamed(String name) {
        return packages.stream().filter(p -> p.packageName.equals(name)).findFirst();
    }

    /** IR of every package that assembled, in input order. */
    public List<IrPackage> validPackages() {
        List<IrPackage> out = new ArrayList<>();
        for (PackageResult p : packages) {
            if (p.ok()) out.add(p.ir);
        }
        return out;
    }

    public List<UnknownNode> unknownNodes() {
        List<UnknownNode> out = new ArrayList<>();
        for (IrPackage pkg : validPackages()) {
            for (IrExecutable e : pkg.executables) {
                if (e instanceof IrUnknownExecutable) {
                    out.add(new UnknownNode(pkg.name, e.id, null, e.typeTag, ((IrUnknownExecutable) e).reason.name()));
                } else if (e instanceof IrDataFlow) {
                    for (IrComponent c : ((IrDataFlow) e).components) {
                        if (c instanceof IrUnknownComponent) {
                            out.add(new UnknownNode(pkg.name, e.id, c.id, c.classId, "UNRECOGNIZED_TYPE"));
                        }
                    }
                }
            }
        }
        return out;
    }

    /** {@code EXPRESSION_DOWNGRADED} diagnostics of all packages. */
    public List<IrDiagnostic> downgradedExpressions() {
        List<IrDiagnostic> out = new ArrayList<>();
        for (IrDiagnostic d : allDiagnostics()) {
            if (d.code == DiagnosticCode.EXPRESSION_DOWNGRADED) out.add(d);
        }
        return out;
    }

    /** Package, project and mapping diagnostics, in deterministic order. */
    public List<IrDiagnostic> allDiagnostics() {
        List<IrDiagnostic> all = new ArrayList<>(diagnostics);
        for (PackageResult p : packages) all.addAll(p.diagnostics);
        if (workflow != null) all.addAll(workflow.diagnostics);
        return Diagnostics.sorted(all);
    }
}
