package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import info.isaksson.erland.dtsxmigrate.ir.IrCrossPackageEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutePackage;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrForEachLoop;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrScript;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import info.isaksson.erland.dtsxmigrate.mapping.MappingNames;
import info.isaksson.erland.dtsxmigrate.mapping.WorkflowGenerator;
import info.isaksson.erland.dtsxmigrate.mapping.WorkflowMappingInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps validated packages to a {@link WorkflowGraph}: one DAG per package, one task per
 * executable, one dependency per precedence edge.
 *
 * <p>DAG ids are the slugged package names; task ids the slugged container path of the executable,
 * e.g. {@code process_files__upload_raw_file}. Collisions get a {@code _2}, {@code _3} suffix in
 * executable-id order.</p>
 */
public final class WorkflowGraphMapper implements WorkflowGenerator<WorkflowGraph> {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowGraphMapper.class);

    @Override
    public WorkflowGraph generate(WorkflowMappingInput input) {
        Map<String, String> dagIds = new HashMap<>();
        Set<String> usedDagIds = new HashSet<>();
        for (IrPackage pkg : input.packages) {
            dagIds.put(pkg.name, MappingNames.unique(MappingNames.slug(pkg.name), usedDagIds));
        }

        List<WorkflowDag> dags = new ArrayList<>();
        List<WorkflowTrigger> triggers = new ArrayList<>();
        List<IrDiagnostic> diagnostics = new ArrayList<>();
        for (IrPackage pkg : input.packages) {
            Diagnostics diags = new Diagnostics(pkg.name);
            dags.add(mapPackage(pkg, input, dagIds, triggers, diags));
            diagnostics.addAll(diags.toDeterministicList());
        }
        triggers.sort(Comparator.comparing((WorkflowTrigger t) -> t.dagId)
                .thenComparing(t -> t.taskId)
                .thenComparing(t -> t.triggeredDagId));
        diagnostics.sort(Diagnostics.ORDER);

        int tasks = dags.stream().mapToInt(d -> d.tasks.size()).sum();
        logger.info("Mapped {} package(s) to {} DAG(s), {} task(s), {} trigger(s)",
                input.packages.size(), dags.size(), tasks, triggers.size());
        return new WorkflowGraph(input.decision.strategy, dags, triggers, diagnostics);
    }

    private WorkflowDag mapPackage(IrPackage pkg, WorkflowMappingInput input, Map<String, String> dagIds,
                                   List<WorkflowTrigger> triggers, Diagnostics diags) {
        String dagId = dagIds.get(pkg.name);

        Map<String, String> taskIds = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (IrExecutable exe : pkg.executables) {
            taskIds.put(exe.id, MappingNames.unique(MappingNames.executablePath(pkg, exe), used));
        }

        Map<String, List<IrPrecedenceEdge>> incoming = new HashMap<>();
        for (IrPrecedenceEdge e : pkg.precedenceEdges) {
            incoming.computeIfAbsent(e.to, k -> new ArrayList<>()).add(e);
        }

        List<WorkflowTask> tasks = new ArrayList<>();
        for (IrExecutable exe : pkg.executables) {
            Map<String, String> params = new LinkedHashMap<>();
            OperatorKind operator = operator(exe, params);
            boolean lowConfidence = operator == OperatorKind.PLACEHOLDER;

            if (exe instanceof IrExecutePackage) {
                IrExecutePackage call = (IrExecutePackage) exe;
                IrCrossPackageEdge edge = input.callFrom(pkg.name, exe.id).orElse(null);
                String calleeDag = edge == null ? null : dagIds.get(edge.calleePackage);
                if (calleeDag != null) {
                    params.put("trigger_dag_id", calleeDag);
                    triggers.add(new WorkflowTrigger(dagId, taskIds.get(exe.id), calleeDag));
                } else {
                    lowConfidence = true;
                    if (call.rawReference != null) params.put("package_reference", call.rawReference);
                }
            }

            Trigger trigger = trigger(incoming.getOrDefault(exe.id, List.of()), exe.id, diags);
            String groupId = exe.parentId == null ? null : taskIds.get(exe.parentId);
            tasks.add(new WorkflowTask(taskIds.get(exe.id), exe.id, exe.name, operator, groupId,
                    trigger.rule, trigger.branchCondition, lowConfidence, exe.disabled, params));
        }

        List<WorkflowDependency> dependencies = new ArrayList<>();
        for (IrPrecedenceEdge e : pkg.precedenceEdges) {
            String up = taskIds.get(e.from);
            String down = taskIds.get(e.to);
            if (up == null || down == null) continue;
            dependencies.add(new WorkflowDependency(up, down, e.condition, e.expression));
        }
        return new WorkflowDag(dagId, pkg.name, tasks, dependencies);
    }

    static OperatorKind operator(IrExecutable exe, Map<String, String> params) {
        switch (exe.kind) {
            case EXECUTE_SQL: {
                IrExecuteSql sql = (IrExecuteSql) exe;
                if (sql.connectionRef != null) params.put("connection", sql.connectionRef);
                putValue(params, "sql", sql.sql);
                return OperatorKind.SQL;
            }
            case DATA_FLOW:
                params.put("data_flow", exe.id);
                return ((IrDataFlow) exe).warehouseBound() ? OperatorKind.DBT_RUN : OperatorKind.DATA_TRANSFER;
            case SCRIPT: {
                IrScript script = (IrScript) exe;
                if (script.language != null) params.put("language", script.language);
                params.put("io_intent", script.ioIntent.name());
                return OperatorKind.PYTHON;
            }
            case SEQUENCE_CONTAINER:
                return OperatorKind.TASK_GROUP;
            case FOR_EACH_LOOP: {
                IrForEachLoop loop = (IrForEachLoop) exe;
                if (loop.enumeratorType != null) params.put("enumerator", loop.enumeratorType);
                if (!loop.variableMappings.isEmpty()) params.put("mapped_variables", String.join(",", loop.variableMappings));
                loop.enumeratorProperties.forEach((k, v) -> putValue(params, "enumerator." + k, v));
                return OperatorKind.MAPPED_TASK_GROUP;
            }
            case EXECUTE_PACKAGE:
                return OperatorKind.TRIGGER_WORKFLOW;
            case UNKNOWN:
            default:
                if (exe.typeTag != null) params.put("type_tag", exe.typeTag);
                if (exe instanceof IrUnknownExecutable) params.put("reason", ((IrUnknownExecutable) exe).reason.name());
                return OperatorKind.PLACEHOLDER;
        }
    }

    private static void putValue(Map<String, String> params, String key, IrPropertyValue value) {
        if (value == null) return;
        if (value.literal != null && !value.literal.isEmpty()) params.put(key, value.literal);
        if (value.hasExpression()) params.put(key + "_expression", value.expression);
    }

    static Trigger trigger(List<IrPrecedenceEdge> incoming, String executableId, Diagnostics diags) {
        if (incoming.isEmpty()) return new Trigger(TriggerRule.ALL_SUCCESS, null);

        Set<IrPrecedenceCondition> conditions = EnumSet.noneOf(IrPrecedenceCondition.class);
        boolean anyOr = false;
        List<String> expressions = new ArrayList<>();
        for (IrPrecedenceEdge e : incoming) {
            conditions.add(e.condition);
            if (!e.logicalAnd) anyOr = true;
            if (e.condition == IrPrecedenceCondition.EXPRESSION && e.expression != null) expressions.add(e.expression);
        }
        String branch = branchCondition(expressions, anyOr);

        if (conditions.size() > 1) {
            diags.executable(DiagnosticCode.MIXED_TRIGGER_CONDITIONS, executableId,
                    "Incoming precedence constraints mix " + conditions + "; mapped to all_done",
                    "conditions", conditions.toString());
            return new Trigger(TriggerRule.ALL_DONE, branch);
        }
        switch (conditions.iterator().next()) {
            case FAILURE:
                return new Trigger(TriggerRule.ONE_FAILED, null);
            case COMPLETION:
                return new Trigger(TriggerRule.ALL_DONE, null);
            case EXPRESSION:
                return new Trigger(TriggerRule.ALL_DONE, branch);
            case SUCCESS:
            default:
                return new Trigger(anyOr ? TriggerRule.ONE_SUCCESS : TriggerRule.ALL_SUCCESS, null);
        }
    }

    private static String branchCondition(List<String> expressions, boolean anyOr) {
        if (expressions.isEmpty()) return null;
        if (expressions.size() == 1) return expressions.get(0);
        List<String> wrapped = new ArrayList<>();
        for (String e : expressions) wrapped.add("(" + e + ")");
        return String.join(anyOr ? " || " : " && ", wrapped);
    }

    static final class Trigger {
        final TriggerRule rule;
        final String branchCondition;

        Trigger(TriggerRule rule, String branchCondition) {
            this.rule = rule;
            this.branchCondition = branchCondition;
        }
    }
}
