package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import info.isaksson.erland.dtsxmigrate.ir.IrCrossPackageEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutePackage;
import info.isaksson.erland.dtsxmigrate.ir.IrForEachLoop;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEvalOp;
import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;
import info.isaksson.erland.dtsxmigrate.ir.IrSequenceContainer;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategy;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownReason;
import info.isaksson.erland.dtsxmigrate.ir.IrWriteMode;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.mapping.WorkflowMappingInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition.*;
import static info.isaksson.erland.dtsxmigrate.mapping.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class WorkflowGraphMapperTest {

    private WorkflowGraph graph;

    private static IrPrecedenceEdge expression(String from, String to, String expression) {
        return new IrPrecedenceEdge(null, from, to, EXPRESSION, expression, IrPrecedenceEvalOp.EXPRESSION, SUCCESS, true);
    }

    @BeforeEach
    void setUp() {
        List<IrExecutable> executables = List.of(
                new IrUnknownExecutable("Package\\Archive", "Archive", "Microsoft.FileSystemTask", null, null, false,
                        IrUnknownReason.UNRECOGNIZED_TYPE, null),
                new IrForEachLoop("Package\\Each File", "Each File", "STOCK:FOREACHLOOP", null, null, false,
                        "ForEachFileEnumerator", null, List.of("User::FileName"), List.of()),
                dataFlow("Package\\Export", "Export", List.of(
                        source("1", "Orders", "dbo.Orders", IrEndpointBinding.WAREHOUSE),
                        destination("2", "Csv", null, IrWriteMode.INSERT, IrEndpointBinding.FILE)
                ), List.of(path("p", "1", "2"))),
                salesFlow("Package\\Load"),
                script("Package\\Notify", "Notify", IrScriptIoIntent.NONE),
                new IrExecutePackage("Package\\Run Child", "Run Child", "Microsoft.ExecutePackageTask", null, null, false,
                        "Child", "Child.dtsx", true),
                new IrExecutePackage("Package\\Run Missing", "Run Missing", "Microsoft.ExecutePackageTask", null, null, false,
                        "Missing", "Missing.dtsx", true),
                new IrSequenceContainer("Package\\Stage", "Stage", "STOCK:SEQUENCE", null, null, false,
                        List.of("Package\\Stage\\Truncate")),
                sql("Package\\Stage\\Truncate", "Truncate", "Package\\Stage", "TRUNCATE TABLE stg.Orders")
        );
        List<IrPrecedenceEdge> edges = List.of(
                IrPrecedenceEdge.of("Package\\Stage", "Package\\Load", SUCCESS),
                IrPrecedenceEdge.of("Package\\Load", "Package\\Notify", FAILURE),
                IrPrecedenceEdge.of("Package\\Load", "Package\\Archive", COMPLETION),
                expression("Package\\Stage", "Package\\Run Child", "@[User::RunChild] == true"),
                IrPrecedenceEdge.of("Package\\Notify", "Package\\Each File", SUCCESS),
                IrPrecedenceEdge.of("Package\\Archive", "Package\\Each File", FAILURE),
                new IrPrecedenceEdge(null, "Package\\Load", "Package\\Export", SUCCESS, null, null, SUCCESS, false),
                new IrPrecedenceEdge(null, "Package\\Stage", "Package\\Export", SUCCESS, null, null, SUCCESS, false)
        );
        IrPackage daily = pkg("Daily Load", executables, edges);
        IrPackage child = pkg("Child", List.of(sql("Package\\Merge", "Merge", null, "MERGE INTO dbo.T USING s ON 1=1")), List.of());

        WorkflowMappingInput input = new WorkflowMappingInput(List.of(daily, child),
                List.of(new IrCrossPackageEdge("Daily Load", "Package\\Run Child", "Child")),
                decision(IrStrategy.MIXED));
        graph = new WorkflowGraphMapper().generate(input);
    }

    private WorkflowTask task(String id) {
        return graph.dagFor("Daily Load").orElseThrow().task(id).orElseThrow();
    }

    @Test
    void oneDagPerPackageSortedByName() {
        assertEquals(IrStrategy.MIXED, graph.strategy);
        assertEquals(List.of("child", "daily_load"), graph.dags.stream().map(d -> d.dagId).toList());
        assertEquals(9, graph.dagFor("Daily Load").orElseThrow().tasks.size());
    }

    @Test
    void operatorsFollowExecutableKinds() {
        assertEquals(OperatorKind.SQL, task("stage__truncate").operator);
        assertEquals(OperatorKind.DBT_RUN, task("load_orders").operator);
        assertEquals(OperatorKind.DATA_TRANSFER, task("export").operator);
        assertEquals(OperatorKind.PYTHON, task("notify").operator);
        assertEquals(OperatorKind.TASK_GROUP, task("stage").operator);
        assertEquals(OperatorKind.MAPPED_TASK_GROUP, task("each_file").operator);
        assertEquals(OperatorKind.TRIGGER_WORKFLOW, task("run_child").operator);

        WorkflowTask archive = task("archive");
        assertEquals(OperatorKind.PLACEHOLDER, archive.operator);
        assertTrue(archive.lowConfidence);
        assertEquals("Microsoft.FileSystemTask", archive.params.get("type_tag"));
    }

    @Test
    void containerChildrenReferenceTheirGroup() {
        assertEquals("stage", task("stage__truncate").groupId);
        assertNull(task("stage").groupId);
        assertEquals("TRUNCATE TABLE stg.Orders", task("stage__truncate").params.get("sql"));
        assertEquals("User::FileName", task("each_file").params.get("mapped_variables"));
    }

    @Test
    void triggerRulesFollowIncomingConstraints() {
        assertEquals(TriggerRule.ALL_SUCCESS, task("stage").triggerRule);
        assertEquals(TriggerRule.ALL_SUCCESS, task("load_orders").triggerRule);
        assertEquals(TriggerRule.ONE_FAILED, task("notify").triggerRule);
        assertEquals(TriggerRule.ALL_DONE, task("archive").triggerRule);
        assertEquals(TriggerRule.ONE_SUCCESS, task("export").triggerRule);

        WorkflowTask runChild = task("run_child");
        assertEquals(TriggerRule.ALL_DONE, runChild.triggerRule);
        assertEquals("@[User::RunChild] == true", runChild.branchCondition);
    }

    @Test
    void mixedIncomingConditionsFallBackToAllDoneWithWarning() {
        assertEquals(TriggerRule.ALL_DONE, task("each_file").triggerRule);

        assertEquals(1, graph.diagnostics.size());
        assertEquals(DiagnosticCode.MIXED_TRIGGER_CONDITIONS, graph.diagnostics.get(0).code);
        assertEquals("Package\\Each File", graph.diagnostics.get(0).executableId);
        assertEquals("Daily Load", graph.diagnostics.get(0).packageName);
    }

    @Test
    void executePackageTriggersTheCalleeDag() {
        assertEquals("child", task("run_child").params.get("trigger_dag_id"));
        assertFalse(task("run_child").lowConfidence);
        assertEquals(List.of(new WorkflowTrigger("daily_load", "run_child", "child")), graph.triggers);

        WorkflowTask missing = task("run_missing");
        assertTrue(missing.lowConfidence);
        assertEquals("Missing.dtsx", missing.params.get("package_reference"));
    }

    @Test
    void dependenciesMirrorPrecedenceEdges() {
        List<WorkflowDependency> deps = graph.dagFor("Daily Load").orElseThrow().dependencies;

        assertEquals(8, deps.size());
        assertTrue(deps.contains(new WorkflowDependency("stage", "load_orders", SUCCESS, null)));
        assertTrue(deps.contains(new WorkflowDependency("stage", "run_child", EXPRESSION, "@[User::RunChild] == true")));
    }

    @Test
    void collidingTaskNamesGetSuffixes() {
        IrPackage p = pkg("Dupes", List.of(
                sql("Package\\A", "Load", null, "SELECT 1"),
                sql("Package\\B", "load", null, "SELECT 2")
        ), List.of());

        WorkflowGraph g = new WorkflowGraphMapper().generate(new WorkflowMappingInput(List.of(p), List.of(), decision(IrStrategy.AIRFLOW_ONLY)));

        assertEquals(List.of("load", "load_2"), g.dags.get(0).tasks.stream().map(t -> t.id).toList());
    }

    @Test
    void multipleExpressionsAreCombinedWithTheirLogicalOperator() {
        IrPrecedenceEdge a = new IrPrecedenceEdge(null, "A", "C", EXPRESSION, "@x > 1", IrPrecedenceEvalOp.EXPRESSION, null, false);
        IrPrecedenceEdge b = new IrPrecedenceEdge(null, "B", "C", EXPRESSION, "@y > 2", IrPrecedenceEvalOp.EXPRESSION, null, false);

        WorkflowGraphMapper.Trigger t = WorkflowGraphMapper.trigger(List.of(a, b), "C",
                new info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics("P"));

        assertEquals(TriggerRule.ALL_DONE, t.rule);
        assertEquals("(@x > 1) || (@y > 2)", t.branchCondition);
    }

    @Test
    void mappingIsDeterministic() {
        WorkflowGraph again = new WorkflowGraphMapper().generate(new WorkflowMappingInput(
                List.of(pkg("Child", List.of(sql("Package\\Merge", "Merge", null, "MERGE INTO dbo.T USING s ON 1=1")), List.of())),
                List.of(), decision(IrStrategy.AIRFLOW_ONLY)));
        WorkflowDag original = graph.dagFor("Child").orElseThrow();
        WorkflowDag repeated = again.dagFor("Child").orElseThrow();

        assertEquals(original.tasks.toString(), repeated.tasks.toString());
        assertEquals(original.tasks.get(0).params, repeated.tasks.get(0).params);
    }
}
