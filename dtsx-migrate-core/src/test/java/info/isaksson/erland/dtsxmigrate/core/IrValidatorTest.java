package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPath;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownComponent;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticKind;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.dtsxmigrate.core.CoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class IrValidatorTest {

    private final IrValidator validator = new IrValidator();

    private static IrComponent node(String id) {
        return new IrUnknownComponent(id, id, "Custom.Component", List.of(id + ".in"), List.of(id + ".out"), null, null);
    }

    @Test
    void acceptsDag() {
        IrPackage p = pkg("Ok", List.<IrExecutable>of(sql("a"), sql("b"), sql("c"), flow("df", IrEndpointBinding.WAREHOUSE, false)),
                edges(edge("a", "b"), edge("a", "c"), edge("b", "df"), edge("c", "df")));
        assertEquals(List.of(), validator.validate(p));
    }

    @Test
    void rejectsPrecedenceCycleWithPath() {
        IrPackage p = pkg("Loop", List.<IrExecutable>of(sql("a"), sql("b"), sql("c")),
                edges(edge("a", "b"), edge("b", "c"), edge("c", "a")));
        List<IrDiagnostic> ds = validator.validate(p);
        assertEquals(1, ds.size());
        IrDiagnostic d = ds.get(0);
        assertEquals(DiagnosticCode.PRECEDENCE_CYCLE, d.code);
        assertEquals(DiagnosticKind.INVARIANT_VIOLATION, d.kind);
        assertEquals("a -> b -> c", d.context.get("cycle"));
        assertEquals("Loop", d.packageName);
    }

    @Test
    void rejectsDuplicateIdsAndDanglingEdges() {
        IrPackage p = pkg("Bad", List.<IrExecutable>of(sql("a"), sql("a"), sql("b")),
                edges(edge("a", "b"), edge("b", "ghost")));
        List<IrDiagnostic> ds = validator.validate(p);
        assertEquals(List.of(DiagnosticCode.DANGLING_PRECEDENCE_REFERENCE, DiagnosticCode.DUPLICATE_EXECUTABLE_ID),
                ds.stream().map(d -> d.code).toList());
        assertEquals("ghost", ds.get(0).executableId);
        assertTrue(ds.stream().allMatch(IrDiagnostic::error));
    }

    @Test
    void rejectsDataFlowCycle() {
        IrPackage p = pkg("Flow", dataFlow("df", List.of(node("x"), node("y"), node("z")),
                List.of(path("p1", "x", "y"), path("p2", "y", "z"), new IrPath("p3", null, "z.out", "x.in2", "z", "x"))));
        List<IrDiagnostic> ds = validator.validate(p);
        assertEquals(1, ds.size());
        assertEquals(DiagnosticCode.DATAFLOW_CYCLE, ds.get(0).code);
        assertEquals("df", ds.get(0).executableId);
        assertEquals("x -> y -> z", ds.get(0).context.get("cycle"));
    }

    @Test
    void rejectsTwoPathsIntoOneInput() {
        IrPackage p = pkg("Flow", dataFlow("df", List.of(node("x"), node("y"), node("z")),
                List.of(path("p1", "x", "z"), new IrPath("p2", null, "y.out", "z.in", "y", "z"))));
        List<IrDiagnostic> ds = validator.validate(p);
        assertEquals(List.of(DiagnosticCode.DUPLICATE_INPUT_PATH), ds.stream().map(d -> d.code).toList());
        assertEquals("z", ds.get(0).componentId);
    }

    @Test
    void rejectsDuplicateComponentsAndDanglingPaths() {
        IrPackage p = pkg("Flow", dataFlow("df", List.of(node("x"), node("x"), node("y")),
                List.of(path("p1", "x", "y"), path("p2", "y", "nowhere"))));
        List<DiagnosticCode> codes = validator.validate(p).stream().map(d -> d.code).toList();
        assertEquals(List.of(DiagnosticCode.DANGLING_PATH, DiagnosticCode.DUPLICATE_COMPONENT_ID), codes);
    }
}
