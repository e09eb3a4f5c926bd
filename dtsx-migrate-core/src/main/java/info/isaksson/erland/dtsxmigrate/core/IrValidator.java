package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPath;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural checks on an assembled {@link IrPackage}. Every finding is an
 * {@code INVARIANT_VIOLATION} error.
 *
 * <ul>
 *   <li>executable ids are unique;</li>
 *   <li>precedence edges reference existing executables and form a DAG;</li>
 *   <li>per data flow: unique component ids, paths between existing components, at most one path
 *   per input port, and an acyclic component graph.</li>
 * </ul>
 *
 * <p>Stateless; usable on IR from any source, e.g. read back from JSON.</p>
 */
public final class IrValidator {

    public List<IrDiagnostic> validate(IrPackage pkg) {
        Diagnostics d = new Diagnostics(pkg.name);

        Set<String> ids = new HashSet<>();
        Set<String> reported = new TreeSet<>();
        for (IrExecutable e : pkg.executables) {
            if (!ids.add(e.id)) reported.add(e.id);
        }
        for (String id : reported) {
            d.executable(DiagnosticCode.DUPLICATE_EXECUTABLE_ID, id, "Executable id " + id + " is declared more than once", "id", id);
        }

        boolean dangling = false;
        Map<String, Set<String>> successors = new HashMap<>();
        for (IrPrecedenceEdge e : pkg.precedenceEdges) {
            boolean ok = true;
            for (String end : List.of(e.from, e.to)) {
                if (!ids.contains(end)) {
                    d.executable(DiagnosticCode.DANGLING_PRECEDENCE_REFERENCE, end,
                            "Precedence edge " + e.id + " references unknown executable " + end, "edge", e.id);
                    ok = false;
                }
            }
            if (ok) {
                successors.computeIfAbsent(e.from, k -> new LinkedHashSet<>()).add(e.to);
            } else {
                dangling = true;
            }
        }
        if (!dangling) {
            List<String> cycle = Graphs.findCycle(ids, successors);
            if (!cycle.isEmpty()) {
                String path = String.join(" -> ", cycle);
                d.executable(DiagnosticCode.PRECEDENCE_CYCLE, cycle.get(0), "Precedence constraints form a cycle: " + path, "cycle", path);
            }
        }

        for (IrExecutable e : pkg.executables) {
            if (e instanceof IrDataFlow) validateDataFlow((IrDataFlow) e, d);
        }
        return d.toDeterministicList();
    }

    private static void validateDataFlow(IrDataFlow df, Diagnostics d) {
        Set<String> components = new HashSet<>();
        for (IrComponent c : df.components) {
            if (!components.add(c.id)) {
                d.component(DiagnosticCode.DUPLICATE_COMPONENT_ID, df.id, c.id,
                        "Data flow " + df.name + " declares component id " + c.id + " twice", "component", c.id);
            }
        }

        Map<String, String> inputOwners = new HashMap<>();
        Map<String, Set<String>> successors = new HashMap<>();
        boolean valid = true;
        for (IrPath p : df.paths) {
            String missing = !components.contains(p.fromComponent) ? p.fromComponent
                    : !components.contains(p.toComponent) ? p.toComponent : null;
            if (missing != null) {
                d.component(DiagnosticCode.DANGLING_PATH, df.id, null,
                        "Path " + p.id + " in data flow " + df.name + " references unknown component " + missing, "endpoint", missing);
                valid = false;
                continue;
            }
            if (p.endPort != null) {
                String previous = inputOwners.putIfAbsent(p.endPort, p.id);
                if (previous != null) {
                    d.component(DiagnosticCode.DUPLICATE_INPUT_PATH, df.id, p.toComponent,
                            "Input " + p.endPort + " is fed by both " + previous + " and " + p.id, "input", p.endPort);
                    valid = false;
                }
            }
            successors.computeIfAbsent(p.fromComponent, k -> new LinkedHashSet<>()).add(p.toComponent);
        }
        if (!valid) return;

        List<String> cycle = Graphs.findCycle(new ArrayList<>(components), successors);
        if (!cycle.isEmpty()) {
            String path = String.join(" -> ", cycle);
            d.component(DiagnosticCode.DATAFLOW_CYCLE, df.id, cycle.get(0),
                    "Data flow " + df.name + " contains a cycle: " + path, "cycle", path);
        }
    }
}
