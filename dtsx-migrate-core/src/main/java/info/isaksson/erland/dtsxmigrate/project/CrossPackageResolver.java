package info.isaksson.erland.dtsxmigrate.project;

import info.isaksson.erland.dtsxmigrate.core.Graphs;
import info.isaksson.erland.dtsxmigrate.ir.IrCrossPackageEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutePackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrProjectGraph;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Links Execute Package tasks to the packages they run and builds the project graph.
 *
 * <p>A reference matches a package by its source file name (without {@code .dtsx}) or by its package
 * name, ignoring case. Source names win when both would match different packages.</p>
 *
 * <p>Graph nodes are package names, which must be unique within the project. Packages sharing a name
 * (copies of one template often all keep {@code Package}) are renamed to their source file stem and
 * reported as {@code DUPLICATE_PACKAGE_NAME}; {@link Resolution#packages} carries the renamed IR.</p>
 */
public final class CrossPackageResolver {

    private static final Logger logger = LoggerFactory.getLogger(CrossPackageResolver.class);

    /** Resolved edges, the project graph and any diagnostics raised on the way. */
    public static final class Resolution {
        /** Input packages in input order, under the names used as graph nodes. */
        public final List<IrPackage> packages;

        public final IrProjectGraph graph;

        /** Null when the graph is acyclic. */
        public final ProjectCycle cycle;

        public final List<IrDiagnostic> diagnostics;

        Resolution(List<IrPackage> packages, IrProjectGraph graph, ProjectCycle cycle, List<IrDiagnostic> diagnostics) {
            this.packages = packages;
            this.graph = graph;
            this.cycle = cycle;
            this.diagnostics = diagnostics;
        }
    }

    public Resolution resolve(List<IrPackage> packages) {
        if (packages == null) throw new IllegalArgumentException("packages must not be null");
        List<IrDiagnostic> diagnostics = new ArrayList<>();
        List<IrPackage> named = uniqueNames(packages, diagnostics);
        List<IrPackage> sorted = new ArrayList<>(named);
        sorted.sort(Comparator.comparing((IrPackage p) -> p.name));

        Map<String, String> bySource = new HashMap<>();
        Map<String, String> byName = new HashMap<>();
        for (IrPackage p : sorted) {
            bySource.putIfAbsent(key(stem(p.sourceName)), p.name);
            byName.putIfAbsent(key(p.name), p.name);
        }

        List<IrCrossPackageEdge> edges = new ArrayList<>();
        Map<String, Set<String>> callees = new TreeMap<>();
        for (IrPackage p : sorted) {
            Diagnostics d = new Diagnostics(p.name);
            for (IrExecutePackage call : p.executablesOf(IrExecutePackage.class)) {
                String target = call.packageReference == null ? null : match(call.packageReference, bySource, byName);
                if (target == null) {
                    String shown = call.packageReference != null ? call.packageReference : call.rawReference;
                    d.executable(DiagnosticCode.UNRESOLVED_PACKAGE_REFERENCE, call.id,
                            "Execute Package task " + call.name + " references " + (shown == null ? "no package" : shown)
                                    + ", which is not part of the project",
                            "reference", shown);
                    continue;
                }
                edges.add(new IrCrossPackageEdge(p.name, call.id, target));
                callees.computeIfAbsent(p.name, k -> new TreeSet<>()).add(target);
            }
            diagnostics.addAll(d.toDeterministicList());
        }
        edges.sort(Comparator.comparing((IrCrossPackageEdge e) -> e.callerPackage)
                .thenComparing(e -> e.callerExecutableId)
                .thenComparing(e -> e.calleePackage));

        List<String> names = sorted.stream().map(p -> p.name).toList();
        Set<String> called = new TreeSet<>();
        callees.values().forEach(called::addAll);
        List<String> entryPoints = new ArrayList<>();
        List<String> isolated = new ArrayList<>();
        for (String n : names) {
            if (called.contains(n)) continue;
            entryPoints.add(n);
            if (!callees.containsKey(n)) isolated.add(n);
        }

        List<String> cycle = Graphs.findCycle(names, callees);
        ProjectCycle projectCycle = null;
        List<String> order = List.of();
        if (cycle.isEmpty()) {
            order = Graphs.topologicalOrder(names, callees);
        } else {
            projectCycle = new ProjectCycle(cycle);
            Diagnostics d = new Diagnostics(null);
            d.report(DiagnosticCode.PROJECT_CYCLE, "Packages call each other in a cycle: " + projectCycle.path(),
                    "cycle", String.join(", ", cycle));
            diagnostics.addAll(d.toDeterministicList());
            logger.warn("Project graph has a cycle: {}", projectCycle.path());
        }

        logger.debug("Resolved {} cross-package edge(s) across {} package(s)", edges.size(), names.size());
        IrProjectGraph graph = new IrProjectGraph(names, edges, entryPoints, isolated, order, cycle);
        return new Resolution(List.copyOf(named), graph, projectCycle, Diagnostics.sorted(diagnostics));
    }

    /**
     * Renames every package whose name (ignoring case) is shared with another one to its source stem,
     * suffixed with {@code _2}, {@code _3}, ... if that is taken too. Unique names are kept.
     */
    static List<IrPackage> uniqueNames(List<IrPackage> packages, List<IrDiagnostic> out) {
        Map<String, Integer> counts = new HashMap<>();
        for (IrPackage p : packages) counts.merge(key(p.name), 1, Integer::sum);

        Set<String> used = new HashSet<>();
        List<IrPackage> shared = new ArrayList<>();
        for (IrPackage p : packages) {
            if (counts.get(key(p.name)) == 1) {
                used.add(key(p.name));
            } else {
                shared.add(p);
            }
        }
        if (shared.isEmpty()) return new ArrayList<>(packages);

        shared.sort(Comparator.comparing((IrPackage p) -> p.sourceName).thenComparing(p -> p.name));
        Map<IrPackage, IrPackage> renamed = new IdentityHashMap<>();
        for (IrPackage p : shared) {
            String base = stem(p.sourceName);
            if (base.isEmpty()) base = p.name;
            String candidate = base;
            for (int n = 2; !used.add(key(candidate)); n++) candidate = base + "_" + n;
            renamed.put(p, p.withName(candidate));

            Map<String, String> ctx = new LinkedHashMap<>();
            ctx.put("name", p.name);
            ctx.put("source", p.sourceName);
            out.add(new IrDiagnostic(DiagnosticCode.DUPLICATE_PACKAGE_NAME, null, candidate, null, null,
                    counts.get(key(p.name)) + " packages are named " + p.name + "; " + p.sourceName + " is keyed as " + candidate,
                    ctx));
        }
        logger.warn("{} package(s) share a name and were keyed by source file instead", shared.size());

        List<IrPackage> result = new ArrayList<>(packages.size());
        for (IrPackage p : packages) result.add(renamed.getOrDefault(p, p));
        return result;
    }

    private static String match(String reference, Map<String, String> bySource, Map<String, String> byName) {
        String k = key(stem(reference));
        String hit = bySource.get(k);
        return hit != null ? hit : byName.get(k);
    }

    /** File name without directories and without a {@code .dtsx} extension. */
    public static String stem(String name) {
        if (name == null) return "";
        String s = name.trim().replace('\\', '/');
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        if (s.toLowerCase(Locale.ROOT).endsWith(".dtsx")) s = s.substring(0, s.length() - 5);
        return s;
    }

    private static String key(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
