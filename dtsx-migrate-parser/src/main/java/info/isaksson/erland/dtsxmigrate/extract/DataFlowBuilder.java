package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrAggregateComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrConditionalSplitComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionKind;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrDerivedColumnComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDestinationComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrLookupComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrNamedExpression;
import info.isaksson.erland.dtsxmigrate.ir.IrPath;
import info.isaksson.erland.dtsxmigrate.ir.IrSortComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrSourceComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrUnionAllComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownReason;
import info.isaksson.erland.dtsxmigrate.ir.IrWriteMode;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Builds the component graph of a data-flow task.
 *
 * <p>Two passes: mutable drafts are collected from {@code components/component} and
 * {@code paths/path}, the graph is checked (dangling endpoints, duplicate inputs, cycles), and only
 * then are the immutable components created, in topological order with ties broken by document
 * order.</p>
 *
 * <p>A data flow whose graph is invalid becomes an {@link IrUnknownExecutable} with reason
 * {@link IrUnknownReason#DATAFLOW_INVALID}; the rest of the package is unaffected.</p>
 */
final class DataFlowBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DataFlowBuilder.class);

    private static final String[] AGGREGATIONS = {
            null, "COUNT", "COUNT", "COUNT_DISTINCT", "SUM", "AVG", "MIN", "MAX"
    };

    /** Mutable component state while ports and paths are being resolved. */
    private static final class Draft {
        final String id;
        final String name;
        final String classId;
        final DtsxElement element;
        final int documentIndex;
        final List<String> inputPorts = new ArrayList<>();
        final List<String> outputPorts = new ArrayList<>();
        final Map<String, String> properties = new LinkedHashMap<>();
        String connectionRef;

        Draft(String id, String name, String classId, DtsxElement element, int documentIndex) {
            this.id = id;
            this.name = name;
            this.classId = classId;
            this.element = element;
            this.documentIndex = documentIndex;
        }
    }

    /** A port owned by a component. */
    private static final class Port {
        final String id;
        final Draft owner;

        Port(String id, Draft owner) {
            this.id = id;
            this.owner = owner;
        }
    }

    IrExecutable build(DtsxElement exe, ExecutableHeader h, ExtractContext ctx) {
        DtsxElement pipeline = exe.child("DTS:ObjectData")
                .flatMap(od -> od.child("pipeline"))
                .orElse(null);
        if (pipeline == null) {
            logger.debug("Data flow {} has no pipeline element", h.id);
            return new IrDataFlow(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled, List.of(), List.of());
        }

        int errorsBefore = ctx.diagnostics.size();
        boolean valid = true;

        // components
        Map<String, Draft> drafts = new LinkedHashMap<>();
        Map<String, Port> ports = new HashMap<>();
        Map<String, Draft> componentAliases = new HashMap<>();
        int index = 0;
        for (DtsxElement c : componentElements(pipeline)) {
            String refId = PackageHeaderExtractor.blankToNull(c.attr("refId"));
            String rawId = PackageHeaderExtractor.blankToNull(c.attr("id"));
            String name = PackageHeaderExtractor.blankToNull(c.attr("name"));
            String id = refId != null ? refId : rawId != null ? rawId : name != null ? name : "component" + index;
            if (drafts.containsKey(id)) {
                ctx.diagnostics.component(DiagnosticCode.DUPLICATE_COMPONENT_ID, h.id, id,
                        "Data flow " + h.name + " declares component id " + id + " twice", "component", id);
                valid = false;
                continue;
            }
            Draft d = new Draft(id, name, c.attr("componentClassID"), c, index++);
            readProperties(c, d, h, ctx);
            readPorts(c, d, ports);
            drafts.put(id, d);
            componentAliases.put(id, d);
            if (rawId != null) componentAliases.putIfAbsent(rawId, d);
            if (name != null) componentAliases.putIfAbsent(name, d);
        }

        // paths
        List<IrPath> paths = new ArrayList<>();
        Map<String, String> inputOwners = new HashMap<>();
        int pathIndex = 0;
        for (DtsxElement p : pathElements(pipeline)) {
            pathIndex++;
            String pathId = firstNonNull(p.attr("refId"), p.attr("id"), p.attr("name"), "path" + pathIndex);
            String pathName = PackageHeaderExtractor.blankToNull(p.attr("name"));
            String start = PackageHeaderExtractor.blankToNull(p.attr("startId"));
            String end = PackageHeaderExtractor.blankToNull(p.attr("endId"));

            Port from = resolve(start, ports, componentAliases, true, pathName != null ? pathName : pathId);
            Port to = resolve(end, ports, componentAliases, false, pathId);
            if (from == null || to == null) {
                String missing = from == null ? start : end;
                ctx.diagnostics.component(DiagnosticCode.DANGLING_PATH, h.id, null,
                        "Path " + pathId + " in data flow " + h.name + " references unknown endpoint " + missing,
                        "endpoint", String.valueOf(missing));
                valid = false;
                continue;
            }
            String previous = inputOwners.putIfAbsent(to.id, pathId);
            if (previous != null) {
                ctx.diagnostics.component(DiagnosticCode.DUPLICATE_INPUT_PATH, h.id, to.owner.id,
                        "Input " + to.id + " is fed by both " + previous + " and " + pathId, "input", to.id);
                valid = false;
                continue;
            }
            paths.add(new IrPath(pathId, pathName, from.id, to.id, from.owner.id, to.owner.id));
        }

        List<String> cycle = valid ? findCycle(drafts, paths) : List.of();
        if (!cycle.isEmpty()) {
            ctx.diagnostics.component(DiagnosticCode.DATAFLOW_CYCLE, h.id, cycle.get(0),
                    "Data flow " + h.name + " contains a cycle: " + String.join(" -> ", cycle), "cycle", String.join(" -> ", cycle));
            valid = false;
        }

        if (!valid) {
            logger.debug("Data flow {} is invalid ({} diagnostics), keeping it as placeholder", h.id, ctx.diagnostics.size() - errorsBefore);
            return new IrUnknownExecutable(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                    IrUnknownReason.DATAFLOW_INVALID, List.of());
        }

        List<IrComponent> components = new ArrayList<>();
        for (Draft d : topologicalOrder(drafts, paths)) {
            components.add(toComponent(d, h, ctx));
        }
        return new IrDataFlow(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled, components, paths);
    }

    private static List<DtsxElement> componentElements(DtsxElement pipeline) {
        List<DtsxElement> out = new ArrayList<>();
        for (DtsxElement group : pipeline.children("components")) {
            out.addAll(group.children("component"));
        }
        return out;
    }

    private static List<DtsxElement> pathElements(DtsxElement pipeline) {
        List<DtsxElement> out = new ArrayList<>();
        for (DtsxElement group : pipeline.children("paths")) {
            out.addAll(group.children("path"));
        }
        return out;
    }

    private static void readProperties(DtsxElement c, Draft d, ExecutableHeader h, ExtractContext ctx) {
        for (DtsxElement group : c.children("properties")) {
            for (DtsxElement p : group.children("property")) {
                String name = p.attr("name");
                if (name == null) continue;
                boolean flagged = VariableExtractor.truthy(p.attr("isSensitive")) || VariableExtractor.truthy(p.attr("Sensitive"));
                d.properties.putIfAbsent(name, ctx.redaction.apply(d.id, name, p.text(), flagged).literal);
            }
        }
        String connection = null;
        for (DtsxElement group : c.children("connections")) {
            for (DtsxElement conn : group.children("connection")) {
                connection = firstNonNull(conn.attr("connectionManagerRefId"), conn.attr("connectionManagerID"));
                if (connection != null) break;
            }
            if (connection != null) break;
        }
        if (connection == null) connection = d.properties.get("Connection");
        d.connectionRef = ctx.connectionId(connection, h.id);
    }

    private static void readPorts(DtsxElement c, Draft d, Map<String, Port> ports) {
        for (DtsxElement group : c.children("inputs")) {
            for (DtsxElement in : group.children("input")) {
                String id = portId(in, d, "Inputs");
                d.inputPorts.add(id);
                registerPort(in, new Port(id, d), ports);
            }
        }
        for (DtsxElement group : c.children("outputs")) {
            for (DtsxElement out : group.children("output")) {
                String id = portId(out, d, "Outputs");
                d.outputPorts.add(id);
                registerPort(out, new Port(id, d), ports);
            }
        }
    }

    private static String portId(DtsxElement port, Draft d, String collection) {
        String refId = PackageHeaderExtractor.blankToNull(port.attr("refId"));
        if (refId != null) return refId;
        String label = firstNonNull(port.attr("name"), port.attr("id"), String.valueOf(d.inputPorts.size() + d.outputPorts.size()));
        return d.id + "." + collection + "[" + label + "]";
    }

    private static void registerPort(DtsxElement el, Port port, Map<String, Port> ports) {
        ports.putIfAbsent(port.id, port);
        String rawId = PackageHeaderExtractor.blankToNull(el.attr("id"));
        if (rawId != null) ports.putIfAbsent(rawId, port);
    }

    /**
     * Resolve a path endpoint to a port. Endpoints naming a component rather than a port (the legacy
     * form) get a synthesized port on that component.
     */
    private static Port resolve(String endpoint, Map<String, Port> ports, Map<String, Draft> components, boolean output, String label) {
        if (endpoint == null) return null;
        Port p = ports.get(endpoint);
        if (p != null) return p;
        Draft owner = components.get(endpoint);
        if (owner == null) return null;
        String id = owner.id + (output ? ".Outputs[" : ".Inputs[") + label + "]";
        List<String> list = output ? owner.outputPorts : owner.inputPorts;
        if (!list.contains(id)) list.add(id);
        Port synthesized = new Port(id, owner);
        ports.putIfAbsent(id, synthesized);
        return ports.get(id);
    }

    /** First cycle found by a depth-first search in document order; empty when acyclic. */
    private static List<String> findCycle(Map<String, Draft> drafts, List<IrPath> paths) {
        Map<String, List<String>> adjacency = adjacency(drafts, paths);
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> stack = new ArrayList<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        for (String id : drafts.keySet()) {
            if (!visited.add(id)) continue;
            enter(id, adjacency, onStack, stack, pending);
            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    onStack.remove(stack.remove(stack.size() - 1));
                    continue;
                }
                String next = it.next();
                if (onStack.contains(next)) {
                    return new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                }
                if (visited.add(next)) enter(next, adjacency, onStack, stack, pending);
            }
        }
        return List.of();
    }

    private static void enter(String node, Map<String, List<String>> adjacency, Set<String> onStack,
                              List<String> stack, Deque<Iterator<String>> pending) {
        onStack.add(node);
        stack.add(node);
        pending.push(adjacency.getOrDefault(node, List.of()).iterator());
    }

    private static Map<String, List<String>> adjacency(Map<String, Draft> drafts, List<IrPath> paths) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (String id : drafts.keySet()) adjacency.put(id, new ArrayList<>());
        for (IrPath p : paths) adjacency.get(p.fromComponent).add(p.toComponent);
        return adjacency;
    }

    private static List<Draft> topologicalOrder(Map<String, Draft> drafts, List<IrPath> paths) {
        Map<String, List<String>> adjacency = adjacency(drafts, paths);
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : drafts.keySet()) inDegree.put(id, 0);
        for (IrPath p : paths) inDegree.merge(p.toComponent, 1, Integer::sum);

        PriorityQueue<Draft> ready = new PriorityQueue<>(Comparator.comparingInt(d -> d.documentIndex));
        for (Draft d : drafts.values()) {
            if (inDegree.get(d.id) == 0) ready.add(d);
        }
        List<Draft> out = new ArrayList<>();
        while (!ready.isEmpty()) {
            Draft d = ready.poll();
            out.add(d);
            for (String next : adjacency.get(d.id)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) ready.add(drafts.get(next));
            }
        }
        return out;
    }

    private static IrComponent toComponent(Draft d, ExecutableHeader h, ExtractContext ctx) {
        ComponentClasses.ComponentClass cls = ComponentClasses.classify(d.classId, d.properties);
        Map<String, String> props = d.properties;
        switch (cls.kind) {
            case SOURCE: {
                String outputPort = null;
                for (DtsxElement group : d.element.children("outputs")) {
                    for (DtsxElement o : group.children("output")) {
                        if (!VariableExtractor.truthy(o.attr("isErrorOut"))) {
                            outputPort = portId(o, d, "Outputs");
                            break;
                        }
                    }
                    if (outputPort != null) break;
                }
                if (outputPort == null && !d.outputPorts.isEmpty()) outputPort = d.outputPorts.get(0);
                return new IrSourceComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props,
                        trimToNull(props.get("SqlCommand")), tableName(props), props.get("AccessMode"), outputPort,
                        binding(cls.binding, d.connectionRef, ctx));
            }
            case DESTINATION: {
                String accessMode = props.get("AccessMode");
                return new IrDestinationComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props,
                        tableName(props), accessMode, writeMode(accessMode), binding(cls.binding, d.connectionRef, ctx));
            }
            case DERIVED_COLUMN:
                return new IrDerivedColumnComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props,
                        derivedColumns(d));
            case LOOKUP:
                return new IrLookupComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props,
                        joinKeys(d), firstNonNull(trimToNull(props.get("SqlCommand")), tableName(props)),
                        noMatchBehavior(props.get("NoMatchBehavior")));
            case CONDITIONAL_SPLIT:
                return conditionalSplit(d);
            case UNION_ALL:
                return new IrUnionAllComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props);
            case AGGREGATE:
                return aggregate(d);
            case SORT:
                return sort(d);
            default:
                ctx.diagnostics.component(DiagnosticCode.UNKNOWN_COMPONENT, h.id, d.id,
                        "Component " + (d.name == null ? d.id : d.name) + " of class '" + (d.classId == null ? "" : d.classId)
                                + "' is not supported; kept as placeholder",
                        "classId", d.classId == null ? "" : d.classId);
                return new IrUnknownComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, props);
        }
    }

    private static IrEndpointBinding binding(IrEndpointBinding byClass, String connectionRef, ExtractContext ctx) {
        IrConnectionManager cm = ctx.connection(connectionRef);
        if (cm != null) {
            if (cm.kind == IrConnectionKind.FILE) return IrEndpointBinding.FILE;
            if (cm.kind == IrConnectionKind.HTTP) return IrEndpointBinding.API;
        }
        return byClass;
    }

    private static String tableName(Map<String, String> props) {
        return firstNonNull(trimToNull(props.get("OpenRowset")), trimToNull(props.get("TableOrViewName")));
    }

    static IrWriteMode writeMode(String accessMode) {
        if (accessMode == null) return IrWriteMode.INSERT;
        String m = accessMode.trim().toLowerCase(Locale.ROOT);
        return m.contains("fastload") || m.equals("3") || m.equals("4") ? IrWriteMode.APPEND : IrWriteMode.INSERT;
    }

    private static String noMatchBehavior(String raw) {
        if (raw == null) return null;
        switch (raw.trim()) {
            case "0":
                return "FAIL_COMPONENT";
            case "1":
                return "NO_MATCH_OUTPUT";
            default:
                return raw.trim();
        }
    }

    private static List<IrNamedExpression> derivedColumns(Draft d) {
        List<IrNamedExpression> out = new ArrayList<>();
        for (DtsxElement col : columns(d.element, "outputs", "output", "outputColumns", "outputColumn")) {
            addExpressionColumn(col, out);
        }
        for (DtsxElement col : columns(d.element, "inputs", "input", "inputColumns", "inputColumn")) {
            addExpressionColumn(col, out);
        }
        String legacy = trimToNull(d.properties.get("Expression"));
        if (out.isEmpty() && legacy != null) {
            out.add(new IrNamedExpression("Derived Column 1", legacy, d.properties.get("FriendlyExpression")));
        }
        return out;
    }

    private static void addExpressionColumn(DtsxElement col, List<IrNamedExpression> out) {
        String expression = columnProperty(col, "Expression");
        if (expression == null) return;
        String name = firstNonNull(col.attr("name"), col.attr("cachedName"), col.attr("refId"));
        out.add(new IrNamedExpression(name, expression, columnProperty(col, "FriendlyExpression")));
    }

    private static List<String> joinKeys(Draft d) {
        List<String> keys = new ArrayList<>();
        String raw = d.properties.get("JoinKeys");
        if (raw != null) {
            for (String k : raw.split(",")) {
                if (!k.isBlank()) keys.add(k.trim());
            }
        }
        if (keys.isEmpty()) {
            for (DtsxElement col : columns(d.element, "inputs", "input", "inputColumns", "inputColumn")) {
                String ref = columnProperty(col, "JoinToReferenceColumn");
                if (ref != null) keys.add(ref);
            }
        }
        return keys;
    }

    private static IrComponent conditionalSplit(Draft d) {
        List<DtsxElement> cases = new ArrayList<>();
        String defaultOutput = null;
        for (DtsxElement group : d.element.children("outputs")) {
            for (DtsxElement o : group.children("output")) {
                if (VariableExtractor.truthy(o.attr("isDefaultOut"))) {
                    defaultOutput = o.attr("name");
                } else if (columnProperty(o, "Expression") != null) {
                    cases.add(o);
                }
            }
        }
        cases.sort(Comparator.comparingInt(o -> parseInt(columnProperty(o, "EvaluationOrder"))));
        List<IrNamedExpression> conditions = new ArrayList<>();
        for (DtsxElement o : cases) {
            conditions.add(new IrNamedExpression(o.attr("name"), columnProperty(o, "Expression"), columnProperty(o, "FriendlyExpression")));
        }
        String legacy = trimToNull(d.properties.get("Expression"));
        if (conditions.isEmpty() && legacy != null) {
            conditions.add(new IrNamedExpression("Case 1", legacy, d.properties.get("FriendlyExpression")));
        }
        return new IrConditionalSplitComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, d.properties,
                conditions, defaultOutput);
    }

    private static IrComponent aggregate(Draft d) {
        List<String> groupBy = new ArrayList<>();
        List<IrNamedExpression> aggregations = new ArrayList<>();
        for (DtsxElement col : columns(d.element, "outputs", "output", "outputColumns", "outputColumn")) {
            String type = columnProperty(col, "AggregationType");
            if (type == null) continue;
            String name = firstNonNull(col.attr("name"), col.attr("refId"));
            int code = parseInt(type);
            if (code == 0) {
                groupBy.add(name);
            } else if (code > 0 && code < AGGREGATIONS.length) {
                String argument = code == 2 ? "*" : name;
                aggregations.add(new IrNamedExpression(name, AGGREGATIONS[code] + "(" + argument + ")", null));
            }
        }
        return new IrAggregateComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, d.properties,
                groupBy, aggregations);
    }

    private static IrComponent sort(Draft d) {
        List<DtsxElement> keyed = new ArrayList<>();
        for (DtsxElement col : columns(d.element, "inputs", "input", "inputColumns", "inputColumn")) {
            int pos = parseInt(columnProperty(col, "NewSortKeyPosition"));
            if (pos != 0 && pos != Integer.MAX_VALUE) keyed.add(col);
        }
        keyed.sort(Comparator.comparingInt(c -> Math.abs(parseInt(columnProperty(c, "NewSortKeyPosition")))));
        List<String> keys = new ArrayList<>();
        for (DtsxElement col : keyed) {
            String name = firstNonNull(col.attr("cachedName"), col.attr("name"), col.attr("lineageId"));
            keys.add(parseInt(columnProperty(col, "NewSortKeyPosition")) < 0 ? name + " DESC" : name);
        }
        return new IrSortComponent(d.id, d.name, d.classId, d.inputPorts, d.outputPorts, d.connectionRef, d.properties,
                keys, VariableExtractor.truthy(d.properties.get("EliminateDuplicates")));
    }

    /** Columns under {@code <portGroup>/<port>/<columnGroup>/<column>}. */
    private static List<DtsxElement> columns(DtsxElement component, String portGroup, String port, String columnGroup, String column) {
        List<DtsxElement> out = new ArrayList<>();
        for (DtsxElement pg : component.children(portGroup)) {
            for (DtsxElement p : pg.children(port)) {
                for (DtsxElement cg : p.children(columnGroup)) {
                    out.addAll(cg.children(column));
                }
            }
        }
        return out;
    }

    /** Value of {@code properties/property[@name]} on a column or port. */
    private static String columnProperty(DtsxElement el, String name) {
        for (DtsxElement group : el.children("properties")) {
            for (DtsxElement p : group.children("property")) {
                if (name.equals(p.attr("name"))) return trimToNull(p.text());
            }
        }
        return null;
    }

    private static int parseInt(String s) {
        if (s == null) return Integer.MAX_VALUE;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String trimToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
