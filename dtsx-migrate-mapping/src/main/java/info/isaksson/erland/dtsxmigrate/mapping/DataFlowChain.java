package info.isaksson.erland.dtsxmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrPath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One route through a data flow, from a component without inputs to a component without outputs.
 *
 * <p>{@link #pathIds} has one entry less than {@link #componentIds}: path {@code i} connects
 * component {@code i} to component {@code i + 1}.</p>
 */
@JsonPropertyOrder({"dataFlowId","componentIds","pathIds"})
public final class DataFlowChain {
    public final String dataFlowId;
    public final List<String> componentIds;
    public final List<String> pathIds;

    public DataFlowChain(String dataFlowId, List<String> componentIds, List<String> pathIds) {
        this.dataFlowId = Objects.requireNonNull(dataFlowId, "dataFlowId");
        this.componentIds = List.copyOf(componentIds);
        this.pathIds = List.copyOf(pathIds);
    }

    public String startId() {
        return componentIds.get(0);
    }

    public String endId() {
        return componentIds.get(componentIds.size() - 1);
    }

    /**
     * Enumerates every chain of an acyclic data flow. Starts follow component order; at a fork the
     * branches follow the component order of their targets, then path id.
     */
    public static List<DataFlowChain> of(IrDataFlow dataFlow) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < dataFlow.components.size(); i++) {
            position.put(dataFlow.components.get(i).id, i);
        }
        Map<String, List<IrPath>> outgoing = new HashMap<>();
        Set<String> hasIncoming = new HashSet<>();
        for (IrPath p : dataFlow.paths) {
            if (!position.containsKey(p.fromComponent) || !position.containsKey(p.toComponent)) continue;
            outgoing.computeIfAbsent(p.fromComponent, k -> new ArrayList<>()).add(p);
            hasIncoming.add(p.toComponent);
        }
        Comparator<IrPath> branchOrder = Comparator
                .comparing((IrPath p) -> position.get(p.toComponent))
                .thenComparing(p -> p.id);
        outgoing.values().forEach(l -> l.sort(branchOrder));

        List<DataFlowChain> chains = new ArrayList<>();
        for (IrComponent c : dataFlow.components) {
            if (hasIncoming.contains(c.id)) continue;
            List<String> components = new ArrayList<>();
            components.add(c.id);
            walk(dataFlow.id, c.id, components, new ArrayList<>(), outgoing, chains);
        }
        return chains;
    }

    private static void walk(String dataFlowId, String current, List<String> components, List<String> paths,
                             Map<String, List<IrPath>> outgoing, List<DataFlowChain> out) {
        List<IrPath> next = outgoing.getOrDefault(current, List.of());
        if (next.isEmpty()) {
            out.add(new DataFlowChain(dataFlowId, components, paths));
            return;
        }
        for (IrPath p : next) {
            // guards against a cycle slipping past validation
            if (components.contains(p.toComponent)) continue;
            components.add(p.toComponent);
            paths.add(p.id);
            walk(dataFlowId, p.toComponent, components, paths, outgoing, out);
            components.remove(components.size() - 1);
            paths.remove(paths.size() - 1);
        }
    }

    @Override
    public String toString() {
        return String.join(" -> ", componentIds);
    }
}
