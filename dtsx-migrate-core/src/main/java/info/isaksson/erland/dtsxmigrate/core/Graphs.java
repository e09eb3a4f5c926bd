package info.isaksson.erland.dtsxmigrate.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic cycle search and topological ordering over string-keyed directed graphs.
 *
 * <p>Nodes and successors are visited in natural (sorted) order. Both searches keep an explicit
 * stack, so depth is bounded by the heap rather than the thread stack. Every call works on its own
 * visited set and path.</p>
 */
public final class Graphs {

    private Graphs() {}

    /**
     * The first cycle found, as the nodes in edge order without repeating the first one; empty when
     * the graph is acyclic. A self-loop is a cycle of one.
     */
    public static List<String> findCycle(Collection<String> nodes, Map<String, ? extends Collection<String>> successors) {
        Set<String> done = new HashSet<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        for (String root : new TreeSet<>(nodes)) {
            if (done.contains(root)) continue;
            enter(root, successors, path, onPath, pending);
            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    pending.pop();
                    String finished = path.remove(path.size() - 1);
                    onPath.remove(finished);
                    done.add(finished);
                    continue;
                }
                String s = it.next();
                if (onPath.contains(s)) {
                    return new ArrayList<>(path.subList(path.indexOf(s), path.size()));
                }
                if (!done.contains(s)) enter(s, successors, path, onPath, pending);
            }
        }
        return List.of();
    }

    private static void enter(String node, Map<String, ? extends Collection<String>> successors,
                              List<String> path, Set<String> onPath, Deque<Iterator<String>> pending) {
        path.add(node);
        onPath.add(node);
        pending.push(new TreeSet<>(next(successors, node)).iterator());
    }

    /**
     * Kahn's algorithm, always taking the smallest ready node. Returns an empty list when the graph
     * has a cycle. Successors outside {@code nodes} are ignored.
     */
    public static List<String> topologicalOrder(Collection<String> nodes, Map<String, ? extends Collection<String>> successors) {
        Set<String> all = new TreeSet<>(nodes);
        Map<String, Integer> indegree = new HashMap<>();
        for (String n : all) indegree.put(n, 0);
        for (String n : all) {
            for (String s : new TreeSet<>(next(successors, n))) {
                if (all.contains(s)) indegree.merge(s, 1, Integer::sum);
            }
        }
        TreeSet<String> ready = new TreeSet<>();
        for (String n : all) {
            if (indegree.get(n) == 0) ready.add(n);
        }
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String n = ready.pollFirst();
            order.add(n);
            for (String s : new TreeSet<>(next(successors, n))) {
                if (!all.contains(s)) continue;
                if (indegree.merge(s, -1, Integer::sum) == 0) ready.add(s);
            }
        }
        return order.size() == all.size() ? order : List.of();
    }

    private static Collection<String> next(Map<String, ? extends Collection<String>> successors, String node) {
        Collection<String> c = successors.get(node);
        return c == null ? List.of() : c;
    }
}
