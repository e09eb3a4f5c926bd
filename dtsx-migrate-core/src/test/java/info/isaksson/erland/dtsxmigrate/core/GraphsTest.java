package info.isaksson.erland.dtsxmigrate.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GraphsTest {

    @Test
    void acyclicGraphHasNoCycleAndSortedTopologicalOrder() {
        Map<String, Set<String>> succ = Map.of("a", Set.of("c", "b"), "b", Set.of("d"), "c", Set.of("d"));
        assertEquals(List.of(), Graphs.findCycle(List.of("d", "c", "b", "a"), succ));
        assertEquals(List.of("a", "b", "c", "d"), Graphs.topologicalOrder(List.of("d", "c", "b", "a"), succ));
    }

    @Test
    void reportsFirstCycleInVisitOrder() {
        Map<String, Set<String>> succ = Map.of("A", Set.of("B"), "B", Set.of("C"), "C", Set.of("A"), "X", Set.of("A"));
        assertEquals(List.of("A", "B", "C"), Graphs.findCycle(List.of("X", "C", "B", "A"), succ));
        assertEquals(List.of(), Graphs.topologicalOrder(List.of("A", "B", "C", "X"), succ));
    }

    @Test
    void selfLoopIsCycleOfOne() {
        assertEquals(List.of("A"), Graphs.findCycle(List.of("A", "B"), Map.of("A", Set.of("A"))));
    }

    @Test
    void repeatedCallsGiveSameAnswer() {
        Map<String, Set<String>> succ = Map.of("b", Set.of("a"), "a", Set.of("b"));
        List<String> first = Graphs.findCycle(List.of("a", "b"), succ);
        assertEquals(first, Graphs.findCycle(List.of("b", "a"), succ));
        assertEquals(List.of("a", "b"), first);
    }

    @Test
    void successorsOutsideTheNodeSetAreIgnoredForOrdering() {
        assertEquals(List.of("a", "b"), Graphs.topologicalOrder(List.of("a", "b"), Map.of("a", Set.of("b", "zz"))));
    }

    @Test
    void deepChainIsSearchedWithoutExhaustingTheThreadStack() {
        int depth = 100_000;
        List<String> nodes = new ArrayList<>();
        Map<String, Set<String>> succ = new HashMap<>();
        for (int i = 0; i < depth; i++) {
            String n = String.format("n%06d", i);
            nodes.add(n);
            if (i + 1 < depth) succ.put(n, Set.of(String.format("n%06d", i + 1)));
        }
        assertEquals(List.of(), Graphs.findCycle(nodes, succ));
        assertEquals(depth, Graphs.topologicalOrder(nodes, succ).size());

        succ.put(nodes.get(depth - 1), Set.of(nodes.get(0)));
        List<String> cycle = Graphs.findCycle(nodes, succ);
        assertEquals(depth, cycle.size());
        assertEquals("n000000", cycle.get(0));
        assertEquals("n099999", cycle.get(depth - 1));
    }
}
