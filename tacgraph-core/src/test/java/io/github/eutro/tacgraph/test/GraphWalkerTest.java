package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphWalkerTest {
    private static final Map<String, List<String>> GRAPH = new HashMap<>();

    static {
        GRAPH.put("a", Arrays.asList("b", "c"));
        GRAPH.put("b", Collections.singletonList("d"));
        GRAPH.put("c", Arrays.asList("d", "a"));
        GRAPH.put("d", Collections.emptyList());
    }

    private static GraphWalker<String> walker(String root) {
        return new GraphWalker<>(root, n -> GRAPH.getOrDefault(n, Collections.emptyList()));
    }

    @Test
    void testPreOrderVisitsEachOnce() {
        List<String> order = walker("a").preOrder().toList();
        assertEquals("a", order.get(0));
        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c", "d")), new HashSet<>(order));
        assertEquals(4, order.size());
    }

    @Test
    void testPostOrderChildrenFirst() {
        List<String> order = walker("a").postOrder().toList();
        assertEquals(4, order.size());
        assertEquals("a", order.get(order.size() - 1));
        assertTrue(order.indexOf("d") < order.indexOf("b"));
    }

    @Test
    void testLeaf() {
        assertEquals(Collections.singletonList("d"), walker("d").preOrder().toList());
        assertEquals(Collections.singletonList("x"), walker("x").postOrder().toList());
    }
}
