package io.github.eutro.tacgraph.core.graph;

import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Edge;
import io.github.eutro.tacgraph.core.util.GraphWalker;

import java.util.*;

/**
 * The inter-procedural control-flow graph, in which private calls jump to the callee's entry
 * block and private returns jump to every continuation of every call to the function.
 */
public final class GlobalCfg {
    private final SortedSet<Edge> edges;
    private final Map<Block, List<Block>> succs = new HashMap<>();
    private final Map<Block, List<Block>> preds = new HashMap<>();

    public GlobalCfg(Collection<Edge> edges) {
        this.edges = Collections.unmodifiableSortedSet(new TreeSet<>(edges));
        for (Edge edge : this.edges) {
            succs.computeIfAbsent(edge.from, $ -> new ArrayList<>()).add(edge.to);
            preds.computeIfAbsent(edge.to, $ -> new ArrayList<>()).add(edge.from);
        }
    }

    /**
     * Get every edge, sorted.
     *
     * @return The edges.
     */
    public SortedSet<Edge> edges() {
        return edges;
    }

    public boolean hasEdge(Block from, Block to) {
        return edges.contains(Edge.of(from, to));
    }

    public List<Block> successors(Block block) {
        List<Block> list = succs.get(block);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public List<Block> predecessors(Block block) {
        List<Block> list = preds.get(block);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * Create a walker over the blocks reachable from {@code root}.
     *
     * @param root The block to start from.
     * @return The walker.
     */
    public GraphWalker<Block> walker(Block root) {
        return new GraphWalker<>(root, this::successors);
    }
}
