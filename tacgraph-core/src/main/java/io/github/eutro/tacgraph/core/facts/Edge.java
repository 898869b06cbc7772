package io.github.eutro.tacgraph.core.facts;

import java.util.Objects;

/**
 * A directed control-flow edge between two blocks.
 */
public final class Edge implements Comparable<Edge> {
    public final Block from;
    public final Block to;

    private Edge(Block from, Block to) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
    }

    public static Edge of(Block from, Block to) {
        return new Edge(from, to);
    }

    @Override
    public int compareTo(Edge o) {
        int c = from.compareTo(o.from);
        return c != 0 ? c : to.compareTo(o.to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return from.equals(edge.from) && to.equals(edge.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
