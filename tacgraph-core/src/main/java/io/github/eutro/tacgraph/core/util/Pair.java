package io.github.eutro.tacgraph.core.util;

import java.util.Objects;

/**
 * One tuple of a binary relation, such as {@code Statement_Block(stmt, block)}.
 * Two pairs are equal when both columns are.
 *
 * @param <L> The type of the first column.
 * @param <R> The type of the second column.
 */
public final class Pair<L, R> {
    public final L left;
    public final R right;

    private Pair(L left, R right) {
        this.left = left;
        this.right = right;
    }

    public static <L, R> Pair<L, R> of(L left, R right) {
        return new Pair<>(left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Pair)) return false;
        Pair<?, ?> that = (Pair<?, ?>) o;
        return Objects.equals(left, that.left) && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(left) + Objects.hashCode(right);
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
