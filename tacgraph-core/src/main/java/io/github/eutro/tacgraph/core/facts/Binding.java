package io.github.eutro.tacgraph.core.facts;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A positional binding of a variable at a call or return site.
 * <p>
 * The site is a caller {@link Block} for actual arguments and actual return receivers,
 * and a {@link Func} for formal parameters and formal return values.
 * Positions are zero-based.
 *
 * @param <S> The type of the site.
 */
public final class Binding<S extends EntityId> implements Comparable<Binding<?>> {
    public final S site;
    public final Var var;
    public final int position;

    private Binding(S site, Var var, int position) {
        this.site = Objects.requireNonNull(site);
        this.var = Objects.requireNonNull(var);
        this.position = position;
    }

    public static <S extends EntityId> Binding<S> of(S site, Var var, int position) {
        return new Binding<>(site, var, position);
    }

    @Override
    public int compareTo(@NotNull Binding<?> o) {
        int c = site.compareTo(o.site);
        if (c != 0) return c;
        c = Integer.compare(position, o.position);
        return c != 0 ? c : var.compareTo(o.var);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding<?> binding = (Binding<?>) o;
        return position == binding.position && site.equals(binding.site) && var.equals(binding.var);
    }

    @Override
    public int hashCode() {
        return Objects.hash(site, var, position);
    }

    @Override
    public String toString() {
        return site + "#" + position + " = " + var;
    }
}
