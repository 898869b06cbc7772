package io.github.eutro.tacgraph.core.passes;

/**
 * A pass that modifies its input and returns it, as every derivation over a
 * {@link io.github.eutro.tacgraph.core.Program} does.
 *
 * @param <T> The type modified.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
