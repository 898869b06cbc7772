package io.github.eutro.tacgraph.core.passes;

import io.github.eutro.tacgraph.core.passes.misc.ChainedPass;

/**
 * One step of an analysis: a derivation over a {@link io.github.eutro.tacgraph.core.Program},
 * or more generally anything taking an {@code A} to a {@code B}.
 * <p>
 * Derivations attach their results to the program they are given and return it. Such passes are
 * {@link InPlaceIRPass in-place}, and only in-place passes can be used to compute
 * {@link io.github.eutro.tacgraph.core.ext.MetadataState metadata} on demand.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass returns its input, modified, rather than something new.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * A short name for this pass, for logs and error messages.
     *
     * @return The name.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Run {@code next} on the result of this pass.
     *
     * @param next The following pass.
     * @param <C>  Its result type.
     * @return The chain of both.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
