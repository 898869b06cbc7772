package io.github.eutro.tacgraph.core.passes.misc;

import io.github.eutro.tacgraph.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * The composition of two passes, as built by {@link IRPass#then(IRPass)}.
 * <p>
 * Nested chains are flattened when built, so a long {@code a.then(b).then(c)...} runs as one list.
 * If a pass fails, the exception gets a suppressed note naming that pass and its position.
 *
 * @param <A> The input type.
 * @param <B> The type passed from the first pass to the second.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes = new ArrayList<>();
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        addFlattened(first);
        addFlattened(next);
        isInPlace = first.isInPlace() && next.isInPlace();
    }

    private void addFlattened(IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            passes.add(pass);
        }
    }

    /**
     * Get the passes of this chain, in the order they run.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @Override
    public String name() {
        StringJoiner sj = new StringJoiner(" -> ");
        for (IRPass<?, ?> pass : passes) {
            sj.add(pass.name());
        }
        return sj.toString();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("in pass " + i + " (" + pass.name() + ") of " + name()));
                throw e;
            }
        }
        return (C) acc;
    }
}
