package io.github.eutro.tacgraph.core.facts;

import java.util.Objects;

/**
 * A private call site together with the block execution continues in once the callee returns.
 * <p>
 * The lifter also records a local edge from {@link #caller} to {@link #continuation};
 * that edge is only a placeholder and is not real control flow.
 */
public final class CallReturn {
    /**
     * The block ending in the {@code CALLPRIVATE}.
     */
    public final Block caller;
    /**
     * The called function.
     */
    public final Func function;
    /**
     * The block the call returns to.
     */
    public final Block continuation;

    private CallReturn(Block caller, Func function, Block continuation) {
        this.caller = Objects.requireNonNull(caller);
        this.function = Objects.requireNonNull(function);
        this.continuation = Objects.requireNonNull(continuation);
    }

    public static CallReturn of(Block caller, Func function, Block continuation) {
        return new CallReturn(caller, function, continuation);
    }

    /**
     * Get the placeholder local edge this call site records.
     *
     * @return The edge from the caller to the continuation.
     */
    public Edge placeholderEdge() {
        return Edge.of(caller, continuation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallReturn that = (CallReturn) o;
        return caller.equals(that.caller)
                && function.equals(that.function)
                && continuation.equals(that.continuation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caller, function, continuation);
    }

    @Override
    public String toString() {
        return caller + " -call " + function + "-> " + continuation;
    }
}
