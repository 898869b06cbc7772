package io.github.eutro.tacgraph.core.ext;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.passes.IRPass;
import io.github.eutro.tacgraph.core.passes.meta.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.StringJoiner;

/**
 * Keeps track of which derived results of a {@link Program} have been computed.
 * <p>
 * A result becomes valid when the pass producing it calls {@link #validate(MetaKind...)}.
 * Passes that read another result call {@link #ensureValid(Object, ComputableMetaKind, ComputableMetaKind[])},
 * which runs the producing pass if nothing has yet.
 */
public class MetadataState {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataState.class);
    private static final List<MetaKind> KINDS = new ArrayList<>();

    /**
     * A kind of derived result whose presence can be checked on {@link MetadataState}.
     */
    public static class MetaKind {
        final int index;
        final String name;

        MetaKind(String name) {
            synchronized (KINDS) {
                this.index = KINDS.size();
                KINDS.add(this);
            }
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of derived result, together with the pass that produces it.
     *
     * @param <T> The IR the pass runs on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T> producer;

        ComputableMetaKind(String name, IRPass<T, T> producer) {
            super(name);
            if (!producer.isInPlace()) {
                throw new IllegalArgumentException(name + " is produced by " + producer.name() + ", which is not in place");
            }
            this.producer = producer;
        }
    }

    /**
     * Results that can be derived for programs.
     */
    public static final ComputableMetaKind<Program>
            VERIFIED = new ComputableMetaKind<>("VERIFIED", VerifyFacts.INSTANCE),
            BLOCK_BOUNDS = new ComputableMetaKind<>("BLOCK_BOUNDS", ComputeBlockBounds.INSTANCE),
            VAR_OWNERS = new ComputableMetaKind<>("VAR_OWNERS", ComputeVarOwners.INSTANCE),
            CALL_BINDINGS = new ComputableMetaKind<>("CALL_BINDINGS", BindCallArgs.INSTANCE),
            GLOBAL_CFG = new ComputableMetaKind<>("GLOBAL_CFG", ComputeGlobalCfg.INSTANCE),
            CLASSIFIED = new ComputableMetaKind<>("CLASSIFIED", ClassifyBlocks.INSTANCE),
            REACHABILITY = new ComputableMetaKind<>("REACHABILITY", ComputeReachability.INSTANCE);

    private final BitSet computed = new BitSet();

    /**
     * Check whether the given result has been computed.
     *
     * @param kind The kind of result.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return computed.get(kind.index);
    }

    /**
     * Compute each of the given results that has not been computed yet, in order.
     *
     * @param t     The thing the passes run on.
     * @param first The first kind.
     * @param rest  The other kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... rest) {
        compute(t, first);
        for (ComputableMetaKind<T> kind : rest) {
            compute(t, kind);
        }
    }

    private <T> void compute(T t, ComputableMetaKind<T> kind) {
        if (isValid(kind)) return;
        LOGGER.debug("computing {} on demand", kind);
        kind.producer.run(t);
        validate(kind);
    }

    /**
     * Mark the given results as computed.
     *
     * @param kinds The kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            computed.set(kind.index);
        }
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "MetadataState[", "]");
        for (int i = computed.nextSetBit(0); i >= 0; i = computed.nextSetBit(i + 1)) {
            sj.add(KINDS.get(i).name);
        }
        return sj.toString();
    }
}
