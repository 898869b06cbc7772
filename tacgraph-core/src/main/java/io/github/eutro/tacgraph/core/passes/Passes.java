package io.github.eutro.tacgraph.core.passes;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.passes.meta.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Pre-composed passes.
 */
public class Passes {
    /**
     * Every derivation, in dependency order.
     */
    public static final IRPass<Program, Program> FULL =
            VerifyFacts.INSTANCE
                    .then(ComputeBlockBounds.INSTANCE)
                    .then(ComputeVarOwners.INSTANCE)
                    .then(BindCallArgs.INSTANCE)
                    .then(ComputeGlobalCfg.INSTANCE)
                    .then(ClassifyBlocks.INSTANCE)
                    .then(ComputeReachability.INSTANCE);

    /**
     * The passes of {@link #FULL}, for running them one at a time.
     */
    public static final List<InPlaceIRPass<Program>> STAGES = Collections.unmodifiableList(Arrays.<InPlaceIRPass<Program>>asList(
            VerifyFacts.INSTANCE,
            ComputeBlockBounds.INSTANCE,
            ComputeVarOwners.INSTANCE,
            BindCallArgs.INSTANCE,
            ComputeGlobalCfg.INSTANCE,
            ClassifyBlocks.INSTANCE,
            ComputeReachability.INSTANCE
    ));
}
