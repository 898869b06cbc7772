package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.FactIndex;
import io.github.eutro.tacgraph.core.graph.GlobalCfg;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes {@link ProgramExts#REACHABLE_BLOCKS}: the blocks reachable from the global entry block
 * in the global CFG. Empty if the entry block does not occur in the facts.
 */
public class ComputeReachability implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeReachability INSTANCE = new ComputeReachability();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED, MetadataState.GLOBAL_CFG);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);
        GlobalCfg cfg = program.getExtOrThrow(ProgramExts.GLOBAL_CFG);

        Block entry = program.config.getGlobalEntryBlock();
        Set<Block> reachable = new TreeSet<>();
        if (index.knownBlocks().contains(entry)) {
            for (Block block : cfg.walker(entry).preOrder()) {
                reachable.add(block);
            }
        }

        program.attachExt(ProgramExts.REACHABLE_BLOCKS, Collections.unmodifiableSet(reachable));
        ms.validate(MetadataState.REACHABILITY);
    }
}
