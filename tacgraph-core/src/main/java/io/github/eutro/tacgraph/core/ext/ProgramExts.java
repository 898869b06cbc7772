package io.github.eutro.tacgraph.core.ext;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.FactIndex;
import io.github.eutro.tacgraph.core.graph.*;
import io.github.eutro.tacgraph.core.passes.meta.*;

import java.util.Set;

/**
 * The {@link Ext}s under which derived results are attached to a {@link Program}.
 */
public class ProgramExts {
    /**
     * Which results are valid.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The single-valued membership maps, with inconsistent entities removed.
     * <p>
     * Computed by {@link VerifyFacts}.
     */
    public static final Ext<FactIndex> FACT_INDEX = Ext.create(FactIndex.class, "FACT_INDEX");

    /**
     * The first and last statement of each block.
     * <p>
     * Computed by {@link ComputeBlockBounds}.
     */
    public static final Ext<BlockBounds> BLOCK_BOUNDS = Ext.create(BlockBounds.class, "BLOCK_BOUNDS");

    /**
     * The function each variable and statement belongs to.
     * <p>
     * Computed by {@link ComputeVarOwners}.
     */
    public static final Ext<VarOwnership> VAR_OWNERSHIP = Ext.create(VarOwnership.class, "VAR_OWNERSHIP");

    /**
     * Zero-based argument and return value bindings at private call and return sites.
     * <p>
     * Computed by {@link BindCallArgs}.
     */
    public static final Ext<CallBindings> CALL_BINDINGS = Ext.create(CallBindings.class, "CALL_BINDINGS");

    /**
     * The inter-procedural control-flow graph.
     * <p>
     * Computed by {@link ComputeGlobalCfg}.
     */
    public static final Ext<GlobalCfg> GLOBAL_CFG = Ext.create(GlobalCfg.class, "GLOBAL_CFG");

    /**
     * Function exits, valid terminals, the entry block and the fallback function.
     * <p>
     * Computed by {@link ClassifyBlocks}.
     */
    public static final Ext<BlockClassification> CLASSIFICATION = Ext.create(BlockClassification.class, "CLASSIFICATION");

    /**
     * The blocks reachable from the global entry block in the global CFG.
     * <p>
     * Computed by {@link ComputeReachability}.
     */
    public static final Ext<Set<Block>> REACHABLE_BLOCKS = Ext.create(Set.class, "REACHABLE_BLOCKS");
}
