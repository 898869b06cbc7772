package io.github.eutro.tacgraph.core;

import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.graph.*;
import io.github.eutro.tacgraph.core.report.Violation;

import java.util.List;
import java.util.Set;

/**
 * The published outputs of one completed analysis run. Immutable, and safe to share between threads.
 */
public final class AnalysisResult {
    /**
     * The name of the analysed contract.
     */
    public final String name;
    public final BlockBounds blockBounds;
    public final VarOwnership varOwnership;
    public final CallBindings callBindings;
    public final GlobalCfg globalCfg;
    public final BlockClassification classification;
    public final Set<Block> reachableBlocks;
    /**
     * The inconsistencies found, in the order they were found.
     */
    public final List<Violation> violations;

    private AnalysisResult(String name, Program program) {
        this.name = name;
        blockBounds = program.getExtOrThrow(ProgramExts.BLOCK_BOUNDS);
        varOwnership = program.getExtOrThrow(ProgramExts.VAR_OWNERSHIP);
        callBindings = program.getExtOrThrow(ProgramExts.CALL_BINDINGS);
        globalCfg = program.getExtOrThrow(ProgramExts.GLOBAL_CFG);
        classification = program.getExtOrThrow(ProgramExts.CLASSIFICATION);
        reachableBlocks = program.getExtOrThrow(ProgramExts.REACHABLE_BLOCKS);
        violations = program.violations.toList();
    }

    /**
     * Collect the results of a program every pass has run on.
     *
     * @param name    The name of the contract.
     * @param program The program.
     * @return The result.
     * @throws IllegalStateException If some result has not been computed.
     */
    public static AnalysisResult of(String name, Program program) {
        return new AnalysisResult(name, program);
    }

    /**
     * Whether any violation was found, so that some facts were left out of the results.
     *
     * @return Whether the run is degraded.
     */
    public boolean isDegraded() {
        return !violations.isEmpty();
    }
}
