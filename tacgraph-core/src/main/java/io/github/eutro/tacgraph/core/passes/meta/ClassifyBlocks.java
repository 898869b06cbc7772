package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.conf.AnalysisConfig;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.graph.BlockBounds;
import io.github.eutro.tacgraph.core.graph.BlockClassification;
import io.github.eutro.tacgraph.core.graph.GlobalCfg;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.report.Violation;
import io.github.eutro.tacgraph.core.util.Pair;

import java.util.*;

/**
 * Computes {@link ProgramExts#CLASSIFICATION}.
 * <p>
 * Function exits are sinks of the local control-flow graph, not of the global one.
 */
public class ClassifyBlocks implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final ClassifyBlocks INSTANCE = new ClassifyBlocks();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED, MetadataState.BLOCK_BOUNDS, MetadataState.GLOBAL_CFG);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);
        BlockBounds bounds = program.getExtOrThrow(ProgramExts.BLOCK_BOUNDS);
        GlobalCfg cfg = program.getExtOrThrow(ProgramExts.GLOBAL_CFG);
        AnalysisConfig config = program.config;

        Set<Block> hasIncoming = new HashSet<>();
        Set<Block> hasOutgoing = new HashSet<>();
        for (Edge edge : program.facts.localEdges()) {
            hasOutgoing.add(edge.from);
            hasIncoming.add(edge.to);
        }
        Set<Block> functionExits = new TreeSet<>(hasIncoming);
        functionExits.removeAll(hasOutgoing);

        Set<Block> validTerminals = new TreeSet<>();
        bounds.tails().forEach((block, tail) -> {
            if (config.getValidTerminalOpcodes().contains(index.opcode(tail))) {
                validTerminals.add(block);
            }
        });

        Set<Func> fallbacks = new TreeSet<>();
        for (Pair<Func, String> pub : program.facts.publicFunctions()) {
            if (pub.right.equalsIgnoreCase(config.getFallbackSelector())) {
                fallbacks.add(pub.left);
            }
        }
        if (fallbacks.size() > 1) {
            for (Func func : fallbacks) {
                program.violations.report(Violation.Kind.CLASSIFICATION, func,
                        "more than one function has the fallback selector", fallbacks);
            }
        }

        Set<Block> unclassifiable = new TreeSet<>();
        for (Edge edge : cfg.edges()) {
            if (cfg.successors(edge.to).isEmpty() && !bounds.tail(edge.to).isPresent()) {
                unclassifiable.add(edge.to);
            }
        }
        for (Block sink : unclassifiable) {
            program.violations.report(Violation.Kind.CLASSIFICATION, sink,
                    "program exit has no statement to classify", cfg.predecessors(sink));
        }

        program.attachExt(ProgramExts.CLASSIFICATION, new BlockClassification(
                config.getGlobalEntryBlock(), functionExits, validTerminals, fallbacks));
        ms.validate(MetadataState.CLASSIFIED);
    }
}
