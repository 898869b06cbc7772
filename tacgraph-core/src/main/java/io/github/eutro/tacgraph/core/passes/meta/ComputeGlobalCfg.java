package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.graph.BlockBounds;
import io.github.eutro.tacgraph.core.graph.GlobalCfg;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.util.Pair;

import java.util.*;

/**
 * Computes {@link ProgramExts#GLOBAL_CFG}, the union of:
 * <ul>
 *     <li>every local edge, except the placeholder edge from a call site to its continuation;</li>
 *     <li>an edge from every call site to the entry block of the called function;</li>
 *     <li>an edge from every block of a function ending in {@code RETURNPRIVATE}
 *     to the continuation of every call to that function.</li>
 * </ul>
 */
public class ComputeGlobalCfg implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeGlobalCfg INSTANCE = new ComputeGlobalCfg();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED, MetadataState.BLOCK_BOUNDS);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);
        BlockBounds bounds = program.getExtOrThrow(ProgramExts.BLOCK_BOUNDS);
        FactStore facts = program.facts;

        Set<Edge> placeholders = new HashSet<>();
        for (CallReturn cr : facts.functionCallReturns()) {
            placeholders.add(cr.placeholderEdge());
        }

        Set<Edge> edges = new LinkedHashSet<>();
        for (Edge edge : facts.localEdges()) {
            if (!placeholders.contains(edge)) edges.add(edge);
        }

        for (Pair<Block, Func> call : facts.callGraphEdges()) {
            Block entry = index.entry(call.right);
            if (entry != null) edges.add(Edge.of(call.left, entry));
        }

        Map<Func, List<Block>> returnBlocks = new HashMap<>();
        index.blockFunctions().forEach((block, func) -> {
            Optional<Stmt> tail = bounds.tail(block);
            if (tail.isPresent() && index.opcode(tail.get()) == Opcode.RETURNPRIVATE) {
                returnBlocks.computeIfAbsent(func, $ -> new ArrayList<>()).add(block);
            }
        });
        for (CallReturn cr : facts.functionCallReturns()) {
            for (Block exit : returnBlocks.getOrDefault(cr.function, Collections.emptyList())) {
                edges.add(Edge.of(exit, cr.continuation));
            }
        }

        program.attachExt(ProgramExts.GLOBAL_CFG, new GlobalCfg(edges));
        ms.validate(MetadataState.GLOBAL_CFG);
    }
}
