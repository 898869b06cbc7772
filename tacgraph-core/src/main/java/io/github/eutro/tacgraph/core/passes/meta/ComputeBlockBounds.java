package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.FactIndex;
import io.github.eutro.tacgraph.core.facts.Stmt;
import io.github.eutro.tacgraph.core.graph.BlockBounds;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.report.Violation;
import io.github.eutro.tacgraph.core.util.Pair;

import java.util.*;

/**
 * Computes {@link ProgramExts#BLOCK_BOUNDS}.
 * <p>
 * The global statement order, restricted to pairs within one block, is a chain over the block's
 * non-PHI statements. Its head has no predecessor in the block, its tail no successor.
 * A block whose statements form more than one chain is reported, and gets neither.
 */
public class ComputeBlockBounds implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeBlockBounds INSTANCE = new ComputeBlockBounds();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);

        Set<Stmt> hasPred = new HashSet<>();
        Set<Stmt> hasSucc = new HashSet<>();
        for (Pair<Stmt, Stmt> next : program.facts.statementNext()) {
            Block block = index.block(next.left);
            if (block == null
                    || !block.equals(index.block(next.right))
                    || index.isPhi(next.left)
                    || index.isPhi(next.right)) {
                continue;
            }
            hasSucc.add(next.left);
            hasPred.add(next.right);
        }

        Set<Block> chained = new LinkedHashSet<>();
        Map<Block, List<Stmt>> heads = new HashMap<>();
        Map<Block, List<Stmt>> tails = new HashMap<>();
        index.stmtBlocks().forEach((stmt, block) -> {
            if (index.isPhi(stmt)) return;
            chained.add(block);
            if (!hasPred.contains(stmt)) heads.computeIfAbsent(block, $ -> new ArrayList<>()).add(stmt);
            if (!hasSucc.contains(stmt)) tails.computeIfAbsent(block, $ -> new ArrayList<>()).add(stmt);
        });

        Map<Block, Stmt> headMap = new HashMap<>();
        Map<Block, Stmt> tailMap = new HashMap<>();
        for (Block block : chained) {
            List<Stmt> blockHeads = heads.getOrDefault(block, Collections.emptyList());
            List<Stmt> blockTails = tails.getOrDefault(block, Collections.emptyList());
            if (blockHeads.size() == 1 && blockTails.size() == 1) {
                headMap.put(block, blockHeads.get(0));
                tailMap.put(block, blockTails.get(0));
            } else {
                program.violations.report(Violation.Kind.STRUCTURAL, block,
                        "statements of block do not form a single chain",
                        Pair.of(blockHeads, blockTails));
            }
        }

        program.attachExt(ProgramExts.BLOCK_BOUNDS, new BlockBounds(headMap, tailMap));
        ms.validate(MetadataState.BLOCK_BOUNDS);
    }
}
