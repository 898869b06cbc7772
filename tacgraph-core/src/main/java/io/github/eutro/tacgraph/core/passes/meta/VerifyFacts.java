package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.report.AnalysisAbortedException;
import io.github.eutro.tacgraph.core.report.Violation;
import io.github.eutro.tacgraph.core.report.Violations;
import io.github.eutro.tacgraph.core.util.Pair;

import java.util.*;

import static io.github.eutro.tacgraph.core.util.Relations.group;
import static io.github.eutro.tacgraph.core.util.Relations.putMulti;

/**
 * Checks the membership facts of a program, and computes {@link ProgramExts#FACT_INDEX}.
 * <p>
 * Every statement must have exactly one opcode and one block, every block exactly one function,
 * and every function at most one entry block. Entities that break this are reported as
 * {@link Violation.Kind#STRUCTURAL} violations and left out of the index.
 * <p>
 * The run is aborted with an {@link AnalysisAbortedException} if there are no function
 * membership facts at all, or more statements than the configured limit.
 */
public class VerifyFacts implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyFacts INSTANCE = new VerifyFacts();

    @Override
    public void runInPlace(Program program) {
        FactStore facts = program.facts;
        Violations violations = program.violations;

        int maxStatements = program.config.getMaxStatements();
        if (maxStatements > 0) {
            int count = facts.statementCount();
            if (count > maxStatements) {
                throw new AnalysisAbortedException(String.format(
                        "too many statements: %d > %d", count, maxStatements));
            }
        }
        if (facts.inFunction().isEmpty()) {
            throw new AnalysisAbortedException("no function membership facts");
        }

        Map<Stmt, Set<Opcode>> opcodeSets = group(facts.statementOpcodes());
        Map<Stmt, Set<Block>> blockSets = group(facts.statementBlocks());
        Set<Stmt> stmts = new LinkedHashSet<>(opcodeSets.keySet());
        stmts.addAll(blockSets.keySet());
        for (Pair<Stmt, Stmt> next : facts.statementNext()) {
            stmts.add(next.left);
            stmts.add(next.right);
        }
        for (OperandSlot slot : facts.statementUses()) stmts.add(slot.stmt);
        for (OperandSlot slot : facts.statementDefines()) stmts.add(slot.stmt);

        Map<Stmt, Opcode> opcodes = new LinkedHashMap<>();
        Map<Stmt, Block> stmtBlocks = new LinkedHashMap<>();
        for (Stmt stmt : stmts) {
            boolean ok = checkSingle(violations, stmt, opcodeSets.get(stmt), "opcode");
            ok &= checkSingle(violations, stmt, blockSets.get(stmt), "block");
            if (ok) {
                opcodes.put(stmt, opcodeSets.get(stmt).iterator().next());
                stmtBlocks.put(stmt, blockSets.get(stmt).iterator().next());
            }
        }

        Set<Block> knownBlocks = knownBlocks(facts);
        Map<Block, Set<Func>> functionSets = group(facts.inFunction());
        Map<Block, Func> blockFunctions = new LinkedHashMap<>();
        for (Block block : knownBlocks) {
            if (checkSingle(violations, block, functionSets.get(block), "function")) {
                blockFunctions.put(block, functionSets.get(block).iterator().next());
            }
        }

        Map<Func, Set<Block>> entrySets = new LinkedHashMap<>();
        for (Block entry : facts.functionEntries()) {
            Func func = blockFunctions.get(entry);
            if (func != null) putMulti(entrySets, func, entry);
        }
        Map<Func, Block> entries = new LinkedHashMap<>();
        entrySets.forEach((func, blocks) -> {
            if (blocks.size() == 1) {
                entries.put(func, blocks.iterator().next());
            } else {
                violations.report(Violation.Kind.STRUCTURAL, func,
                        "function has more than one entry block", blocks);
            }
        });

        program.attachExt(ProgramExts.FACT_INDEX,
                new FactIndex(opcodes, stmtBlocks, blockFunctions, entries, knownBlocks));
        program.metadata().validate(MetadataState.VERIFIED);
    }

    private static boolean checkSingle(Violations violations, EntityId entity, Set<?> found, String what) {
        if (found == null || found.isEmpty()) {
            violations.report(Violation.Kind.STRUCTURAL, entity,
                    String.format("%s has no %s", entity.kind(), what), entity);
            return false;
        }
        if (found.size() > 1) {
            violations.report(Violation.Kind.STRUCTURAL, entity,
                    String.format("%s has more than one %s", entity.kind(), what), found);
            return false;
        }
        return true;
    }

    private static Set<Block> knownBlocks(FactStore facts) {
        Set<Block> blocks = new LinkedHashSet<>();
        for (Pair<Stmt, Block> sb : facts.statementBlocks()) blocks.add(sb.right);
        for (Pair<Block, Func> bf : facts.inFunction()) blocks.add(bf.left);
        for (Edge edge : facts.localEdges()) {
            blocks.add(edge.from);
            blocks.add(edge.to);
        }
        for (Edge edge : facts.fallthroughEdges()) {
            blocks.add(edge.from);
            blocks.add(edge.to);
        }
        for (Pair<Block, Func> call : facts.callGraphEdges()) blocks.add(call.left);
        for (CallReturn cr : facts.functionCallReturns()) {
            blocks.add(cr.caller);
            blocks.add(cr.continuation);
        }
        blocks.addAll(facts.functionEntries());
        return blocks;
    }
}
