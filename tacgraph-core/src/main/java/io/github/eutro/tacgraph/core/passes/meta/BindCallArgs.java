package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.graph.CallBindings;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.report.Violation;
import io.github.eutro.tacgraph.core.report.Violations;

import java.util.*;

/**
 * Computes {@link ProgramExts#CALL_BINDINGS}.
 * <p>
 * Operand 0 of {@code CALLPRIVATE} is the callee and operand 0 of {@code RETURNPRIVATE} the
 * return address, so operand {@code n >= 1} binds position {@code n - 1}.
 * Arguments are bound at the caller's block, returned values at the returning function.
 * <p>
 * The operands of a site must be exactly {@code 1..k}. Sites where they are not, and
 * lifter-supplied bindings whose positions are not exactly {@code 0..k-1}, are reported as
 * {@link Violation.Kind#BINDING} violations, and none of their bindings are kept.
 */
public class BindCallArgs implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final BindCallArgs INSTANCE = new BindCallArgs();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);
        FactStore facts = program.facts;
        Violations violations = program.violations;

        Map<Stmt, List<OperandSlot>> calls = new LinkedHashMap<>();
        Map<Stmt, List<OperandSlot>> returns = new LinkedHashMap<>();
        for (OperandSlot use : facts.statementUses()) {
            if (use.position < 1) continue;
            Opcode opcode = index.opcode(use.stmt);
            if (opcode == Opcode.CALLPRIVATE) {
                calls.computeIfAbsent(use.stmt, $ -> new ArrayList<>()).add(use);
            } else if (opcode == Opcode.RETURNPRIVATE) {
                returns.computeIfAbsent(use.stmt, $ -> new ArrayList<>()).add(use);
            }
        }

        List<Binding<Block>> actualArgs = new ArrayList<>();
        calls.forEach((stmt, operands) -> {
            Block block = index.block(stmt);
            if (block == null || !checkContiguous(violations, stmt, positionsOf(operands), 1, operands)) return;
            for (OperandSlot operand : operands) {
                actualArgs.add(Binding.of(block, operand.var, operand.position - 1));
            }
        });

        List<Binding<Func>> formalReturnArgs = new ArrayList<>();
        returns.forEach((stmt, operands) -> {
            Func func = index.function(stmt);
            if (func == null || !checkContiguous(violations, stmt, positionsOf(operands), 1, operands)) return;
            for (OperandSlot operand : operands) {
                formalReturnArgs.add(Binding.of(func, operand.var, operand.position - 1));
            }
        });

        program.attachExt(ProgramExts.CALL_BINDINGS, new CallBindings(
                actualArgs,
                formalReturnArgs,
                wellFormed(violations, facts.formalArgs()),
                wellFormed(violations, facts.actualReturnArgs())));
        ms.validate(MetadataState.CALL_BINDINGS);
    }

    private static <S extends EntityId> List<Binding<S>> wellFormed(Violations violations, List<Binding<S>> bindings) {
        Map<S, List<Binding<S>>> bySite = new LinkedHashMap<>();
        for (Binding<S> binding : bindings) {
            bySite.computeIfAbsent(binding.site, $ -> new ArrayList<>()).add(binding);
        }
        List<Binding<S>> kept = new ArrayList<>();
        bySite.forEach((site, siteBindings) -> {
            int[] positions = new int[siteBindings.size()];
            for (int i = 0; i < positions.length; i++) {
                positions[i] = siteBindings.get(i).position;
            }
            if (checkContiguous(violations, site, positions, 0, siteBindings)) {
                kept.addAll(siteBindings);
            }
        });
        return kept;
    }

    private static int[] positionsOf(List<OperandSlot> operands) {
        int[] positions = new int[operands.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = operands.get(i).position;
        }
        return positions;
    }

    private static boolean checkContiguous(Violations violations, EntityId site, int[] positions, int base, Object tuple) {
        int[] sorted = positions.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] != base + i) {
                violations.report(Violation.Kind.BINDING, site,
                        String.format("positions %s are not contiguous from %d", Arrays.toString(sorted), base),
                        tuple);
                return false;
            }
        }
        return true;
    }
}
