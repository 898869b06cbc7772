package io.github.eutro.tacgraph.core.passes.meta;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.graph.VarOwnership;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.report.Violation;

import java.util.*;

import static io.github.eutro.tacgraph.core.util.Relations.putMulti;

/**
 * Computes {@link ProgramExts#VAR_OWNERSHIP}.
 * <p>
 * A variable belongs to the function of every statement that uses or defines it.
 * A formal parameter that no statement defines also belongs to the function it is a parameter of.
 * A variable that ends up with no function or with several is reported and left unowned.
 */
public class ComputeVarOwners implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeVarOwners INSTANCE = new ComputeVarOwners();

    @Override
    public void runInPlace(Program program) {
        MetadataState ms = program.metadata();
        ms.ensureValid(program, MetadataState.VERIFIED);
        FactIndex index = program.getExtOrThrow(ProgramExts.FACT_INDEX);
        FactStore facts = program.facts;

        Map<Stmt, Func> statementFunctions = new LinkedHashMap<>();
        index.stmtBlocks().forEach((stmt, block) -> {
            Func func = index.function(block);
            if (func != null) statementFunctions.put(stmt, func);
        });

        Set<Var> variables = new LinkedHashSet<>();
        Set<Var> defined = new HashSet<>();
        Map<Var, Set<Func>> candidates = new LinkedHashMap<>();
        for (OperandSlot use : facts.statementUses()) {
            addOccurrence(variables, candidates, statementFunctions, use);
        }
        for (OperandSlot def : facts.statementDefines()) {
            addOccurrence(variables, candidates, statementFunctions, def);
            defined.add(def.var);
        }
        for (Binding<Func> formal : facts.formalArgs()) {
            variables.add(formal.var);
            if (!defined.contains(formal.var)) {
                putMulti(candidates, formal.var, formal.site);
            }
        }

        Map<Var, Func> owners = new HashMap<>();
        for (Var var : variables) {
            Set<Func> funcs = candidates.get(var);
            if (funcs == null) {
                program.violations.report(Violation.Kind.STRUCTURAL, var,
                        "var has no function", var);
            } else if (funcs.size() > 1) {
                program.violations.report(Violation.Kind.STRUCTURAL, var,
                        "var is in more than one function", funcs);
            } else {
                owners.put(var, funcs.iterator().next());
            }
        }

        program.attachExt(ProgramExts.VAR_OWNERSHIP, new VarOwnership(variables, owners, statementFunctions));
        ms.validate(MetadataState.VAR_OWNERS);
    }

    private static void addOccurrence(Set<Var> variables,
                                      Map<Var, Set<Func>> candidates,
                                      Map<Stmt, Func> statementFunctions,
                                      OperandSlot slot) {
        variables.add(slot.var);
        Func func = statementFunctions.get(slot.stmt);
        if (func != null) putMulti(candidates, slot.var, func);
    }
}
