package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.facts.Func;
import io.github.eutro.tacgraph.core.facts.Stmt;
import io.github.eutro.tacgraph.core.facts.Var;
import io.github.eutro.tacgraph.core.graph.VarOwnership;
import io.github.eutro.tacgraph.core.passes.meta.ComputeVarOwners;
import io.github.eutro.tacgraph.core.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class VarOwnersTest {
    private static VarOwnership owners(Program program) {
        ComputeVarOwners.INSTANCE.run(program);
        return program.getExtOrThrow(ProgramExts.VAR_OWNERSHIP);
    }

    @Test
    void testOwnersFromUses() {
        Program program = new Program(Fixtures.callTwice().build());
        VarOwnership owners = owners(program);

        assertEquals(Optional.of(Func.of("0x0")), owners.owner(Var.of("va")));
        assertEquals(Optional.of(Func.of("0xf0")), owners.owner(Var.of("vRet")));
        assertEquals(Optional.of(Func.of("0xf0")), owners.owner(Var.of("vp")));
        assertEquals(Func.of("0xf0"), owners.statementFunctions().get(Stmt.of("0xf2a")));
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testUnusedFormalArgument() {
        VarOwnership owners = owners(new Program(Fixtures.callTwice().build()));
        assertTrue(owners.isVariable(Var.of("vq")));
        assertTrue(owners.variables().contains(Var.of("vp")));
        assertFalse(owners.isVariable(Var.of("vx")));
        assertEquals(Optional.of(Func.of("0xf0")), owners.owner(Var.of("vq")));
    }

    @Test
    void testDefinitionWins() {
        FactStore facts = Fixtures.callTwice()
                .statementDefines("0x10a", "vz", 0)
                .statementUses("0x20a", "vz", 3)
                .formalArg("0xf0", "vz", 2)
                .build();
        VarOwnership owners = owners(new Program(facts));
        assertEquals(Optional.of(Func.of("0x0")), owners.owner(Var.of("vz")));
    }

    @Test
    void testVariableInTwoFunctions() {
        FactStore facts = Fixtures.callTwice()
                .statementDefines("0x10a", "vShared", 0)
                .statementUses("0xf0a", "vShared", 1)
                .build();
        Program program = new Program(facts);
        VarOwnership owners = owners(program);

        assertTrue(owners.isVariable(Var.of("vShared")));
        assertFalse(owners.owner(Var.of("vShared")).isPresent());
        assertEquals(1, program.violations.count(Violation.Kind.STRUCTURAL));
        assertEquals("var is in more than one function", program.violations.toList().get(0).message);
    }

    @Test
    void testVariableOfUnknownStatement() {
        Program program = new Program(Fixtures.straightLine("STOP")
                .statementUses("ghost", "vGhost", 0)
                .build());
        VarOwnership owners = owners(program);

        assertFalse(owners.owner(Var.of("vGhost")).isPresent());
        assertTrue(program.violations.toList().stream()
                .anyMatch(v -> v.entity.equals(Var.of("vGhost")) && v.message.equals("var has no function")));
    }
}
