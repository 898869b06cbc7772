package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.conf.AnalysisConfig;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.*;
import io.github.eutro.tacgraph.core.passes.meta.VerifyFacts;
import io.github.eutro.tacgraph.core.report.AnalysisAbortedException;
import io.github.eutro.tacgraph.core.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VerifyFactsTest {
    private static FactIndex verify(Program program) {
        VerifyFacts.INSTANCE.run(program);
        return program.getExtOrThrow(ProgramExts.FACT_INDEX);
    }

    @Test
    void testCleanFacts() {
        Program program = new Program(Fixtures.callTwice().build());
        FactIndex index = verify(program);

        assertFalse(program.violations.isDegraded());
        assertEquals(Opcode.CALLPRIVATE, index.opcode(Stmt.of("0x0a")));
        assertEquals(Block.of("0xf1"), index.block(Stmt.of("0xf1a")));
        assertEquals(Func.of("0xf0"), index.function(Stmt.of("0xf1a")));
        assertEquals(Block.of("0xf0"), index.entry(Func.of("0xf0")));
        assertEquals(7, index.knownBlocks().size());
    }

    @Test
    void testNoFunctionsAborts() {
        FactStore facts = FactStore.builder()
                .statement("s", "STOP", "0x0")
                .build();
        AnalysisAbortedException e = assertThrows(AnalysisAbortedException.class,
                () -> verify(new Program(facts)));
        assertEquals("no function membership facts", e.getMessage());
    }

    @Test
    void testTooManyStatementsAborts() {
        AnalysisConfig config = AnalysisConfig.createBuilder().setMaxStatements(2).build();
        FactStore facts = Fixtures.straightLine("PUSH1", "PUSH1", "ADD").build();
        assertThrows(AnalysisAbortedException.class, () -> verify(new Program(facts, config)));

        Program program = new Program(Fixtures.straightLine("PUSH1", "STOP").build(), config);
        verify(program);
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testNegativeLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.createBuilder().setMaxStatements(-1));
    }

    @Test
    void testStatementInTwoBlocks() {
        Program program = new Program(Fixtures.straightLine("STOP")
                .statementBlock("s0", "0x1")
                .inFunction("0x1", "0x0")
                .build());
        FactIndex index = verify(program);

        assertNull(index.block(Stmt.of("s0")));
        List<Violation> violations = program.violations.toList();
        assertEquals(1, violations.size());
        assertEquals(Violation.Kind.STRUCTURAL, violations.get(0).kind);
        assertEquals("stmt has more than one block", violations.get(0).message);
    }

    @Test
    void testStatementWithoutOpcode() {
        Program program = new Program(Fixtures.straightLine("STOP")
                .statementBlock("s1", "0x0")
                .build());
        verify(program);
        assertEquals("stmt has no opcode", program.violations.toList().get(0).message);
    }

    @Test
    void testBlockWithoutFunction() {
        Program program = new Program(Fixtures.straightLine("JUMP")
                .statement("t", "STOP", "0x9")
                .localEdge("0x0", "0x9")
                .build());
        FactIndex index = verify(program);

        assertNull(index.function(Block.of("0x9")));
        assertEquals(Block.of("0x9"), program.violations.toList().get(0).entity);
        assertEquals("block has no function", program.violations.toList().get(0).message);
    }

    @Test
    void testBlockInTwoFunctions() {
        Program program = new Program(Fixtures.straightLine("STOP")
                .inFunction("0x0", "0x1")
                .build());
        FactIndex index = verify(program);

        assertNull(index.function(Block.of("0x0")));
        assertEquals(1, program.violations.count(Violation.Kind.STRUCTURAL));
    }

    @Test
    void testFunctionWithTwoEntries() {
        Program program = new Program(Fixtures.callTwice()
                .functionEntry("0xf2")
                .build());
        FactIndex index = verify(program);

        assertNull(index.entry(Func.of("0xf0")));
        assertEquals(Block.of("0x0"), index.entry(Func.of("0x0")));
        Violation violation = program.violations.toList().get(0);
        assertEquals(Func.of("0xf0"), violation.entity);
        assertEquals("function has more than one entry block", violation.message);
    }
}
