package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.conf.AnalysisConfig;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.facts.Func;
import io.github.eutro.tacgraph.core.facts.Opcode;
import io.github.eutro.tacgraph.core.graph.BlockClassification;
import io.github.eutro.tacgraph.core.passes.meta.ClassifyBlocks;
import io.github.eutro.tacgraph.core.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class ClassifyBlocksTest {
    private static BlockClassification classify(Program program) {
        ClassifyBlocks.INSTANCE.run(program);
        return program.getExtOrThrow(ProgramExts.CLASSIFICATION);
    }

    /**
     * {@code A -> B -> C (STOP)} and {@code A -> D (REVERT)}, all in one function.
     */
    private static FactStore.Builder diamondless() {
        return FactStore.builder()
                .statement("a", "JUMPI", "A")
                .statement("b", "JUMP", "B")
                .statement("c", "STOP", "C")
                .statement("d", "REVERT", "D")
                .inFunction("A", "F")
                .inFunction("B", "F")
                .inFunction("C", "F")
                .inFunction("D", "F")
                .functionEntry("A")
                .localEdge("A", "B")
                .localEdge("B", "C")
                .localEdge("A", "D");
    }

    @Test
    void testExitsAndTerminals() {
        Program program = new Program(diamondless().build());
        BlockClassification classes = classify(program);

        assertEquals(new TreeSet<>(Arrays.asList(Block.of("C"), Block.of("D"))), classes.functionExits());
        assertTrue(classes.isValidGlobalTerminal(Block.of("C")));
        assertFalse(classes.isValidGlobalTerminal(Block.of("D")));
        assertFalse(classes.isFunctionExit(Block.of("A")));
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testConfiguredTerminals() {
        AnalysisConfig config = AnalysisConfig.createBuilder()
                .setValidTerminalOpcodes(Opcode.STOP, Opcode.REVERT)
                .build();
        BlockClassification classes = classify(new Program(diamondless().build(), config));

        assertEquals(classes.functionExits(), classes.validTerminals());
    }

    @Test
    void testExitsAreLocal() {
        Program program = new Program(Fixtures.callTwice().build());
        BlockClassification classes = classify(program);

        assertEquals(new TreeSet<>(Arrays.asList(Block.of("0x30"), Block.of("0xf1"), Block.of("0xf2"))),
                classes.functionExits());
        assertEquals(Collections.singleton(Block.of("0x30")), classes.validTerminals());
    }

    @Test
    void testGlobalEntryBlock() {
        assertEquals(Block.of("0x0"), classify(new Program(diamondless().build())).globalEntryBlock());

        AnalysisConfig config = AnalysisConfig.createBuilder().setGlobalEntryBlock("A").build();
        assertEquals(Block.of("A"), classify(new Program(diamondless().build(), config)).globalEntryBlock());
    }

    @Test
    void testFallbackFunction() {
        Program program = new Program(diamondless()
                .publicFunction("F", "0x00000000")
                .publicFunction("G", "0xa9059cbb")
                .build());
        BlockClassification classes = classify(program);

        assertEquals(Optional.of(Func.of("F")), classes.fallbackFunction());
        assertTrue(classes.isFallbackFunction(Func.of("F")));
        assertFalse(classes.isFallbackFunction(Func.of("G")));
    }

    @Test
    void testNoFallbackFunction() {
        BlockClassification classes = classify(new Program(diamondless()
                .publicFunction("G", "0xa9059cbb")
                .build()));
        assertFalse(classes.fallbackFunction().isPresent());
    }

    @Test
    void testTwoFallbacksAreReported() {
        Program program = new Program(diamondless()
                .publicFunction("F", "0x00000000")
                .publicFunction("G", "0X00000000")
                .build());
        BlockClassification classes = classify(program);

        assertEquals(2, classes.fallbackFunctions().size());
        assertEquals(2, program.violations.count(Violation.Kind.CLASSIFICATION));
    }

    @Test
    void testSinkWithoutStatementsIsReported() {
        Program program = new Program(diamondless()
                .inFunction("E", "F")
                .localEdge("C", "E")
                .localEdge("D", "E")
                .build());
        BlockClassification classes = classify(program);

        assertEquals(Collections.singleton(Block.of("E")), classes.functionExits());
        List<Violation> violations = program.violations.toList();
        assertEquals(1, violations.size());
        assertEquals(Block.of("E"), violations.get(0).entity);
        assertEquals(Violation.Kind.CLASSIFICATION, violations.get(0).kind);
    }
}
