package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.facts.Stmt;
import io.github.eutro.tacgraph.core.graph.BlockBounds;
import io.github.eutro.tacgraph.core.passes.meta.ComputeBlockBounds;
import io.github.eutro.tacgraph.core.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class BlockBoundsTest {
    private static BlockBounds bounds(Program program) {
        ComputeBlockBounds.INSTANCE.run(program);
        return program.getExtOrThrow(ProgramExts.BLOCK_BOUNDS);
    }

    @Test
    void testChainWithPhi() {
        FactStore facts = FactStore.builder()
                .inFunction("B", "F")
                .inFunction("C", "F")
                .functionEntry("B")
                .statement("p", "PHI", "B")
                .statement("s1", "PUSH1", "B")
                .statement("s2", "ADD", "B")
                .statement("s3", "JUMP", "B")
                .statement("t1", "JUMPDEST", "C")
                .statement("t2", "STOP", "C")
                .statementNext("s1", "s2")
                .statementNext("s2", "s3")
                .statementNext("s3", "t1")
                .statementNext("t1", "t2")
                .localEdge("B", "C")
                .build();
        Program program = new Program(facts);
        BlockBounds bounds = bounds(program);

        assertEquals(Optional.of(Stmt.of("s1")), bounds.head(Block.of("B")));
        assertEquals(Optional.of(Stmt.of("s3")), bounds.tail(Block.of("B")));
        assertEquals(Optional.of(Stmt.of("t1")), bounds.head(Block.of("C")));
        assertEquals(Optional.of(Stmt.of("t2")), bounds.tail(Block.of("C")));
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testSingleStatement() {
        BlockBounds bounds = bounds(new Program(Fixtures.straightLine("STOP").build()));
        assertEquals(Optional.of(Stmt.of("s0")), bounds.head(Block.of("0x0")));
        assertEquals(Optional.of(Stmt.of("s0")), bounds.tail(Block.of("0x0")));
    }

    @Test
    void testPhiOnlyAndEmptyBlocks() {
        FactStore facts = FactStore.builder()
                .inFunction("P", "F")
                .inFunction("E", "F")
                .functionEntry("P")
                .statement("p1", "PHI", "P")
                .statement("p2", "PHI", "P")
                .localEdge("P", "E")
                .build();
        Program program = new Program(facts);
        BlockBounds bounds = bounds(program);

        assertFalse(bounds.head(Block.of("P")).isPresent());
        assertFalse(bounds.tail(Block.of("P")).isPresent());
        assertFalse(bounds.head(Block.of("E")).isPresent());
        assertFalse(bounds.tail(Block.of("E")).isPresent());
        assertTrue(bounds.heads().isEmpty());
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testBrokenChainIsReported() {
        FactStore facts = Fixtures.straightLine("PUSH1", "PUSH1", "ADD", "STOP")
                .statementNext("s3", "s1")
                .build();
        Program program = new Program(facts);
        BlockBounds bounds = bounds(program);

        assertFalse(bounds.head(Block.of("0x0")).isPresent());
        assertFalse(bounds.tail(Block.of("0x0")).isPresent());
        assertEquals(1, program.violations.count(Violation.Kind.STRUCTURAL));
        assertEquals(Block.of("0x0"), program.violations.toList().get(0).entity);
    }

    @Test
    void testTwoChainsInOneBlock() {
        FactStore facts = Fixtures.straightLine("PUSH1", "STOP")
                .statement("x", "INVALID", "0x0")
                .build();
        Program program = new Program(facts);
        BlockBounds bounds = bounds(program);

        assertTrue(bounds.tails().isEmpty());
        assertEquals("statements of block do not form a single chain",
                program.violations.toList().get(0).message);
    }

    @Test
    void testComputesVerificationFirst() {
        Program program = new Program(Fixtures.straightLine("STOP").build());
        assertFalse(program.metadata().isValid(MetadataState.VERIFIED));
        bounds(program);
        assertTrue(program.metadata().isValid(MetadataState.VERIFIED));
        assertTrue(program.metadata().isValid(MetadataState.BLOCK_BOUNDS));
        assertEquals("MetadataState[VERIFIED, BLOCK_BOUNDS]", program.metadata().toString());
    }
}
