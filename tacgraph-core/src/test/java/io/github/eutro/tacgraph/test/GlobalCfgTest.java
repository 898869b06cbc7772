package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.Program;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Edge;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.graph.GlobalCfg;
import io.github.eutro.tacgraph.core.passes.meta.ComputeGlobalCfg;
import io.github.eutro.tacgraph.core.passes.meta.ComputeReachability;
import io.github.eutro.tacgraph.core.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalCfgTest {
    private static Block b(String key) {
        return Block.of(key);
    }

    private static GlobalCfg cfg(Program program) {
        ComputeGlobalCfg.INSTANCE.run(program);
        return program.getExtOrThrow(ProgramExts.GLOBAL_CFG);
    }

    @Test
    void testCallsAndReturns() {
        Program program = new Program(Fixtures.callTwice().build());
        GlobalCfg cfg = cfg(program);

        Set<Edge> expected = new TreeSet<>(Arrays.asList(
                Edge.of(b("0x10"), b("0x20")),
                Edge.of(b("0xf0"), b("0xf1")),
                Edge.of(b("0xf0"), b("0xf2")),
                Edge.of(b("0x0"), b("0xf0")),
                Edge.of(b("0x20"), b("0xf0")),
                Edge.of(b("0xf1"), b("0x10")),
                Edge.of(b("0xf1"), b("0x30")),
                Edge.of(b("0xf2"), b("0x10")),
                Edge.of(b("0xf2"), b("0x30"))
        ));
        assertEquals(expected, cfg.edges());
        assertFalse(program.violations.isDegraded());
    }

    @Test
    void testPlaceholderEdgesRemoved() {
        GlobalCfg cfg = cfg(new Program(Fixtures.callTwice().build()));
        assertFalse(cfg.hasEdge(b("0x0"), b("0x10")));
        assertFalse(cfg.hasEdge(b("0x20"), b("0x30")));
    }

    @Test
    void testEveryReturnToEveryContinuation() {
        GlobalCfg cfg = cfg(new Program(Fixtures.callTwice().build()));
        for (String ret : Arrays.asList("0xf1", "0xf2")) {
            for (String cont : Arrays.asList("0x10", "0x30")) {
                assertTrue(cfg.hasEdge(b(ret), b(cont)), ret + " -> " + cont);
            }
        }
        assertEquals(Arrays.asList(b("0x0"), b("0x20")), cfg.predecessors(b("0xf0")));
    }

    @Test
    void testEndpointsAreKnownBlocks() {
        Program program = new Program(Fixtures.callTwice().build());
        GlobalCfg cfg = cfg(program);
        Set<Block> known = program.getExtOrThrow(ProgramExts.FACT_INDEX).knownBlocks();
        for (Edge edge : cfg.edges()) {
            assertTrue(known.contains(edge.from), edge.toString());
            assertTrue(known.contains(edge.to), edge.toString());
        }
    }

    @Test
    void testCallWithoutReturn() {
        FactStore facts = FactStore.builder()
                .statement("a", "CALLPRIVATE", "A")
                .statement("c", "STOP", "C")
                .statement("f", "REVERT", "F")
                .inFunction("A", "main")
                .inFunction("C", "main")
                .inFunction("F", "F")
                .functionEntry("A")
                .functionEntry("F")
                .localEdge("A", "C")
                .callGraphEdge("A", "F")
                .functionCallReturn("A", "F", "C")
                .build();
        GlobalCfg cfg = cfg(new Program(facts));

        assertEquals(Collections.singleton(Edge.of(b("A"), b("F"))), cfg.edges());
    }

    @Test
    void testFunctionWithTwoEntriesGetsNoCallEdge() {
        FactStore facts = Fixtures.callTwice()
                .functionEntry("0xf1")
                .build();
        Program program = new Program(facts);
        GlobalCfg cfg = cfg(program);

        assertTrue(cfg.successors(b("0x0")).isEmpty());
        assertEquals(1, program.violations.count(Violation.Kind.STRUCTURAL));
    }

    @Test
    void testReachability() {
        Program program = new Program(Fixtures.callTwice().build());
        ComputeReachability.INSTANCE.run(program);
        Set<Block> reachable = program.getExtOrThrow(ProgramExts.REACHABLE_BLOCKS);

        assertEquals(new TreeSet<>(Arrays.asList(
                b("0x0"), b("0x10"), b("0x20"), b("0x30"),
                b("0xf0"), b("0xf1"), b("0xf2"))), reachable);
    }

    @Test
    void testUnreachableFromUnknownEntry() {
        Program program = new Program(Fixtures.straightLine("STOP")
                .inFunction("0x40", "0x40")
                .build());
        ComputeReachability.INSTANCE.run(program);
        assertEquals(Collections.singleton(b("0x0")), program.getExtOrThrow(ProgramExts.REACHABLE_BLOCKS));

        Program dead = new Program(FactStore.builder()
                .statement("x", "STOP", "0x40")
                .inFunction("0x40", "0x40")
                .build());
        ComputeReachability.INSTANCE.run(dead);
        assertTrue(dead.getExtOrThrow(ProgramExts.REACHABLE_BLOCKS).isEmpty());
    }
}
