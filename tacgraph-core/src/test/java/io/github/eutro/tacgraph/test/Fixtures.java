package io.github.eutro.tacgraph.test;

import io.github.eutro.tacgraph.core.facts.FactStore;

public class Fixtures {
    /**
     * Two functions: {@code 0x0} calls {@code 0xf0} from two sites, {@code 0xf0} returns from two blocks.
     * <pre>
     *   0x0 --call--> 0xf0 -> 0xf1 (RETURNPRIVATE)
     *    :                 -> 0xf2 (RETURNPRIVATE)
     *   0x10
     *    |
     *   0x20 --call--> 0xf0
     *    :
     *   0x30 (STOP)
     * </pre>
     */
    public static FactStore.Builder callTwice() {
        return FactStore.builder()
                .statement("0x0a", "CALLPRIVATE", "0x0")
                .statementUses("0x0a", "vCallee", 0)
                .statementUses("0x0a", "va", 1)
                .statementUses("0x0a", "vb", 2)
                .statement("0x10a", "JUMP", "0x10")
                .statement("0x20a", "CALLPRIVATE", "0x20")
                .statementUses("0x20a", "vCallee2", 0)
                .statementUses("0x20a", "vc", 1)
                .statementUses("0x20a", "vd", 2)
                .statement("0x30a", "STOP", "0x30")
                .statement("0xf0a", "JUMPI", "0xf0")
                .statementUses("0xf0a", "vp", 0)
                .statement("0xf1a", "RETURNPRIVATE", "0xf1")
                .statementUses("0xf1a", "vRet", 0)
                .statementUses("0xf1a", "vr", 1)
                .statement("0xf2a", "RETURNPRIVATE", "0xf2")
                .statementUses("0xf2a", "vRet", 0)
                .statementUses("0xf2a", "vr2", 1)
                .statementNext("0x0a", "0x10a")
                .statementNext("0x10a", "0x20a")
                .statementNext("0x20a", "0x30a")
                .statementNext("0x30a", "0xf0a")
                .statementNext("0xf0a", "0xf1a")
                .statementNext("0xf1a", "0xf2a")
                .localEdge("0x0", "0x10")
                .localEdge("0x10", "0x20")
                .localEdge("0x20", "0x30")
                .localEdge("0xf0", "0xf1")
                .localEdge("0xf0", "0xf2")
                .callGraphEdge("0x0", "0xf0")
                .callGraphEdge("0x20", "0xf0")
                .functionCallReturn("0x0", "0xf0", "0x10")
                .functionCallReturn("0x20", "0xf0", "0x30")
                .inFunction("0x0", "0x0")
                .inFunction("0x10", "0x0")
                .inFunction("0x20", "0x0")
                .inFunction("0x30", "0x0")
                .inFunction("0xf0", "0xf0")
                .inFunction("0xf1", "0xf0")
                .inFunction("0xf2", "0xf0")
                .functionEntry("0x0")
                .functionEntry("0xf0")
                .formalArg("0xf0", "vp", 0)
                .formalArg("0xf0", "vq", 1)
                .actualReturnArg("0x0", "vx", 0)
                .actualReturnArg("0x20", "vy", 0)
                .publicFunction("0x0", "0x00000000");
    }

    /**
     * One function with a single block, {@code 0x0}, of the given statements in order.
     */
    public static FactStore.Builder straightLine(String... opcodes) {
        FactStore.Builder b = FactStore.builder()
                .inFunction("0x0", "0x0")
                .functionEntry("0x0");
        for (int i = 0; i < opcodes.length; i++) {
            b.statement("s" + i, opcodes[i], "0x0");
            if (i > 0) b.statementNext("s" + (i - 1), "s" + i);
        }
        return b;
    }
}
