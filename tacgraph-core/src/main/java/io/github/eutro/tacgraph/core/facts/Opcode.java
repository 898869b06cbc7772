package io.github.eutro.tacgraph.core.facts;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An instruction kind, identified by its mnemonic.
 * <p>
 * Opcodes are interned, so they can be compared by identity.
 * Besides the ordinary EVM mnemonics, the lifter emits the pseudo-opcodes
 * {@link #CALLPRIVATE}, {@link #RETURNPRIVATE} and {@link #PHI}.
 */
public final class Opcode {
    private static final Map<String, Opcode> INTERNED = new ConcurrentHashMap<>();

    /**
     * Call of a private function. Operand 0 is the callee, the rest are actual arguments.
     */
    public static final Opcode CALLPRIVATE = of("CALLPRIVATE");
    /**
     * Return from a private function. Operand 0 is the return address, the rest are returned values.
     */
    public static final Opcode RETURNPRIVATE = of("RETURNPRIVATE");
    /**
     * SSA merge, not part of any block's linear order.
     */
    public static final Opcode PHI = of("PHI");
    public static final Opcode STOP = of("STOP");
    public static final Opcode RETURN = of("RETURN");
    public static final Opcode REVERT = of("REVERT");
    public static final Opcode INVALID = of("INVALID");

    /**
     * The mnemonic of this opcode.
     */
    public final String mnemonic;

    private Opcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Get the opcode with the given mnemonic.
     *
     * @param mnemonic The mnemonic.
     * @return The interned opcode.
     */
    public static Opcode of(String mnemonic) {
        return INTERNED.computeIfAbsent(mnemonic, Opcode::new);
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
