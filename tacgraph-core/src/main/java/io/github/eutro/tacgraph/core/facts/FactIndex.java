package io.github.eutro.tacgraph.core.facts;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Single-valued lookups over a {@link FactStore}, from which every entity
 * with inconsistent membership has been removed.
 * <p>
 * Statements, blocks and functions that are absent here are excluded from every derivation.
 */
public final class FactIndex {
    private final Map<Stmt, Opcode> opcodes;
    private final Map<Stmt, Block> stmtBlocks;
    private final Map<Block, Func> blockFunctions;
    private final Map<Func, Block> entries;
    private final Set<Block> knownBlocks;

    /**
     * Construct an index from already verified maps.
     *
     * @param opcodes        Statement to opcode, for statements with exactly one.
     * @param stmtBlocks     Statement to block, for statements with exactly one.
     * @param blockFunctions Block to function, for blocks with exactly one.
     * @param entries        Function to entry block, for functions with exactly one.
     * @param knownBlocks    Every block mentioned anywhere in the facts.
     */
    public FactIndex(Map<Stmt, Opcode> opcodes,
                     Map<Stmt, Block> stmtBlocks,
                     Map<Block, Func> blockFunctions,
                     Map<Func, Block> entries,
                     Set<Block> knownBlocks) {
        this.opcodes = Collections.unmodifiableMap(new LinkedHashMap<>(opcodes));
        this.stmtBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(stmtBlocks));
        this.blockFunctions = Collections.unmodifiableMap(new LinkedHashMap<>(blockFunctions));
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.knownBlocks = Collections.unmodifiableSet(new TreeSet<>(knownBlocks));
    }

    public @Nullable Opcode opcode(Stmt stmt) {
        return opcodes.get(stmt);
    }

    public @Nullable Block block(Stmt stmt) {
        return stmtBlocks.get(stmt);
    }

    public @Nullable Func function(Block block) {
        return blockFunctions.get(block);
    }

    /**
     * Get the function of the block of a statement.
     *
     * @param stmt The statement.
     * @return The function, or null if either membership is missing.
     */
    public @Nullable Func function(Stmt stmt) {
        Block block = block(stmt);
        return block == null ? null : function(block);
    }

    public @Nullable Block entry(Func func) {
        return entries.get(func);
    }

    /**
     * Whether the statement is a PHI, and so outside its block's linear order.
     *
     * @param stmt The statement.
     * @return Whether it is a PHI.
     */
    public boolean isPhi(Stmt stmt) {
        return opcode(stmt) == Opcode.PHI;
    }

    public Map<Stmt, Block> stmtBlocks() {
        return stmtBlocks;
    }

    public Map<Block, Func> blockFunctions() {
        return blockFunctions;
    }

    /**
     * Every block mentioned by any relation, excluded or not.
     *
     * @return The blocks, sorted.
     */
    public Set<Block> knownBlocks() {
        return knownBlocks;
    }
}
