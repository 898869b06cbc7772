package io.github.eutro.tacgraph.core.graph;

import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Func;

import java.util.*;

/**
 * The blocks and functions with a special role in the program.
 */
public final class BlockClassification {
    private final Block globalEntryBlock;
    private final SortedSet<Block> functionExits;
    private final SortedSet<Block> validTerminals;
    private final SortedSet<Func> fallbackFunctions;

    public BlockClassification(Block globalEntryBlock,
                               Collection<Block> functionExits,
                               Collection<Block> validTerminals,
                               Collection<Func> fallbackFunctions) {
        this.globalEntryBlock = Objects.requireNonNull(globalEntryBlock);
        this.functionExits = Collections.unmodifiableSortedSet(new TreeSet<>(functionExits));
        this.validTerminals = Collections.unmodifiableSortedSet(new TreeSet<>(validTerminals));
        this.fallbackFunctions = Collections.unmodifiableSortedSet(new TreeSet<>(fallbackFunctions));
    }

    /**
     * The block the program starts in. A constant, not derived from the facts.
     *
     * @return The block.
     */
    public Block globalEntryBlock() {
        return globalEntryBlock;
    }

    /**
     * Whether the block is a sink of the <i>local</i> control-flow graph:
     * it has an incoming local edge and no outgoing one.
     *
     * @param block The block.
     * @return Whether it is a function exit.
     */
    public boolean isFunctionExit(Block block) {
        return functionExits.contains(block);
    }

    /**
     * Whether the block's last statement halts the program normally.
     *
     * @param block The block.
     * @return Whether it is a valid terminal.
     */
    public boolean isValidGlobalTerminal(Block block) {
        return validTerminals.contains(block);
    }

    public boolean isFallbackFunction(Func func) {
        return fallbackFunctions.contains(func);
    }

    /**
     * Get the fallback function, if there is one. If the facts name several,
     * which is reported as a violation, this is the least of them.
     *
     * @return The fallback function.
     */
    public Optional<Func> fallbackFunction() {
        return fallbackFunctions.isEmpty() ? Optional.empty() : Optional.of(fallbackFunctions.first());
    }

    public SortedSet<Block> functionExits() {
        return functionExits;
    }

    public SortedSet<Block> validTerminals() {
        return validTerminals;
    }

    public SortedSet<Func> fallbackFunctions() {
        return fallbackFunctions;
    }
}
