package io.github.eutro.tacgraph.core.conf;

import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Opcode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of an analysis run. Immutable; create one with {@link #createBuilder()}.
 * <p>
 * The defaults can be overridden by the system properties
 * {@value #PROP_GLOBAL_ENTRY_BLOCK}, {@value #PROP_FALLBACK_SELECTOR} and {@value #PROP_MAX_STATEMENTS}.
 */
public final class AnalysisConfig {
    public static final String PROP_GLOBAL_ENTRY_BLOCK = "tacgraph.globalEntryBlock";
    public static final String PROP_FALLBACK_SELECTOR = "tacgraph.fallbackSelector";
    public static final String PROP_MAX_STATEMENTS = "tacgraph.maxStatements";

    /**
     * The configuration with every setting at its default.
     */
    public static final AnalysisConfig DEFAULT = createBuilder().build();

    private final Block globalEntryBlock;
    private final String fallbackSelector;
    private final Set<Opcode> validTerminalOpcodes;
    private final int maxStatements;

    private AnalysisConfig(Builder builder) {
        globalEntryBlock = builder.globalEntryBlock;
        fallbackSelector = builder.fallbackSelector;
        validTerminalOpcodes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.validTerminalOpcodes));
        maxStatements = builder.maxStatements;
    }

    /**
     * Create a builder, with defaults taken from the system properties where set.
     *
     * @return The builder.
     */
    public static Builder createBuilder() {
        return new Builder();
    }

    /**
     * The block execution of the program starts in.
     *
     * @return The entry block.
     */
    public Block getGlobalEntryBlock() {
        return globalEntryBlock;
    }

    /**
     * The selector identifying the fallback function, as {@code 0x}-prefixed hex.
     *
     * @return The selector.
     */
    public String getFallbackSelector() {
        return fallbackSelector;
    }

    /**
     * The opcodes that end a program normally.
     *
     * @return The opcodes.
     */
    public Set<Opcode> getValidTerminalOpcodes() {
        return validTerminalOpcodes;
    }

    /**
     * The largest number of statements a contract may have, or 0 for no limit.
     *
     * @return The limit.
     */
    public int getMaxStatements() {
        return maxStatements;
    }

    /**
     * A builder for {@link AnalysisConfig}.
     */
    public static final class Builder {
        private Block globalEntryBlock = Block.of(System.getProperty(PROP_GLOBAL_ENTRY_BLOCK, "0x0"));
        private String fallbackSelector = System.getProperty(PROP_FALLBACK_SELECTOR, "0x00000000");
        private final Set<Opcode> validTerminalOpcodes = new LinkedHashSet<>();
        private int maxStatements = Integer.getInteger(PROP_MAX_STATEMENTS, 0);

        private Builder() {
            validTerminalOpcodes.add(Opcode.STOP);
            validTerminalOpcodes.add(Opcode.RETURN);
        }

        /**
         * Set the block the program starts in. By default, {@code 0x0}.
         *
         * @param block The block key.
         * @return This builder, for convenience.
         */
        public Builder setGlobalEntryBlock(String block) {
            globalEntryBlock = Block.of(block);
            return this;
        }

        /**
         * Set the selector of the fallback function. By default, {@code 0x00000000}.
         *
         * @param selector The selector.
         * @return This builder, for convenience.
         */
        public Builder setFallbackSelector(String selector) {
            fallbackSelector = Objects.requireNonNull(selector);
            return this;
        }

        /**
         * Replace the opcodes that end a program normally. By default, {@code STOP} and {@code RETURN}.
         *
         * @param opcodes The opcodes.
         * @return This builder, for convenience.
         */
        public Builder setValidTerminalOpcodes(Opcode... opcodes) {
            validTerminalOpcodes.clear();
            Collections.addAll(validTerminalOpcodes, opcodes);
            return this;
        }

        /**
         * Set the largest number of statements to analyse, or 0 for no limit. By default, no limit.
         *
         * @param maxStatements The limit.
         * @return This builder, for convenience.
         */
        public Builder setMaxStatements(int maxStatements) {
            if (maxStatements < 0) {
                throw new IllegalArgumentException("maxStatements must not be negative: " + maxStatements);
            }
            this.maxStatements = maxStatements;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(this);
        }
    }
}
