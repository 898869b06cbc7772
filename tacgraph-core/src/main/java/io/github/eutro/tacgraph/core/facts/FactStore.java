package io.github.eutro.tacgraph.core.facts;

import io.github.eutro.tacgraph.core.util.Pair;

import java.util.*;

/**
 * The immutable input relations produced by the lifter for one contract.
 * <p>
 * Each relation is a set of tuples, exposed as an unmodifiable list in insertion order
 * so that every derivation over the same store visits tuples in the same order.
 * Relations are not checked for consistency here; that is done by
 * {@link io.github.eutro.tacgraph.core.passes.meta.VerifyFacts}.
 */
public final class FactStore {
    private final List<Pair<Stmt, Opcode>> statementOpcodes;
    private final List<Pair<Stmt, Block>> statementBlocks;
    private final List<Pair<Stmt, Stmt>> statementNext;
    private final List<OperandSlot> statementUses;
    private final List<OperandSlot> statementDefines;
    private final List<Edge> localEdges;
    private final List<Edge> fallthroughEdges;
    private final List<Pair<Block, Func>> callGraphEdges;
    private final List<CallReturn> functionCallReturns;
    private final List<Pair<Block, Func>> inFunction;
    private final List<Block> functionEntries;
    private final List<Pair<Func, String>> publicFunctions;
    private final List<Pair<Func, String>> functionNames;
    private final List<Binding<Func>> formalArgs;
    private final List<Binding<Block>> actualReturnArgs;
    private final List<Pair<Var, String>> variableValues;
    private final List<Pair<Block, Long>> gasPerBlock;
    private final List<Pair<Stmt, Long>> codeChunksAccessed;

    private FactStore(Builder b) {
        statementOpcodes = freeze(b.statementOpcodes);
        statementBlocks = freeze(b.statementBlocks);
        statementNext = freeze(b.statementNext);
        statementUses = freeze(b.statementUses);
        statementDefines = freeze(b.statementDefines);
        localEdges = freeze(b.localEdges);
        fallthroughEdges = freeze(b.fallthroughEdges);
        callGraphEdges = freeze(b.callGraphEdges);
        functionCallReturns = freeze(b.functionCallReturns);
        inFunction = freeze(b.inFunction);
        functionEntries = freeze(b.functionEntries);
        publicFunctions = freeze(b.publicFunctions);
        functionNames = freeze(b.functionNames);
        formalArgs = freeze(b.formalArgs);
        actualReturnArgs = freeze(b.actualReturnArgs);
        variableValues = freeze(b.variableValues);
        gasPerBlock = freeze(b.gasPerBlock);
        codeChunksAccessed = freeze(b.codeChunksAccessed);
    }

    private static <T> List<T> freeze(Set<T> set) {
        return Collections.unmodifiableList(new ArrayList<>(set));
    }

    /**
     * Create a builder for a fact store.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * {@code Statement_Opcode(stmt, opcode)}.
     *
     * @return The relation.
     */
    public List<Pair<Stmt, Opcode>> statementOpcodes() {
        return statementOpcodes;
    }

    /**
     * {@code Statement_Block(stmt, block)}.
     *
     * @return The relation.
     */
    public List<Pair<Stmt, Block>> statementBlocks() {
        return statementBlocks;
    }

    /**
     * {@code Statement_Next(stmt, next)}, the global order over non-PHI statements.
     *
     * @return The relation.
     */
    public List<Pair<Stmt, Stmt>> statementNext() {
        return statementNext;
    }

    public List<OperandSlot> statementUses() {
        return statementUses;
    }

    public List<OperandSlot> statementDefines() {
        return statementDefines;
    }

    public List<Edge> localEdges() {
        return localEdges;
    }

    /**
     * The local edges that are fallthroughs. Informational, no derivation reads it.
     *
     * @return The relation.
     */
    public List<Edge> fallthroughEdges() {
        return fallthroughEdges;
    }

    /**
     * {@code CallGraphEdge(callerBlock, function)}.
     *
     * @return The relation.
     */
    public List<Pair<Block, Func>> callGraphEdges() {
        return callGraphEdges;
    }

    public List<CallReturn> functionCallReturns() {
        return functionCallReturns;
    }

    /**
     * {@code InFunction(block, function)}.
     *
     * @return The relation.
     */
    public List<Pair<Block, Func>> inFunction() {
        return inFunction;
    }

    /**
     * The blocks that are the entry of the function they are {@link #inFunction() in}.
     *
     * @return The relation.
     */
    public List<Block> functionEntries() {
        return functionEntries;
    }

    /**
     * {@code PublicFunction(function, selector)}, selectors as {@code 0x}-prefixed hex.
     *
     * @return The relation.
     */
    public List<Pair<Func, String>> publicFunctions() {
        return publicFunctions;
    }

    public List<Pair<Func, String>> functionNames() {
        return functionNames;
    }

    public List<Binding<Func>> formalArgs() {
        return formalArgs;
    }

    public List<Binding<Block>> actualReturnArgs() {
        return actualReturnArgs;
    }

    public List<Pair<Var, String>> variableValues() {
        return variableValues;
    }

    public List<Pair<Block, Long>> gasPerBlock() {
        return gasPerBlock;
    }

    public List<Pair<Stmt, Long>> codeChunksAccessed() {
        return codeChunksAccessed;
    }

    /**
     * Count the distinct statements mentioned by the opcode or block relations.
     *
     * @return The number of statements.
     */
    public int statementCount() {
        Set<Stmt> stmts = new HashSet<>();
        for (Pair<Stmt, Opcode> op : statementOpcodes) stmts.add(op.left);
        for (Pair<Stmt, Block> sb : statementBlocks) stmts.add(sb.left);
        return stmts.size();
    }

    /**
     * A builder of {@link FactStore}s. Duplicate tuples are collapsed.
     */
    public static final class Builder {
        private final Set<Pair<Stmt, Opcode>> statementOpcodes = new LinkedHashSet<>();
        private final Set<Pair<Stmt, Block>> statementBlocks = new LinkedHashSet<>();
        private final Set<Pair<Stmt, Stmt>> statementNext = new LinkedHashSet<>();
        private final Set<OperandSlot> statementUses = new LinkedHashSet<>();
        private final Set<OperandSlot> statementDefines = new LinkedHashSet<>();
        private final Set<Edge> localEdges = new LinkedHashSet<>();
        private final Set<Edge> fallthroughEdges = new LinkedHashSet<>();
        private final Set<Pair<Block, Func>> callGraphEdges = new LinkedHashSet<>();
        private final Set<CallReturn> functionCallReturns = new LinkedHashSet<>();
        private final Set<Pair<Block, Func>> inFunction = new LinkedHashSet<>();
        private final Set<Block> functionEntries = new LinkedHashSet<>();
        private final Set<Pair<Func, String>> publicFunctions = new LinkedHashSet<>();
        private final Set<Pair<Func, String>> functionNames = new LinkedHashSet<>();
        private final Set<Binding<Func>> formalArgs = new LinkedHashSet<>();
        private final Set<Binding<Block>> actualReturnArgs = new LinkedHashSet<>();
        private final Set<Pair<Var, String>> variableValues = new LinkedHashSet<>();
        private final Set<Pair<Block, Long>> gasPerBlock = new LinkedHashSet<>();
        private final Set<Pair<Stmt, Long>> codeChunksAccessed = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder statementOpcode(String stmt, String opcode) {
            statementOpcodes.add(Pair.of(Stmt.of(stmt), Opcode.of(opcode)));
            return this;
        }

        public Builder statementBlock(String stmt, String block) {
            statementBlocks.add(Pair.of(Stmt.of(stmt), Block.of(block)));
            return this;
        }

        /**
         * Record an instruction: its opcode and its block, in one call.
         *
         * @param stmt   The statement.
         * @param opcode The opcode mnemonic.
         * @param block  The block.
         * @return This builder.
         */
        public Builder statement(String stmt, String opcode, String block) {
            return statementOpcode(stmt, opcode).statementBlock(stmt, block);
        }

        public Builder statementNext(String stmt, String next) {
            statementNext.add(Pair.of(Stmt.of(stmt), Stmt.of(next)));
            return this;
        }

        public Builder statementUses(String stmt, String var, int position) {
            statementUses.add(OperandSlot.of(Stmt.of(stmt), Var.of(var), position));
            return this;
        }

        public Builder statementDefines(String stmt, String var, int position) {
            statementDefines.add(OperandSlot.of(Stmt.of(stmt), Var.of(var), position));
            return this;
        }

        public Builder localEdge(String from, String to) {
            localEdges.add(Edge.of(Block.of(from), Block.of(to)));
            return this;
        }

        public Builder fallthroughEdge(String from, String to) {
            fallthroughEdges.add(Edge.of(Block.of(from), Block.of(to)));
            return this;
        }

        public Builder callGraphEdge(String callerBlock, String function) {
            callGraphEdges.add(Pair.of(Block.of(callerBlock), Func.of(function)));
            return this;
        }

        public Builder functionCallReturn(String callerBlock, String function, String continuation) {
            functionCallReturns.add(CallReturn.of(Block.of(callerBlock), Func.of(function), Block.of(continuation)));
            return this;
        }

        public Builder inFunction(String block, String function) {
            inFunction.add(Pair.of(Block.of(block), Func.of(function)));
            return this;
        }

        public Builder functionEntry(String block) {
            functionEntries.add(Block.of(block));
            return this;
        }

        public Builder publicFunction(String function, String selector) {
            publicFunctions.add(Pair.of(Func.of(function), selector));
            return this;
        }

        public Builder functionName(String function, String name) {
            functionNames.add(Pair.of(Func.of(function), name));
            return this;
        }

        public Builder formalArg(String function, String var, int position) {
            formalArgs.add(Binding.of(Func.of(function), Var.of(var), position));
            return this;
        }

        public Builder actualReturnArg(String callerBlock, String var, int position) {
            actualReturnArgs.add(Binding.of(Block.of(callerBlock), Var.of(var), position));
            return this;
        }

        public Builder variableValue(String var, String value) {
            variableValues.add(Pair.of(Var.of(var), value));
            return this;
        }

        public Builder gasPerBlock(String block, long gas) {
            gasPerBlock.add(Pair.of(Block.of(block), gas));
            return this;
        }

        public Builder codeChunkAccessed(String stmt, long chunk) {
            codeChunksAccessed.add(Pair.of(Stmt.of(stmt), chunk));
            return this;
        }

        /**
         * Build the fact store. The builder may be reused afterwards.
         *
         * @return The fact store.
         */
        public FactStore build() {
            return new FactStore(this);
        }
    }
}
