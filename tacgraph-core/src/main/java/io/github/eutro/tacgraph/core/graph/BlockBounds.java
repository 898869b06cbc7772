package io.github.eutro.tacgraph.core.graph;

import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Stmt;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The first and last non-PHI statement of each block.
 * <p>
 * Blocks that are empty, or contain only PHI statements, have neither.
 */
public final class BlockBounds {
    private final Map<Block, Stmt> heads;
    private final Map<Block, Stmt> tails;

    public BlockBounds(Map<Block, Stmt> heads, Map<Block, Stmt> tails) {
        this.heads = Collections.unmodifiableMap(new TreeMap<>(heads));
        this.tails = Collections.unmodifiableMap(new TreeMap<>(tails));
    }

    public Optional<Stmt> head(Block block) {
        return Optional.ofNullable(heads.get(block));
    }

    public Optional<Stmt> tail(Block block) {
        return Optional.ofNullable(tails.get(block));
    }

    public Map<Block, Stmt> heads() {
        return heads;
    }

    public Map<Block, Stmt> tails() {
        return tails;
    }
}
