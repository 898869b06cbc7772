package io.github.eutro.tacgraph.core.facts;

/**
 * A basic block, an ordered container of zero or more {@link Stmt statements}.
 */
public final class Block extends EntityId {
    private Block(String key) {
        super(key);
    }

    /**
     * Get the id with the given key.
     *
     * @param key The key.
     * @return The id.
     */
    public static Block of(String key) {
        return new Block(key);
    }

    @Override
    public String kind() {
        return "block";
    }
}
