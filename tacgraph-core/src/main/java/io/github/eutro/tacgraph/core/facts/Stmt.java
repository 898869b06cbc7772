package io.github.eutro.tacgraph.core.facts;

/**
 * A statement, one instruction occurrence in the lifted program.
 */
public final class Stmt extends EntityId {
    private Stmt(String key) {
        super(key);
    }

    /**
     * Get the id with the given key.
     *
     * @param key The key.
     * @return The id.
     */
    public static Stmt of(String key) {
        return new Stmt(key);
    }

    @Override
    public String kind() {
        return "stmt";
    }
}
