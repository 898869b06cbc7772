package io.github.eutro.tacgraph.core.facts;

/**
 * A variable, a value-carrying entity used or defined by {@link Stmt statements}.
 */
public final class Var extends EntityId {
    private Var(String key) {
        super(key);
    }

    /**
     * Get the id with the given key.
     *
     * @param key The key.
     * @return The id.
     */
    public static Var of(String key) {
        return new Var(key);
    }

    @Override
    public String kind() {
        return "var";
    }
}
