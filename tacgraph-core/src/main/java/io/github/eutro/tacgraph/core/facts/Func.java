package io.github.eutro.tacgraph.core.facts;

/**
 * A function, a set of {@link Block blocks} with one entry block.
 */
public final class Func extends EntityId {
    private Func(String key) {
        super(key);
    }

    /**
     * Get the id with the given key.
     *
     * @param key The key.
     * @return The id.
     */
    public static Func of(String key) {
        return new Func(key);
    }

    @Override
    public String kind() {
        return "function";
    }
}
