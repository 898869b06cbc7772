package io.github.eutro.tacgraph.core.facts;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An opaque identifier of an entity in the lifted program, addressed by its string key.
 * <p>
 * Ids of different kinds never compare equal, even if their keys do.
 * Cross-references between entities are always lookups by id, never direct links.
 */
public abstract class EntityId implements Comparable<EntityId> {
    private final String key;

    EntityId(String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    /**
     * Get the key of this id, as it appears in the facts.
     *
     * @return The key.
     */
    public String key() {
        return key;
    }

    /**
     * Get a short name for the kind of entity this identifies, used in reports.
     *
     * @return The kind name.
     */
    public abstract String kind();

    @Override
    public int compareTo(@NotNull EntityId o) {
        int c = kind().compareTo(o.kind());
        return c != 0 ? c : key.compareTo(o.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return key.equals(((EntityId) o).key);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
