package io.github.eutro.tacgraph.core.report;

import io.github.eutro.tacgraph.core.facts.EntityId;

import java.util.Objects;

/**
 * An inconsistency found in the facts, with the entity it concerns and the offending tuple.
 */
public final class Violation {
    /**
     * The kind of a {@link Violation}.
     */
    public enum Kind {
        /**
         * Membership is missing or ambiguous: a statement without exactly one block or opcode,
         * a block without exactly one function, a variable in two functions,
         * a function with several entry blocks.
         */
        STRUCTURAL,
        /**
         * Operand positions at a call or return site are not {@code 1..k}
         * (or {@code 0..k-1} for already rebased bindings).
         */
        BINDING,
        /**
         * A block or function that should have a unique classification does not.
         */
        CLASSIFICATION,
    }

    public final Kind kind;
    public final EntityId entity;
    public final String message;
    public final String tuple;

    public Violation(Kind kind, EntityId entity, String message, Object tuple) {
        this.kind = Objects.requireNonNull(kind);
        this.entity = Objects.requireNonNull(entity);
        this.message = Objects.requireNonNull(message);
        this.tuple = String.valueOf(tuple);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return kind == that.kind
                && entity.equals(that.entity)
                && message.equals(that.message)
                && tuple.equals(that.tuple);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, entity, message, tuple);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s: %s\n  in: %s", kind, entity.kind(), entity, message, tuple);
    }
}
