package io.github.eutro.tacgraph.core.report;

import io.github.eutro.tacgraph.core.facts.EntityId;

import java.util.*;

/**
 * Collects the {@link Violation}s found during one analysis run, in the order they were found.
 * <p>
 * A run with any violation is degraded, but still completes.
 */
public final class Violations {
    private final Set<Violation> found = new LinkedHashSet<>();

    /**
     * Record a violation.
     *
     * @param kind    The kind of violation.
     * @param entity  The entity it concerns.
     * @param message What is wrong.
     * @param tuple   The offending tuple, or tuples.
     */
    public void report(Violation.Kind kind, EntityId entity, String message, Object tuple) {
        found.add(new Violation(kind, entity, message, tuple));
    }

    /**
     * Whether any violation has been recorded.
     *
     * @return True if the run is degraded.
     */
    public boolean isDegraded() {
        return !found.isEmpty();
    }

    /**
     * Count the recorded violations of a kind.
     *
     * @param kind The kind.
     * @return The count.
     */
    public int count(Violation.Kind kind) {
        int n = 0;
        for (Violation v : found) {
            if (v.kind == kind) n++;
        }
        return n;
    }

    /**
     * Get a snapshot of the violations recorded so far.
     *
     * @return An unmodifiable list of the violations.
     */
    public List<Violation> toList() {
        return Collections.unmodifiableList(new ArrayList<>(found));
    }
}
