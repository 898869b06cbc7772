package io.github.eutro.tacgraph.core.report;

/**
 * Thrown when the facts of a contract cannot be analysed at all, such as when
 * there is no function membership data, or the contract is larger than configured.
 * <p>
 * No partial output of an aborted run is published.
 */
public class AnalysisAbortedException extends RuntimeException {
    public AnalysisAbortedException(String message) {
        super(message);
    }
}
