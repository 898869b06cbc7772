/**
 * File-based front end over the core tacgraph analysis.
 * <p>
 * {@link io.github.eutro.tacgraph.api.FactsReader} loads a contract's facts from a directory,
 * {@link io.github.eutro.tacgraph.api.ResultWriter} writes the derived relations back out, and
 * {@link io.github.eutro.tacgraph.api.BatchAnalyzer} does both for many contracts at once.
 */
package io.github.eutro.tacgraph.api;
