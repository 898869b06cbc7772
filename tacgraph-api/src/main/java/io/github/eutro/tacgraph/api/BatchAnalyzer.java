package io.github.eutro.tacgraph.api;

import io.github.eutro.tacgraph.core.AnalysisResult;
import io.github.eutro.tacgraph.core.ProgramAnalyzer;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.report.AnalysisAbortedException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

/**
 * Analyses many contracts in parallel, reading each from its fact directory and writing
 * its results to a directory of the same name under an output root.
 * <p>
 * Contracts are independent: one failing or aborting does not affect the others.
 * A contract whose analysis does not complete has no results written.
 * <p>
 * Contracts whose directories share a name are told apart by a {@code -N} suffix,
 * counting from 2 in the order they are given, so that no two write to the same directory.
 */
public class BatchAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchAnalyzer.class);

    /**
     * How the analysis of one contract ended.
     */
    public enum Status {
        /**
         * Completed with no violations.
         */
        OK,
        /**
         * Completed, but violations were found.
         */
        DEGRADED,
        /**
         * The facts were rejected outright; nothing was written.
         */
        ABORTED,
        /**
         * The facts could not be read, or the results could not be written.
         */
        FAILED,
    }

    public static final class Outcome {
        public final String name;
        public final Status status;
        @Nullable
        public final String message;

        public Outcome(String name, Status status, @Nullable String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        @Override
        public String toString() {
            return message == null ? name + ": " + status : name + ": " + status + " (" + message + ")";
        }
    }

    private final ProgramAnalyzer analyzer;
    private final int jobs;

    /**
     * Construct a batch analyzer.
     *
     * @param analyzer The analyzer to run on each contract.
     * @param jobs     The number of contracts to analyse at once.
     */
    public BatchAnalyzer(ProgramAnalyzer analyzer, int jobs) {
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be positive: " + jobs);
        }
        this.analyzer = analyzer;
        this.jobs = jobs;
    }

    /**
     * Analyse every contract, and wait for all of them.
     *
     * @param contracts  The fact directories of the contracts.
     * @param outputRoot The directory to write results under.
     * @return The outcome of each contract, in the order given.
     */
    public List<Outcome> run(List<Path> contracts, Path outputRoot) {
        List<String> names = uniqueNames(contracts);
        ExecutorService executor = Executors.newFixedThreadPool(jobs);
        List<Outcome> outcomes = new ArrayList<>();
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (int i = 0; i < contracts.size(); i++) {
                Path contract = contracts.get(i);
                String name = names.get(i);
                futures.add(executor.submit(() -> analyzeOne(contract, name, outputRoot)));
            }
            for (int i = 0; i < futures.size(); i++) {
                String name = names.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOGGER.error("{}: analysis failed", name, e.getCause());
                    outcomes.add(new Outcome(name, Status.FAILED, String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.error("interrupted, cancelling {} remaining contracts", futures.size() - i);
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                        outcomes.add(new Outcome(names.get(j), Status.ABORTED, "interrupted"));
                    }
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    /**
     * Analyse one contract, on the calling thread, writing its results to
     * {@code outputRoot/name}.
     *
     * @param contract   The fact directory of the contract.
     * @param name       The name to report and write the contract under.
     * @param outputRoot The directory to write results under.
     * @return The outcome.
     */
    public Outcome analyzeOne(Path contract, String name, Path outputRoot) {
        FactStore facts;
        try {
            facts = FactsReader.read(contract);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("{}: could not read facts: {}", name, e.getMessage());
            return new Outcome(name, Status.FAILED, e.getMessage());
        }

        AnalysisResult result;
        try {
            result = analyzer.analyze(name, facts);
        } catch (AnalysisAbortedException e) {
            LOGGER.error("{}: aborted: {}", name, e.getMessage());
            return new Outcome(name, Status.ABORTED, e.getMessage());
        }

        try {
            ResultWriter.write(result, outputRoot.resolve(name));
        } catch (IOException e) {
            LOGGER.error("{}: could not write results", name, e);
            return new Outcome(name, Status.FAILED, e.getMessage());
        }

        if (result.isDegraded()) {
            return new Outcome(name, Status.DEGRADED, result.violations.size() + " violations");
        }
        LOGGER.info("{}: done, {} global edges, {} reachable blocks",
                name, result.globalCfg.edges().size(), result.reachableBlocks.size());
        return new Outcome(name, Status.OK, null);
    }

    static List<String> uniqueNames(List<Path> contracts) {
        List<String> names = new ArrayList<>(contracts.size());
        Set<String> taken = new HashSet<>();
        for (Path contract : contracts) taken.add(nameOf(contract));
        Set<String> used = new HashSet<>();
        for (Path contract : contracts) {
            String base = nameOf(contract);
            String name = base;
            int n = 2;
            // a suffixed name must not shadow a contract that really has that name
            while (used.contains(name) || (!name.equals(base) && taken.contains(name))) {
                name = base + "-" + n++;
            }
            used.add(name);
            names.add(name);
        }
        return names;
    }

    private static String nameOf(Path contract) {
        Path fileName = contract.toAbsolutePath().normalize().getFileName();
        return fileName == null ? "contract" : fileName.toString();
    }
}
