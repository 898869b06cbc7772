package io.github.eutro.tacgraph.core;

import io.github.eutro.tacgraph.core.conf.AnalysisConfig;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.passes.InPlaceIRPass;
import io.github.eutro.tacgraph.core.passes.Passes;
import io.github.eutro.tacgraph.core.report.AnalysisAbortedException;
import io.github.eutro.tacgraph.core.report.Violation;
import io.github.eutro.tacgraph.core.report.Violations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs every derivation over the facts of a contract.
 * <p>
 * An analyzer holds no state between runs, so one instance may analyse many contracts,
 * from many threads at once.
 */
public class ProgramAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgramAnalyzer.class);

    private final AnalysisConfig config;
    private final List<InPlaceIRPass<Program>> stages;

    public ProgramAnalyzer(AnalysisConfig config) {
        this(config, Passes.STAGES);
    }

    public ProgramAnalyzer() {
        this(AnalysisConfig.DEFAULT);
    }

    /**
     * Construct an analyzer running the given passes, which must between them compute
     * every result {@link AnalysisResult} publishes.
     *
     * @param config The configuration.
     * @param stages The passes, in order.
     */
    public ProgramAnalyzer(AnalysisConfig config, List<InPlaceIRPass<Program>> stages) {
        this.config = config;
        this.stages = stages;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /**
     * Analyse a contract.
     *
     * @param name  The name of the contract, for logging.
     * @param facts The facts of the contract.
     * @return The results, with the violations found.
     * @throws AnalysisAbortedException If the facts cannot be analysed, or the thread was interrupted.
     */
    public AnalysisResult analyze(String name, FactStore facts) {
        Program program = new Program(facts, config);
        for (InPlaceIRPass<Program> stage : stages) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AnalysisAbortedException(name + ": interrupted");
            }
            long start = System.nanoTime();
            stage.runInPlace(program);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{}: {} took {} ms",
                        name,
                        stage.name(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
        }

        AnalysisResult result = AnalysisResult.of(name, program);
        if (result.isDegraded()) {
            Violations violations = program.violations;
            LOGGER.warn("{}: degraded, {} structural, {} binding, {} classification violations",
                    name,
                    violations.count(Violation.Kind.STRUCTURAL),
                    violations.count(Violation.Kind.BINDING),
                    violations.count(Violation.Kind.CLASSIFICATION));
        }
        return result;
    }
}
