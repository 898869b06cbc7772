package io.github.eutro.tacgraph.api;

import io.github.eutro.tacgraph.core.AnalysisResult;
import io.github.eutro.tacgraph.core.facts.Binding;
import io.github.eutro.tacgraph.core.facts.Edge;
import io.github.eutro.tacgraph.core.report.Violation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Writes the results of an analysis to a directory, one {@code <Relation>.csv} file per relation,
 * one tab-separated tuple per line.
 * <p>
 * Rows are sorted (bindings by site, then by position), except in {@code Violations.csv},
 * which keeps the order violations were found in, so the same result is always written as the same bytes. Each file is written to a temporary file
 * first and then moved into place.
 */
public class ResultWriter {
    /**
     * The file extension of result files.
     */
    public static final String EXTENSION = ".csv";

    /**
     * Write a result.
     *
     * @param result    The result.
     * @param directory The directory, which is created if needed.
     * @throws IOException If a file cannot be written.
     */
    public static void write(AnalysisResult result, Path directory) throws IOException {
        Files.createDirectories(directory);

        writeSorted(directory, "BlockHead", pairs(result.blockBounds.heads()));
        writeSorted(directory, "BlockTail", pairs(result.blockBounds.tails()));
        writeSorted(directory, "VariableInFunction", pairs(result.varOwnership.owners()));
        writeSorted(directory, "Statement_Function", pairs(result.varOwnership.statementFunctions()));
        writeRelation(directory, "ActualArgs", bindings(result.callBindings.actualArgs()));
        writeRelation(directory, "FormalReturnArgs", bindings(result.callBindings.formalReturnArgs()));

        List<String> edges = new ArrayList<>();
        for (Edge edge : result.globalCfg.edges()) {
            edges.add(row(edge.from, edge.to));
        }
        writeSorted(directory, "GlobalBlockEdge", edges);

        writeSorted(directory, "FunctionExit", singles(result.classification.functionExits()));
        writeSorted(directory, "GlobalEntryBlock",
                singles(Collections.singleton(result.classification.globalEntryBlock())));
        writeSorted(directory, "ValidGlobalTerminalBlock", singles(result.classification.validTerminals()));
        writeSorted(directory, "FallbackFunction", singles(result.classification.fallbackFunctions()));
        writeSorted(directory, "ReachableBlock", singles(result.reachableBlocks));

        List<String> violations = new ArrayList<>();
        for (Violation v : result.violations) {
            violations.add(row(v.kind, v.entity.kind(), v.entity, v.message, v.tuple));
        }
        writeRelation(directory, "Violations", violations);
    }

    private static List<String> pairs(Map<?, ?> map) {
        List<String> rows = new ArrayList<>();
        map.forEach((k, v) -> rows.add(row(k, v)));
        return rows;
    }

    // by site, then numerically by position
    private static List<String> bindings(List<? extends Binding<?>> bindings) {
        List<Binding<?>> sorted = new ArrayList<>(bindings);
        Collections.sort(sorted);
        List<String> rows = new ArrayList<>();
        for (Binding<?> binding : sorted) {
            rows.add(row(binding.site, binding.var, binding.position));
        }
        return rows;
    }

    private static List<String> singles(Collection<?> values) {
        List<String> rows = new ArrayList<>();
        for (Object value : values) {
            rows.add(String.valueOf(value));
        }
        return rows;
    }

    private static String row(Object... columns) {
        StringJoiner sj = new StringJoiner("\t");
        for (Object column : columns) {
            sj.add(String.valueOf(column).replace('\t', ' ').replace('\n', ' '));
        }
        return sj.toString();
    }

    private static void writeSorted(Path directory, String relation, List<String> rows) throws IOException {
        Collections.sort(rows);
        writeRelation(directory, relation, rows);
    }

    private static void writeRelation(Path directory, String relation, List<String> rows) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String row : rows) {
            sb.append(row).append('\n');
        }
        Path file = directory.resolve(relation + EXTENSION);
        Path tmp = directory.resolve(relation + EXTENSION + ".tmp");
        Files.write(tmp, sb.toString().getBytes(StandardCharsets.UTF_8));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
