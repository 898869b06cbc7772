package io.github.eutro.tacgraph.api;

import io.github.eutro.tacgraph.core.facts.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the facts of one contract from a directory with one {@code <Relation>.facts} file per relation.
 * <p>
 * Each line of a file is one tuple, with columns separated by tabs. Empty lines are skipped,
 * and a missing file is an empty relation.
 */
public class FactsReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(FactsReader.class);

    /**
     * The file extension of fact files.
     */
    public static final String EXTENSION = ".facts";

    @FunctionalInterface
    private interface RowHandler {
        void accept(FactStore.Builder builder, String[] row);
    }

    private static final class Relation {
        final String name;
        final int arity;
        final RowHandler handler;

        Relation(String name, int arity, RowHandler handler) {
            this.name = name;
            this.arity = arity;
            this.handler = handler;
        }
    }

    private static final List<Relation> RELATIONS = Arrays.asList(
            new Relation("Statement_Opcode", 2, (b, r) -> b.statementOpcode(r[0], r[1])),
            new Relation("Statement_Block", 2, (b, r) -> b.statementBlock(r[0], r[1])),
            new Relation("Statement_Next", 2, (b, r) -> b.statementNext(r[0], r[1])),
            new Relation("Statement_Uses", 3, (b, r) -> b.statementUses(r[0], r[1], Integer.parseInt(r[2]))),
            new Relation("Statement_Defines", 3, (b, r) -> b.statementDefines(r[0], r[1], Integer.parseInt(r[2]))),
            new Relation("LocalBlockEdge", 2, (b, r) -> b.localEdge(r[0], r[1])),
            new Relation("FallthroughEdge", 2, (b, r) -> b.fallthroughEdge(r[0], r[1])),
            new Relation("CallGraphEdge", 2, (b, r) -> b.callGraphEdge(r[0], r[1])),
            new Relation("FunctionCallReturn", 3, (b, r) -> b.functionCallReturn(r[0], r[1], r[2])),
            new Relation("InFunction", 2, (b, r) -> b.inFunction(r[0], r[1])),
            new Relation("FunctionEntry", 1, (b, r) -> b.functionEntry(r[0])),
            new Relation("PublicFunction", 2, (b, r) -> b.publicFunction(r[0], r[1])),
            new Relation("HighLevelFunctionName", 2, (b, r) -> b.functionName(r[0], r[1])),
            new Relation("FormalArgs", 3, (b, r) -> b.formalArg(r[0], r[1], Integer.parseInt(r[2]))),
            new Relation("ActualReturnArgs", 3, (b, r) -> b.actualReturnArg(r[0], r[1], Integer.parseInt(r[2]))),
            new Relation("Variable_Value", 2, (b, r) -> b.variableValue(r[0], r[1])),
            new Relation("GasPerBlock", 2, (b, r) -> b.gasPerBlock(r[0], Long.parseLong(r[1]))),
            new Relation("CodeChunkAccessed", 2, (b, r) -> b.codeChunkAccessed(r[0], Long.parseLong(r[1])))
    );

    /**
     * Read the facts in a directory.
     *
     * @param directory The directory.
     * @return The facts.
     * @throws IOException              If the directory does not exist, or a file cannot be read.
     * @throws IllegalArgumentException If a line has the wrong number of columns, or a malformed number.
     */
    public static FactStore read(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "not a directory");
        }
        FactStore.Builder builder = FactStore.builder();
        for (Relation relation : RELATIONS) {
            Path file = directory.resolve(relation.name + EXTENSION);
            if (!Files.exists(file)) {
                LOGGER.debug("{}: absent, relation is empty", file);
                continue;
            }
            int count = 0;
            int lineNo = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isEmpty()) continue;
                    String[] row = line.split("\t", -1);
                    if (row.length != relation.arity) {
                        throw new IllegalArgumentException(String.format(
                                "%s:%d: expected %d columns, got %d",
                                file, lineNo, relation.arity, row.length));
                    }
                    try {
                        relation.handler.accept(builder, row);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(String.format(
                                "%s:%d: %s", file, lineNo, e.getMessage()), e);
                    }
                    count++;
                }
            }
            LOGGER.debug("{}: {} tuples", file, count);
        }
        return builder.build();
    }

    /**
     * Check whether a directory holds the facts of a contract, that is, any fact file.
     *
     * @param directory The directory.
     * @return Whether it contains a fact file.
     * @throws IOException If the directory cannot be listed.
     */
    public static boolean isFactsDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) return false;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            return files.iterator().hasNext();
        }
    }
}
