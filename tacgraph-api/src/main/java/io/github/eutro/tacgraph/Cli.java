package io.github.eutro.tacgraph;

import io.github.eutro.tacgraph.api.BatchAnalyzer;
import io.github.eutro.tacgraph.api.FactsReader;
import io.github.eutro.tacgraph.core.ProgramAnalyzer;
import io.github.eutro.tacgraph.core.conf.AnalysisConfig;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        List<String> paths = new ArrayList<>();
        boolean setOutput = false;
        File outputDir = new File(".");
        boolean suppressFlags = false;
        int jobs = Runtime.getRuntime().availableProcessors();
        AnalysisConfig.Builder config = AnalysisConfig.createBuilder();
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            System.err.printf("%s: expected directory%n", arg);
                            System.exit(1);
                        }
                        if (setOutput) {
                            System.err.printf("%s: output already specified%n", arg);
                            System.exit(1);
                        }
                        setOutput = true;
                        outputDir = new File(args[i++]);
                        break;
                    case "-j":
                    case "--jobs":
                        jobs = intArg(arg, args, i++);
                        if (jobs < 1) {
                            System.err.printf("%s: expected a positive number%n", arg);
                            System.exit(1);
                        }
                        break;
                    case "--max-statements":
                        int max = intArg(arg, args, i++);
                        if (max < 0) {
                            System.err.printf("%s: expected a non-negative number%n", arg);
                            System.exit(1);
                        }
                        config.setMaxStatements(max);
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        System.err.printf("%s: unknown flag%n", arg);
                        System.exit(1);
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp();
            System.exit(1);
        }

        List<Path> contracts = new ArrayList<>();
        for (String path : paths) {
            Path dir = new File(path).toPath();
            try {
                if (FactsReader.isFactsDirectory(dir)) {
                    contracts.add(dir);
                } else if (Files.isDirectory(dir)) {
                    try (DirectoryStream<Path> children = Files.newDirectoryStream(dir, Files::isDirectory)) {
                        for (Path child : children) {
                            if (FactsReader.isFactsDirectory(child)) contracts.add(child);
                        }
                    }
                } else {
                    System.err.printf("not a directory: %s%n", path);
                    System.exit(1);
                }
            } catch (IOException e) {
                System.err.printf("could not list directory %s: %s%n", path, e);
                System.exit(1);
            }
        }

        BatchAnalyzer batch = new BatchAnalyzer(new ProgramAnalyzer(config.build()), jobs);
        boolean failed = false;
        for (BatchAnalyzer.Outcome outcome : batch.run(contracts, outputDir.toPath())) {
            System.out.println(outcome);
            if (outcome.status == BatchAnalyzer.Status.FAILED || outcome.status == BatchAnalyzer.Status.ABORTED) {
                failed = true;
            }
        }
        if (failed) System.exit(2);
    }

    private static int intArg(String flag, String[] args, int i) {
        if (i == args.length) {
            System.err.printf("%s: expected number%n", flag);
            System.exit(1);
        }
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            System.err.printf("%s: not a number: %s%n", flag, args[i]);
            System.exit(1);
            throw e;
        }
    }

    private static void printHelp() {
        System.out.println(
                "usage: tacgraph [-h|--help] [-o|--output <dir>] [-j|--jobs <n>] [--max-statements <n>] <dir> ...\n" +
                        "\n" +
                        "  <dir> : a directory of <Relation>.facts files, or a directory of such directories\n" +
                        "  -o|--output <dir> : write the results of each contract to <dir>/<contract>/<Relation>.csv\n" +
                        "  -j|--jobs <n> : analyse <n> contracts at once, by default one per processor\n" +
                        "  --max-statements <n> : abort contracts with more than <n> statements\n" +
                        "  -h|--help : show this help\n" +
                        "\n" +
                        "  the system properties " + AnalysisConfig.PROP_GLOBAL_ENTRY_BLOCK + ", "
                        + AnalysisConfig.PROP_FALLBACK_SELECTOR + " and " + AnalysisConfig.PROP_MAX_STATEMENTS + "\n" +
                        "  override the entry block, the fallback selector and the statement limit"
        );
    }
}
