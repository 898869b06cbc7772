package io.github.eutro.tacgraph.api;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

class TestContracts {
    static Path resource(String name) {
        URL url = TestContracts.class.getResource("/contracts/" + name);
        if (url == null) throw new IllegalStateException("missing test contract " + name);
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static void write(Path dir, String relation, String... lines) throws IOException {
        Files.createDirectories(dir);
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        Files.write(dir.resolve(relation + FactsReader.EXTENSION), sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    static String read(Path dir, String relation) throws IOException {
        return new String(Files.readAllBytes(dir.resolve(relation + ResultWriter.EXTENSION)), StandardCharsets.UTF_8);
    }
}
