package io.specqueue.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.specqueue.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpecQueueCommandTest {

    @Test
    void sourceLoadAndOneShotRunFlow() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-cli-");
        try {
            Path sourceRoot = Files.createDirectories(root.resolve("repo"));
            Path workspace = Files.createDirectories(root.resolve("workspace"));
            Cli cli = new Cli(root);

            assertEquals(0, cli.run("init", "--workspace", workspace.toString()).exitCode);
            Result added = cli.run("source", "add", "main", sourceRoot.toString(), "--description", "primary");
            assertEquals(0, added.exitCode, added.err);
            assertEquals("main", added.json().path("id").asText());
            assertTrue(Files.isDirectory(sourceRoot.resolve("pending")));

            Files.writeString(sourceRoot.resolve("pending").resolve("task-20250101-120000-cli.md"), "do it", StandardCharsets.UTF_8);
            Result ran = cli.run("run", "--once", "--dry-run");
            assertEquals(0, ran.exitCode, ran.err);
            assertEquals(1, ran.json().path("load").path("added").asInt());
            assertEquals(1, ran.json().path("process").path("processed").asInt());
            assertEquals("completed", ran.json().path("process").path("status").asText());

            JsonNode status = cli.run("status").json();
            assertEquals(1, status.path("completed").asInt());
            assertEquals("main", status.path("currentSource").asText());

            JsonNode completed = cli.run("queue", "--status", "completed").json();
            assertEquals(1, completed.size());
            assertEquals("task-20250101-120000-cli", completed.get(0).path("taskId").asText());
            assertEquals(0, cli.run("queue", "--source", "other").json().size());

            Result audit = cli.run("audit-verify");
            assertEquals(0, audit.exitCode, audit.out);
            assertTrue(audit.json().path("valid").asBoolean());

            assertTrue(Files.exists(sourceRoot.resolve("archive").resolve("task-20250101-120000-cli.md")));
            assertTrue(Files.exists(sourceRoot.resolve("results").resolve("task-20250101-120000-cli.json")));

            Result removed = cli.run("source", "remove", "main");
            assertEquals(0, removed.exitCode, removed.err);
            assertEquals(1, removed.json().path("unloadedTasks").asInt());
            assertEquals(0, cli.run("source", "list").json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void validationErrorsExitWithTwo() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-cli-invalid-");
        try {
            Path sourceRoot = Files.createDirectories(root.resolve("repo"));
            Cli cli = new Cli(root);

            Result badId = cli.run("source", "add", "bad id", sourceRoot.toString());
            assertEquals(2, badId.exitCode);
            assertTrue(badId.err.contains("ConfigValidationException"), badId.err);

            assertEquals(0, cli.run("source", "add", "main", sourceRoot.toString()).exitCode);
            Result noExecutor = cli.run("process");
            assertEquals(2, noExecutor.exitCode);
            assertTrue(noExecutor.err.contains("executorCommand"), noExecutor.err);

            assertEquals(2, cli.run("load", "--file", sourceRoot.resolve("pending").resolve("x.md").toString()).exitCode);
            assertEquals(2, cli.run("queue", "--status", "exploded").exitCode);
            assertEquals(2, cli.run("init", "--workspace", root.resolve("missing").toString()).exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runWithoutSourcesIsRejected() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-cli-empty-");
        try {
            Cli cli = new Cli(root);

            Result result = cli.run("run", "--dry-run");

            assertEquals(2, result.exitCode);
            assertTrue(result.err.contains("No sources configured"), result.err);
            assertFalse(result.err.isBlank());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void processDryRunReportsEmptyQueue() throws Exception {
        Path root = Files.createTempDirectory("spec-queue-cli-empty-process-");
        try {
            Path sourceRoot = Files.createDirectories(root.resolve("repo"));
            Cli cli = new Cli(root);
            cli.run("source", "add", "main", sourceRoot.toString());

            Result result = cli.run("process", "--dry-run", "--max", "5");

            assertEquals(0, result.exitCode, result.err);
            assertEquals("empty", result.json().path("status").asText());
            assertEquals(0, cli.run("unload", "main").json().path("unloadedTasks").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Cli {
        private final Path configFile;
        private final Path stateDir;

        private Cli(Path root) {
            this.configFile = root.resolve("config.json");
            this.stateDir = root.resolve("state");
        }

        Result run(String... args) {
            List<String> full = new ArrayList<>(List.of("--config", configFile.toString(), "--state-dir", stateDir.toString()));
            full.addAll(List.of(args));
            StringWriter out = new StringWriter();
            StringWriter err = new StringWriter();
            CommandLine commandLine = SpecQueueCommand.commandLine();
            commandLine.setOut(new PrintWriter(out, true));
            commandLine.setErr(new PrintWriter(err, true));
            int exitCode = commandLine.execute(full.toArray(new String[0]));
            return new Result(exitCode, out.toString(), err.toString());
        }
    }

    private static final class Result {
        private final int exitCode;
        private final String out;
        private final String err;

        private Result(int exitCode, String out, String err) {
            this.exitCode = exitCode;
            this.out = out;
            this.err = err;
        }

        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(out);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
