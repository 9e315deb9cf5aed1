package io.specqueue.executor;

import io.specqueue.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ScriptTaskExecutorTest {
    private static final Path SH = Paths.get("/bin/sh");

    @BeforeEach
    void requireShell() {
        assumeTrue(Files.isExecutable(SH), "needs a POSIX shell");
    }

    @Test
    void payloadIsPipedToStdinAndEnvironmentCarriesTaskIdentity() throws Exception {
        ScriptTaskExecutor executor = new ScriptTaskExecutor(
                List.of(SH.toString(), "-c", "echo \"$TASK_ID@$SOURCE_ID#$TASK_ATTEMPT\"; cat"),
                10_000L
        );

        ExecutionResult result = executor.execute(request("task-20250101-120000-a", "hello spec"));

        assertTrue(result.success());
        assertEquals("task-20250101-120000-a@main#2\nhello spec", result.output());
        assertNull(result.error());
    }

    @Test
    void nonZeroExitIsFailureWithTruncatedOutput() throws Exception {
        ScriptTaskExecutor executor = new ScriptTaskExecutor(
                List.of(SH.toString(), "-c", "echo 'line one'; echo 'line two' 1>&2; exit 3"),
                10_000L
        );

        ExecutionResult result = executor.execute(request("task-20250101-120000-b", ""));

        assertFalse(result.success());
        assertTrue(result.error().startsWith("executor exit=3 output="), result.error());
        assertTrue(result.error().contains("line one line two"), result.error());
    }

    @Test
    void timeoutKillsTheCommand() throws Exception {
        ScriptTaskExecutor executor = new ScriptTaskExecutor(List.of(SH.toString(), "-c", "sleep 30"), 200L);

        long started = System.currentTimeMillis();
        ExecutionResult result = executor.execute(request("task-20250101-120000-c", ""));

        assertFalse(result.success());
        assertTrue(result.error().startsWith("executor timeout after"), result.error());
        assertTrue(System.currentTimeMillis() - started < 20_000L);
    }

    @Test
    void timeoutHoldsWhenTheCommandNeverReadsALargePayload() throws Exception {
        ScriptTaskExecutor executor = new ScriptTaskExecutor(List.of(SH.toString(), "-c", "sleep 30"), 300L);
        String payload = "x".repeat(1024 * 1024);

        long started = System.currentTimeMillis();
        ExecutionResult result = executor.execute(request("task-20250101-120000-f", payload));

        assertFalse(result.success());
        assertTrue(result.error().startsWith("executor timeout after"), result.error());
        assertTrue(System.currentTimeMillis() - started < 20_000L);
    }

    @Test
    void missingBinaryIsReportedAsFailure() throws Exception {
        ScriptTaskExecutor executor = new ScriptTaskExecutor(List.of("/nonexistent/spec-queue-executor"), 0L);

        ExecutionResult result = executor.execute(request("task-20250101-120000-d", "x"));

        assertFalse(result.success());
        assertTrue(result.error().startsWith("executor spawn failed"), result.error());
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ScriptTaskExecutor(List.of(), 0L));
    }

    @Test
    void echoExecutorDescribesTheRequest() throws Exception {
        ExecutionResult result = new EchoTaskExecutor().execute(request("task-20250101-120000-e", "four"));

        assertTrue(result.success());
        var echoed = Jsons.mapper().readTree(result.output());
        assertEquals("task-20250101-120000-e", echoed.path("taskId").asText());
        assertEquals(4, echoed.path("payloadChars").asInt());
        assertEquals("echo", echoed.path("executor").asText());
    }

    private static ExecutionRequest request(String taskId, String payload) {
        return new ExecutionRequest(taskId, "main", Paths.get("/tmp", taskId + ".md"), payload, null, 2);
    }
}
