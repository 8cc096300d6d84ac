package io.eventrelay.completion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per job: the job params go to stdin as JSON, stdout is the
 * result. Output that parses as JSON is kept as JSON, anything else is wrapped as
 * {@code {"response": "..."}}.
 */
public final class ScriptCompletionWorker implements CompletionWorker {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptCompletionWorker(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("completion command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return "script:" + command.get(0);
    }

    @Override
    public CompletionOutput run(CompletionJobView job) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("EVENTRELAY_REQUEST_ID", job.requestId());
        if (job.sessionId() != null) {
            pb.environment().put("EVENTRELAY_SESSION_ID", job.sessionId());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CompletionOutput.fail("script spawn failed: " + e.getMessage());
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(job.params()).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CompletionOutput.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            String combined = output.get(5, TimeUnit.SECONDS);
            if (process.exitValue() == 0) {
                return CompletionOutput.ok(parseOutput(combined));
            }
            return CompletionOutput.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            return CompletionOutput.fail("script execution failed: " + e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script output", e);
        }
    }

    private static JsonNode parseOutput(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return Jsons.readTree(trimmed);
            } catch (JsonProcessingException e) {
                return wrapText(trimmed);
            }
        }
        return wrapText(trimmed);
    }

    private static JsonNode wrapText(String text) {
        ObjectNode wrapped = Jsons.object();
        wrapped.put("response", text);
        return wrapped;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
