package io.eventrelay.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.model.CompletionStatus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.FutureTask;

/**
 * Mutable job state. Every transition goes through a synchronized method that checks
 * {@link CompletionStatus#canAdvanceTo}, so the terminal fields are written once.
 */
final class CompletionJob {
    private final String requestId;
    private final String origin;
    private final String sessionId;
    private final ObjectNode params;
    private final long submittedAtMs;
    private final long submissionOrder;
    private final CompletableFuture<CompletionJobView> done = new CompletableFuture<>();
    private CompletionStatus status = CompletionStatus.QUEUED;
    private Long startedAtMs;
    private Long completedAtMs;
    private JsonNode result;
    private String error;
    private FutureTask<?> task;

    CompletionJob(String requestId, String origin, String sessionId, ObjectNode params, long submittedAtMs,
                  long submissionOrder) {
        this.requestId = requestId;
        this.origin = origin;
        this.sessionId = sessionId;
        this.params = params.deepCopy();
        this.submittedAtMs = submittedAtMs;
        this.submissionOrder = submissionOrder;
    }

    String requestId() {
        return requestId;
    }

    long submissionOrder() {
        return submissionOrder;
    }

    String sessionId() {
        return sessionId;
    }

    synchronized CompletionStatus status() {
        return status;
    }

    synchronized void attach(FutureTask<?> task) {
        this.task = task;
    }

    synchronized FutureTask<?> task() {
        return task;
    }

    synchronized boolean start(long nowMs) {
        if (!status.canAdvanceTo(CompletionStatus.IN_PROGRESS)) {
            return false;
        }
        status = CompletionStatus.IN_PROGRESS;
        startedAtMs = nowMs;
        return true;
    }

    /**
     * Records a terminal state. Returns the resulting view, or {@code null} if the job was
     * already terminal.
     */
    CompletionJobView finish(CompletionStatus terminal, JsonNode result, String error, long nowMs) {
        CompletionJobView view;
        FutureTask<?> running;
        synchronized (this) {
            if (!terminal.isTerminal() || !status.canAdvanceTo(terminal)) {
                return null;
            }
            status = terminal;
            completedAtMs = nowMs;
            this.result = result == null ? null : result.deepCopy();
            this.error = error;
            view = view();
            running = task;
        }
        if (terminal == CompletionStatus.CANCELLED && running != null) {
            running.cancel(true);
        }
        return view;
    }

    synchronized CompletionJobView view() {
        return new CompletionJobView(
                requestId,
                status,
                origin,
                sessionId,
                params.deepCopy(),
                result == null ? null : result.deepCopy(),
                error,
                submittedAtMs,
                startedAtMs,
                completedAtMs
        );
    }

    void interrupt() {
        FutureTask<?> running;
        synchronized (this) {
            running = task;
        }
        if (running != null) {
            running.cancel(true);
        }
    }

    CompletableFuture<CompletionJobView> done() {
        return done;
    }

    void publish(CompletionJobView terminalView) {
        done.complete(terminalView);
    }
}
