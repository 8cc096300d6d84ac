package io.eventrelay.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.config.DaemonSettings;
import io.eventrelay.error.NotFoundException;
import io.eventrelay.error.QueueFullException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventEmitter;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.model.CompletionStatus;
import io.eventrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks asynchronous completion jobs from submission to a single terminal state and
 * announces each step on the event log ({@code completion:queued}, {@code completion:started},
 * {@code completion:result}). Jobs that share a {@code session_id} run one at a time in
 * submission order; jobs of different sessions run in parallel.
 */
public final class CompletionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompletionRegistry.class);

    public static final String EVENT_QUEUED = "completion:queued";
    public static final String EVENT_STARTED = "completion:started";
    public static final String EVENT_RESULT = "completion:result";

    private final CompletionWorker worker;
    private final EventEmitter emitter;
    private final Clock clock;
    private final int maxOutstandingJobs;
    private final long timeoutMs;
    private final int retention;
    private final Map<String, CompletionJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> terminalOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger terminalCount = new AtomicInteger();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger duplicateCompletions = new AtomicInteger();
    private final CompletionSessions sessions = new CompletionSessions();
    private final AtomicLong submissions = new AtomicLong();
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService watchdog;

    public CompletionRegistry(CompletionWorker worker, EventEmitter emitter, DaemonSettings settings, Clock clock) {
        this.worker = worker;
        this.emitter = emitter;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxOutstandingJobs = settings.maxOutstandingJobs();
        this.timeoutMs = settings.completionTimeoutMs();
        this.retention = settings.completedJobRetention();
        AtomicInteger threadNo = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                settings.completionThreads(),
                settings.completionThreads(),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(settings.completionQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "completion-worker-" + threadNo.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "completion-watchdog");
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        this.watchdog = scheduler;
    }

    public SubmitOutcome submit(ObjectNode params, String origin) {
        if (params == null) {
            throw new ValidationException("completion params are required");
        }
        JsonNode prompt = params.get("prompt");
        if (prompt == null || !prompt.isTextual() || prompt.asText().isBlank()) {
            throw new ValidationException("field 'prompt' is required and must be a non-empty string");
        }
        String requestedSession = optionalText(params, "session_id");
        String agentId = agentId(params, origin);
        if (outstanding.incrementAndGet() > maxOutstandingJobs) {
            outstanding.decrementAndGet();
            throw new QueueFullException(maxOutstandingJobs);
        }
        String requestId = "req_" + UUID.randomUUID();
        long nowMs = clock.millis();
        String sessionId = sessions.resolve(requestedSession, agentId);
        ObjectNode accepted = params.deepCopy();
        if (sessionId != null) {
            accepted.put("session_id", sessionId);
        }
        CompletionJob job = new CompletionJob(requestId, origin, sessionId, accepted, nowMs,
                submissions.incrementAndGet());
        jobs.put(requestId, job);

        // job.start() synchronizes on the job too, so completion:started cannot precede completion:queued
        synchronized (job) {
            try {
                admit(job);
            } catch (RejectedExecutionException e) {
                jobs.remove(requestId);
                outstanding.decrementAndGet();
                throw new QueueFullException(maxOutstandingJobs);
            }
            ObjectNode queued = Jsons.object();
            queued.put("request_id", requestId);
            if (sessionId != null) {
                queued.put("session_id", sessionId);
            }
            queued.put("submitted_at", Instant.ofEpochMilli(nowMs).toString());
            emit(EVENT_QUEUED, queued, origin);
        }
        if (timeoutMs > 0L) {
            watchdog.schedule(() -> expire(requestId), timeoutMs, TimeUnit.MILLISECONDS);
        }
        log.debug("Queued completion {} from {} (session {})", requestId, origin, sessionId);
        return new SubmitOutcome(requestId, CompletionStatus.QUEUED, sessionId, nowMs);
    }

    public CompletionJobView status(String requestId) {
        return find(requestId).view();
    }

    public StatusSummary statusSummary() {
        Map<CompletionStatus, Integer> counts = new EnumMap<>(CompletionStatus.class);
        for (CompletionStatus status : CompletionStatus.values()) {
            counts.put(status, 0);
        }
        List<String> active = new ArrayList<>();
        for (CompletionJob job : jobs.values()) {
            CompletionStatus status = job.status();
            counts.merge(status, 1, Integer::sum);
            if (!status.isTerminal()) {
                active.add(job.requestId());
            }
        }
        Map<String, Integer> byName = new LinkedHashMap<>();
        counts.forEach((status, count) -> byName.put(status.wireName(), count));
        active.sort(String::compareTo);
        return new StatusSummary(outstanding.get(), maxOutstandingJobs, sessions.activeSessions(), byName, active);
    }

    /**
     * Lane state and known jobs of one session. Without a {@code sessionId}, the agent's
     * current session is reported.
     */
    public SessionStatus sessionStatus(String sessionId, String agentId) {
        String resolved = sessionId == null || sessionId.isBlank() ? sessions.currentSession(agentId) : sessionId;
        if (resolved == null) {
            if (agentId == null) {
                throw new ValidationException("field 'session_id' is required");
            }
            throw new NotFoundException("agent " + agentId + " has no current session");
        }
        CompletionSessions.LaneStatus lane = sessions.status(resolved);
        List<CompletionJob> members = new ArrayList<>();
        for (CompletionJob job : jobs.values()) {
            if (resolved.equals(job.sessionId())) {
                members.add(job);
            }
        }
        members.sort(Comparator.comparingLong(CompletionJob::submissionOrder));
        List<SessionCompletion> completions = new ArrayList<>();
        for (CompletionJob job : members) {
            CompletionJobView view = job.view();
            completions.add(new SessionCompletion(view.requestId(), view.status(), view.submittedAtMs(),
                    view.startedAtMs(), view.completedAtMs()));
        }
        return new SessionStatus(resolved, lane.activeRequestId(), lane.waitingRequestIds(),
                lane.waitingRequestIds().size(), completions);
    }

    public CompletionResult result(String requestId) {
        CompletionJobView view = find(requestId).view();
        boolean pending = !view.status().isTerminal();
        return new CompletionResult(
                view.requestId(),
                view.status(),
                pending,
                view.result(),
                view.error(),
                view.completedAtMs(),
                view.durationMs()
        );
    }

    public CancelResult cancel(String requestId, String reason) {
        CompletionJob job = find(requestId);
        String message = reason == null || reason.isBlank() ? "cancelled" : reason;
        CompletionJobView view = job.finish(CompletionStatus.CANCELLED, null, message, clock.millis());
        if (view == null) {
            return new CancelResult(requestId, false, job.status());
        }
        onTerminal(job, view);
        return new CancelResult(requestId, true, CompletionStatus.CANCELLED);
    }

    public boolean complete(String requestId, JsonNode result) {
        return finish(requestId, CompletionStatus.COMPLETED, result, null);
    }

    public boolean fail(String requestId, String error) {
        return finish(requestId, CompletionStatus.FAILED, null, error == null ? "failed" : error);
    }

    public CompletableFuture<CompletionJobView> awaitResult(String requestId) {
        return find(requestId).done().copy();
    }

    public int outstanding() {
        return outstanding.get();
    }

    public int duplicateCompletions() {
        return duplicateCompletions.get();
    }

    public String workerId() {
        return worker.id();
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Completion workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void execute(CompletionJob job) {
        if (!job.start(clock.millis())) {
            return;
        }
        ObjectNode started = Jsons.object();
        started.put("request_id", job.requestId());
        started.put("worker", worker.id());
        emit(EVENT_STARTED, started, job.view().origin());

        CompletionOutput output;
        try {
            output = worker.run(job.view());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            output = CompletionOutput.fail("interrupted");
        } catch (Exception e) {
            log.warn("Completion worker {} failed on {}", worker.id(), job.requestId(), e);
            output = CompletionOutput.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (output == null) {
            output = CompletionOutput.fail("worker returned no output");
        }
        if (output.success()) {
            complete(job.requestId(), output.result());
        } else {
            fail(job.requestId(), output.error());
        }
    }

    private void expire(String requestId) {
        CompletionJob job = jobs.get(requestId);
        if (job == null || job.status().isTerminal()) {
            return;
        }
        CompletionJobView view = job.finish(CompletionStatus.FAILED, null, "timeout", clock.millis());
        if (view != null) {
            log.warn("Completion {} timed out after {}ms", requestId, timeoutMs);
            onTerminal(job, view);
            job.interrupt();
        }
    }

    private boolean finish(String requestId, CompletionStatus terminal, JsonNode result, String error) {
        CompletionJob job = jobs.get(requestId);
        if (job == null) {
            log.warn("Discarding {} for unknown completion {}", terminal.wireName(), requestId);
            return false;
        }
        CompletionJobView view = job.finish(terminal, result, error, clock.millis());
        if (view == null) {
            duplicateCompletions.incrementAndGet();
            log.warn("Discarding duplicate {} for completion {} already {}",
                    terminal.wireName(), requestId, job.status().wireName());
            return false;
        }
        onTerminal(job, view);
        return true;
    }

    private void onTerminal(CompletionJob job, CompletionJobView view) {
        outstanding.decrementAndGet();
        FutureTask<?> task = job.task();
        if (task != null) {
            executor.remove(task);
        }
        terminalOrder.add(job.requestId());
        if (terminalCount.incrementAndGet() > retention) {
            String evicted = terminalOrder.poll();
            if (evicted != null) {
                terminalCount.decrementAndGet();
                jobs.remove(evicted);
            }
        }
        if (view.status() == CompletionStatus.COMPLETED && view.result() != null
                && view.result().path("session_id").isTextual()) {
            sessions.remember(agentId(view.params(), view.origin()), view.result().get("session_id").asText());
        }
        emit(EVENT_RESULT, resultPayload(view), view.origin());
        job.publish(view);
        log.debug("Completion {} finished as {}", view.requestId(), view.status().wireName());
        if (job.sessionId() != null) {
            CompletionJob next = sessions.release(job.sessionId(), job.requestId());
            if (next != null) {
                launchWaiting(next);
            }
        }
    }

    private void admit(CompletionJob job) {
        if (job.sessionId() != null && !sessions.admit(job.sessionId(), job)) {
            return;
        }
        try {
            launch(job);
        } catch (RejectedExecutionException e) {
            if (job.sessionId() != null) {
                CompletionJob next = sessions.release(job.sessionId(), job.requestId());
                if (next != null) {
                    launchWaiting(next);
                }
            }
            throw e;
        }
    }

    private void launch(CompletionJob job) {
        FutureTask<Void> task = new FutureTask<>(() -> execute(job), null);
        job.attach(task);
        executor.execute(task);
    }

    private void launchWaiting(CompletionJob job) {
        try {
            launch(job);
        } catch (RejectedExecutionException e) {
            log.warn("Completion {} of session {} could not be scheduled", job.requestId(), job.sessionId());
            finish(job.requestId(), CompletionStatus.FAILED, null, "completion queue is full");
        }
    }

    private ObjectNode resultPayload(CompletionJobView view) {
        ObjectNode data = Jsons.object();
        data.put("request_id", view.requestId());
        if (view.sessionId() != null) {
            data.put("session_id", view.sessionId());
        }
        data.put("status", view.status().wireName());
        if (view.status() == CompletionStatus.COMPLETED) {
            data.set("result", view.result());
        } else {
            data.put("error", view.error());
        }
        data.put("submitted_at", Instant.ofEpochMilli(view.submittedAtMs()).toString());
        data.put("completed_at", Instant.ofEpochMilli(view.completedAtMs()).toString());
        data.put("duration_ms", view.durationMs());
        return data;
    }

    private void emit(String name, ObjectNode data, String origin) {
        try {
            emitter.emit(name, data, origin);
        } catch (RuntimeException e) {
            log.warn("Failed to emit {}: {}", name, e.getMessage());
        }
    }

    private static String agentId(JsonNode params, String origin) {
        String agentId = optionalText(params, "agent_id");
        return agentId == null ? origin : agentId;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException("field '" + field + "' must be a string");
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private CompletionJob find(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new ValidationException("field 'request_id' is required");
        }
        CompletionJob job = jobs.get(requestId);
        if (job == null) {
            throw new NotFoundException("unknown request_id: " + requestId);
        }
        return job;
    }

    public record SubmitOutcome(
            String requestId,
            CompletionStatus status,
            String sessionId,
            long submittedAtMs
    ) {
    }

    public record CancelResult(
            String requestId,
            boolean cancelled,
            CompletionStatus status
    ) {
    }

    public record StatusSummary(
            int outstanding,
            int maxOutstanding,
            int activeSessions,
            Map<String, Integer> counts,
            List<String> activeRequestIds
    ) {
    }

    public record SessionStatus(
            String sessionId,
            String activeRequestId,
            List<String> waitingRequestIds,
            int queueDepth,
            List<SessionCompletion> completions
    ) {
    }

    public record SessionCompletion(
            String requestId,
            CompletionStatus status,
            long submittedAtMs,
            Long startedAtMs,
            Long completedAtMs
    ) {
    }
}
