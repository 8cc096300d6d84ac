package io.eventrelay.completion;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.config.DaemonSettings;
import io.eventrelay.error.NotFoundException;
import io.eventrelay.error.QueueFullException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventLog;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.model.CompletionStatus;
import io.eventrelay.model.Event;
import io.eventrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class CompletionRegistryTest {
    @Test
    void completesJobAndAnnouncesEachStep() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(new EchoCompletionWorker(), log,
                     DaemonSettings.defaults(), Clock.systemUTC())) {
            CompletionRegistry.SubmitOutcome submitted = registry.submit(prompt("hello"), "agent-1");
            Assertions.assertEquals(CompletionStatus.QUEUED, submitted.status());
            Assertions.assertTrue(submitted.requestId().startsWith("req_"));

            CompletionJobView done = registry.awaitResult(submitted.requestId()).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(CompletionStatus.COMPLETED, done.status());
            Assertions.assertEquals("hello", done.result().get("response").asText());
            Assertions.assertNotNull(done.startedAtMs());
            Assertions.assertNotNull(done.durationMs());

            CompletionResult result = registry.result(submitted.requestId());
            Assertions.assertFalse(result.pending());
            Assertions.assertEquals("hello", result.result().get("response").asText());

            List<Event> events = log.query(List.of("completion:*"), 0L, 10);
            Assertions.assertEquals(List.of("completion:queued", "completion:started", "completion:result"),
                    events.stream().map(Event::name).toList());
            for (Event event : events) {
                Assertions.assertEquals(submitted.requestId(), event.dataText("request_id"));
                Assertions.assertEquals("agent-1", event.origin());
            }
            Event resultEvent = events.get(2);
            Assertions.assertEquals("completed", resultEvent.dataText("status"));
            Assertions.assertEquals("hello", resultEvent.data().path("result").path("response").asText());
            Assertions.assertEquals(0, registry.outstanding());
        }
    }

    @Test
    void requestIdsAreDistinct() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(new EchoCompletionWorker(), log,
                     DaemonSettings.defaults(), Clock.systemUTC())) {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 50; i++) {
                ids.add(registry.submit(prompt("p" + i), null).requestId());
            }
            Assertions.assertEquals(50, ids.size());
            for (String id : ids) {
                Assertions.assertEquals(CompletionStatus.COMPLETED,
                        registry.awaitResult(id).get(5, TimeUnit.SECONDS).status());
            }
        }
    }

    @Test
    void rejectsInvalidRequests() {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 100);
             CompletionRegistry registry = new CompletionRegistry(new EchoCompletionWorker(), log,
                     DaemonSettings.defaults(), Clock.systemUTC())) {
            Assertions.assertThrows(ValidationException.class, () -> registry.submit(Jsons.object(), null));
            Assertions.assertThrows(ValidationException.class,
                    () -> registry.submit(Jsons.object().put("prompt", 5), null));
            Assertions.assertThrows(ValidationException.class, () -> registry.submit(null, null));
            Assertions.assertThrows(ValidationException.class, () -> registry.status(" "));
            Assertions.assertThrows(NotFoundException.class, () -> registry.status("req_missing"));
            Assertions.assertThrows(NotFoundException.class, () -> registry.cancel("req_missing", null));
            Assertions.assertEquals(0, registry.outstanding());
        }
    }

    @Test
    void statusFollowsQueuedThenInProgress() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 10, 0L, 100),
                     Clock.systemUTC())) {
            String first = registry.submit(prompt("first"), null).requestId();
            Assertions.assertEquals(first, worker.started.poll(5, TimeUnit.SECONDS));
            String second = registry.submit(prompt("second"), null).requestId();

            CompletionJobView running = registry.status(first);
            Assertions.assertEquals(CompletionStatus.IN_PROGRESS, running.status());
            Assertions.assertNotNull(running.startedAtMs());
            Assertions.assertNull(running.completedAtMs());
            Assertions.assertEquals(CompletionStatus.QUEUED, registry.status(second).status());
            Assertions.assertTrue(registry.result(second).pending());

            CompletionRegistry.StatusSummary summary = registry.statusSummary();
            Assertions.assertEquals(2, summary.outstanding());
            Assertions.assertEquals(1, summary.counts().get("in_progress"));
            Assertions.assertEquals(1, summary.counts().get("queued"));
            Assertions.assertEquals(Set.of(first, second), new HashSet<>(summary.activeRequestIds()));

            worker.release.countDown();
            Assertions.assertEquals(CompletionStatus.COMPLETED,
                    registry.awaitResult(first).get(5, TimeUnit.SECONDS).status());
            Assertions.assertEquals(CompletionStatus.COMPLETED,
                    registry.awaitResult(second).get(5, TimeUnit.SECONDS).status());
            Assertions.assertTrue(registry.statusSummary().activeRequestIds().isEmpty());
        }
    }

    @Test
    void refusesWorkBeyondOutstandingLimit() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(2, 2, 0L, 100),
                     Clock.systemUTC())) {
            String a = registry.submit(prompt("a"), null).requestId();
            String b = registry.submit(prompt("b"), null).requestId();
            QueueFullException full = Assertions.assertThrows(QueueFullException.class,
                    () -> registry.submit(prompt("c"), null));
            Assertions.assertEquals(2, full.limit());
            Assertions.assertEquals(2, registry.outstanding());

            worker.release.countDown();
            registry.awaitResult(a).get(5, TimeUnit.SECONDS);
            registry.awaitResult(b).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(0, registry.outstanding());
            String c = registry.submit(prompt("c"), null).requestId();
            Assertions.assertEquals(CompletionStatus.COMPLETED,
                    registry.awaitResult(c).get(5, TimeUnit.SECONDS).status());
        }
    }

    @Test
    void cancellingQueuedJobSkipsWorker() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 10, 0L, 100),
                     Clock.systemUTC())) {
            String running = registry.submit(prompt("running"), null).requestId();
            Assertions.assertEquals(running, worker.started.poll(5, TimeUnit.SECONDS));
            String queued = registry.submit(prompt("queued"), null).requestId();

            CompletionRegistry.CancelResult cancel = registry.cancel(queued, "user");
            Assertions.assertTrue(cancel.cancelled());
            Assertions.assertEquals(CompletionStatus.CANCELLED, cancel.status());
            CompletionJobView view = registry.awaitResult(queued).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(CompletionStatus.CANCELLED, view.status());
            Assertions.assertEquals("user", view.error());

            worker.release.countDown();
            registry.awaitResult(running).get(5, TimeUnit.SECONDS);
            Assertions.assertNull(worker.started.poll(200, TimeUnit.MILLISECONDS));
            Assertions.assertEquals(CompletionStatus.CANCELLED, registry.status(queued).status());
        }
    }

    @Test
    void cancelledQueuedJobsFreeTheirQueueSlots() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 20, 3, 0L, 100),
                     Clock.systemUTC())) {
            String blocker = registry.submit(prompt("blocker"), null).requestId();
            Assertions.assertEquals(blocker, worker.started.poll(5, TimeUnit.SECONDS));
            for (int i = 0; i < 3; i++) {
                String id = registry.submit(prompt("doomed-" + i), null).requestId();
                Assertions.assertTrue(registry.cancel(id, null).cancelled());
            }
            Assertions.assertEquals(1, registry.outstanding());

            List<String> admitted = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                admitted.add(registry.submit(prompt("after-" + i), null).requestId());
            }
            Assertions.assertEquals(4, registry.outstanding());

            worker.release.countDown();
            for (String id : admitted) {
                Assertions.assertEquals(CompletionStatus.COMPLETED,
                        registry.awaitResult(id).get(5, TimeUnit.SECONDS).status());
            }
        }
    }

    @Test
    void rejectedSubmissionIsNeverAnnounced() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 10, 1, 0L, 100),
                     Clock.systemUTC())) {
            String running = registry.submit(prompt("running"), null).requestId();
            Assertions.assertEquals(running, worker.started.poll(5, TimeUnit.SECONDS));
            String waiting = registry.submit(prompt("waiting"), null).requestId();

            Assertions.assertThrows(QueueFullException.class, () -> registry.submit(prompt("rejected"), null));
            Assertions.assertEquals(2, registry.outstanding());
            List<String> announced = log.query(List.of("completion:queued"), 0L, 10).stream()
                    .map(event -> event.dataText("request_id"))
                    .toList();
            Assertions.assertEquals(List.of(running, waiting), announced);
            worker.release.countDown();
        }
    }

    @Test
    void jobsOfOneSessionRunOneAtATime() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(4, 10, 0L, 100),
                     Clock.systemUTC())) {
            String firstOfA = registry.submit(prompt("a1").put("session_id", "sess-a"), null).requestId();
            String secondOfA = registry.submit(prompt("a2").put("session_id", "sess-a"), null).requestId();
            String onlyOfB = registry.submit(prompt("b1").put("session_id", "sess-b"), null).requestId();

            Set<String> startedNow = new HashSet<>();
            startedNow.add(worker.started.poll(5, TimeUnit.SECONDS));
            startedNow.add(worker.started.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals(Set.of(firstOfA, onlyOfB), startedNow);
            Assertions.assertNull(worker.started.poll(200, TimeUnit.MILLISECONDS));
            Assertions.assertEquals(CompletionStatus.QUEUED, registry.status(secondOfA).status());

            CompletionRegistry.SessionStatus lane = registry.sessionStatus("sess-a", null);
            Assertions.assertEquals(firstOfA, lane.activeRequestId());
            Assertions.assertEquals(List.of(secondOfA), lane.waitingRequestIds());
            Assertions.assertEquals(1, lane.queueDepth());
            Assertions.assertEquals(List.of(firstOfA, secondOfA),
                    lane.completions().stream().map(CompletionRegistry.SessionCompletion::requestId).toList());
            Assertions.assertEquals(2, registry.statusSummary().activeSessions());

            worker.release.countDown();
            CompletionJobView first = registry.awaitResult(firstOfA).get(5, TimeUnit.SECONDS);
            CompletionJobView second = registry.awaitResult(secondOfA).get(5, TimeUnit.SECONDS);
            registry.awaitResult(onlyOfB).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(secondOfA, worker.started.poll(5, TimeUnit.SECONDS));
            Assertions.assertTrue(second.startedAtMs() >= first.completedAtMs());
            Assertions.assertEquals("sess-a", second.sessionId());
            Assertions.assertTrue(waitFor(() -> registry.statusSummary().activeSessions() == 0, Duration.ofSeconds(5)));
            Assertions.assertNull(registry.sessionStatus("sess-a", null).activeRequestId());
        }
    }

    @Test
    void cancellingWaitingSessionJobLeavesLaneIntact() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(2, 10, 0L, 100),
                     Clock.systemUTC())) {
            String first = registry.submit(prompt("1").put("session_id", "sess"), null).requestId();
            String second = registry.submit(prompt("2").put("session_id", "sess"), null).requestId();
            String third = registry.submit(prompt("3").put("session_id", "sess"), null).requestId();
            Assertions.assertEquals(first, worker.started.poll(5, TimeUnit.SECONDS));

            Assertions.assertTrue(registry.cancel(second, null).cancelled());
            Assertions.assertEquals(List.of(third), registry.sessionStatus("sess", null).waitingRequestIds());

            worker.release.countDown();
            Assertions.assertEquals(CompletionStatus.COMPLETED,
                    registry.awaitResult(third).get(5, TimeUnit.SECONDS).status());
            Assertions.assertEquals(third, worker.started.poll(5, TimeUnit.SECONDS));
            Assertions.assertNull(worker.started.poll(100, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void agentsContinueTheirLastSession() throws Exception {
        CompletionWorker sessionIssuing = new CompletionWorker() {
            @Override
            public String id() {
                return "session-issuing";
            }

            @Override
            public CompletionOutput run(CompletionJobView job) {
                String session = job.sessionId() == null ? "sess-issued" : job.sessionId();
                return CompletionOutput.ok(Jsons.object().put("session_id", session));
            }
        };
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(sessionIssuing, log, DaemonSettings.defaults(),
                     Clock.systemUTC())) {
            CompletionRegistry.SubmitOutcome fresh = registry.submit(prompt("hi").put("agent_id", "agent-2"), null);
            Assertions.assertNull(fresh.sessionId());
            registry.awaitResult(fresh.requestId()).get(5, TimeUnit.SECONDS);

            CompletionRegistry.SubmitOutcome followUp = registry.submit(prompt("again").put("agent_id", "agent-2"), null);
            Assertions.assertEquals("sess-issued", followUp.sessionId());
            registry.awaitResult(followUp.requestId()).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals("sess-issued", registry.sessionStatus(null, "agent-2").sessionId());

            CompletionRegistry.SubmitOutcome explicit = registry.submit(prompt("x").put("session_id", "sess-other"),
                    "agent-3");
            Assertions.assertEquals("sess-other", explicit.sessionId());
            Assertions.assertEquals("sess-other", registry.submit(prompt("y"), "agent-3").sessionId());

            Assertions.assertThrows(ValidationException.class, () -> registry.sessionStatus(null, null));
            Assertions.assertThrows(NotFoundException.class, () -> registry.sessionStatus(null, "agent-unknown"));
            Assertions.assertThrows(ValidationException.class,
                    () -> registry.submit(prompt("z").put("session_id", 7), null));
        }
    }

    @Test
    void cancellingFinishedJobIsNoop() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(new EchoCompletionWorker(), log,
                     DaemonSettings.defaults(), Clock.systemUTC())) {
            String id = registry.submit(prompt("done"), null).requestId();
            registry.awaitResult(id).get(5, TimeUnit.SECONDS);
            CompletionRegistry.CancelResult cancel = registry.cancel(id, null);
            Assertions.assertFalse(cancel.cancelled());
            Assertions.assertEquals(CompletionStatus.COMPLETED, cancel.status());
            Assertions.assertEquals(1, countResults(log, id));
        }
    }

    @Test
    void cancellingRunningJobInterruptsWorker() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 10, 0L, 100),
                     Clock.systemUTC())) {
            String id = registry.submit(prompt("slow"), null).requestId();
            Assertions.assertEquals(id, worker.started.poll(5, TimeUnit.SECONDS));

            Assertions.assertTrue(registry.cancel(id, null).cancelled());
            CompletionJobView view = registry.awaitResult(id).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(CompletionStatus.CANCELLED, view.status());
            Assertions.assertEquals("cancelled", view.error());

            Assertions.assertTrue(waitFor(() -> registry.duplicateCompletions() == 1, Duration.ofSeconds(5)));
            Assertions.assertEquals(1, worker.interrupted.get());
            Assertions.assertEquals(CompletionStatus.CANCELLED, registry.status(id).status());
            Assertions.assertEquals(1, countResults(log, id));
        }
    }

    @Test
    void racingCancelAndCompleteLeaveOneOutcome() throws Exception {
        GatedWorker worker = new GatedWorker();
        ExecutorService racers = Executors.newFixedThreadPool(2);
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 10_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 500, 0L, 1_000),
                     Clock.systemUTC())) {
            registry.submit(prompt("blocker"), null);
            Assertions.assertNotNull(worker.started.poll(5, TimeUnit.SECONDS));

            for (int i = 0; i < 100; i++) {
                String id = registry.submit(prompt("job-" + i), null).requestId();
                CountDownLatch go = new CountDownLatch(1);
                Future<Boolean> completer = racers.submit(() -> {
                    go.await();
                    return registry.complete(id, Jsons.object().put("n", 1));
                });
                Future<Boolean> canceller = racers.submit(() -> {
                    go.await();
                    return registry.cancel(id, "race").cancelled();
                });
                go.countDown();
                boolean completed = completer.get(5, TimeUnit.SECONDS);
                boolean cancelled = canceller.get(5, TimeUnit.SECONDS);
                Assertions.assertTrue(completed ^ cancelled, "exactly one transition wins for " + id);
                CompletionStatus expected = completed ? CompletionStatus.COMPLETED : CompletionStatus.CANCELLED;
                Assertions.assertEquals(expected, registry.status(id).status());
            }

            Map<String, Integer> perRequest = new HashMap<>();
            for (Event event : log.query(List.of("completion:result"), 0L, 10_000)) {
                perRequest.merge(event.dataText("request_id"), 1, Integer::sum);
            }
            Assertions.assertEquals(100, perRequest.size());
            Assertions.assertTrue(perRequest.values().stream().allMatch(count -> count == 1));
            worker.release.countDown();
        } finally {
            racers.shutdownNow();
        }
    }

    @Test
    void watchdogFailsJobsThatRunTooLong() throws Exception {
        GatedWorker worker = new GatedWorker();
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(worker, log, settings(1, 10, 150L, 100),
                     Clock.systemUTC())) {
            String id = registry.submit(prompt("stuck"), "agent-9").requestId();
            CompletionJobView view = registry.awaitResult(id).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(CompletionStatus.FAILED, view.status());
            Assertions.assertEquals("timeout", view.error());
            Assertions.assertTrue(waitFor(() -> worker.interrupted.get() == 1, Duration.ofSeconds(5)));

            List<Event> results = log.query(List.of("completion:result"), 0L, 10);
            Assertions.assertEquals(1, results.size());
            Assertions.assertEquals("failed", results.get(0).dataText("status"));
            Assertions.assertEquals("timeout", results.get(0).dataText("error"));
            Assertions.assertEquals("agent-9", results.get(0).origin());
        }
    }

    @Test
    void workerFailureBecomesFailedJob() throws Exception {
        CompletionWorker broken = new CompletionWorker() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public CompletionOutput run(CompletionJobView job) {
                throw new IllegalStateException("model unavailable");
            }
        };
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(broken, log, DaemonSettings.defaults(),
                     Clock.systemUTC())) {
            String id = registry.submit(prompt("x"), null).requestId();
            CompletionJobView view = registry.awaitResult(id).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(CompletionStatus.FAILED, view.status());
            Assertions.assertEquals("model unavailable", view.error());
        }
    }

    @Test
    void finishedJobsAreEvictedBeyondRetention() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 1_000);
             CompletionRegistry registry = new CompletionRegistry(new EchoCompletionWorker(), log,
                     settings(1, 10, 0L, 2), Clock.systemUTC())) {
            String first = registry.submit(prompt("1"), null).requestId();
            registry.awaitResult(first).get(5, TimeUnit.SECONDS);
            String second = registry.submit(prompt("2"), null).requestId();
            registry.awaitResult(second).get(5, TimeUnit.SECONDS);
            String third = registry.submit(prompt("3"), null).requestId();
            registry.awaitResult(third).get(5, TimeUnit.SECONDS);

            Assertions.assertThrows(NotFoundException.class, () -> registry.status(first));
            Assertions.assertEquals(CompletionStatus.COMPLETED, registry.status(second).status());
            Assertions.assertEquals(CompletionStatus.COMPLETED, registry.status(third).status());
        }
    }

    private static ObjectNode prompt(String text) {
        return Jsons.object().put("prompt", text);
    }

    private static DaemonSettings settings(int threads, int maxOutstanding, long timeoutMs, int retention) {
        return settings(threads, maxOutstanding, DaemonSettings.defaults().completionQueueCapacity(), timeoutMs,
                retention);
    }

    private static DaemonSettings settings(int threads, int maxOutstanding, int queueCapacity, long timeoutMs,
                                           int retention) {
        DaemonSettings defaults = DaemonSettings.defaults();
        return new DaemonSettings(
                maxOutstanding,
                threads,
                queueCapacity,
                timeoutMs,
                retention,
                defaults.eventRetention(),
                defaults.journalRetryBudget(),
                defaults.journalRetryBackoffMs(),
                defaults.replayMaxEvents(),
                List.of(),
                defaults.completionCommandTimeoutMs(),
                defaults.requestThreads()
        );
    }

    private static int countResults(EventLog log, String requestId) {
        int count = 0;
        for (Event event : log.query(List.of("completion:result"), 0L, 1_000)) {
            if (requestId.equals(event.dataText("request_id"))) {
                count++;
            }
        }
        return count;
    }

    private static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10L);
        }
        return condition.getAsBoolean();
    }

    private static final class GatedWorker implements CompletionWorker {
        private final CountDownLatch release = new CountDownLatch(1);
        private final BlockingQueue<String> started = new LinkedBlockingQueue<>();
        private final AtomicInteger interrupted = new AtomicInteger();

        @Override
        public String id() {
            return "gated";
        }

        @Override
        public CompletionOutput run(CompletionJobView job) throws InterruptedException {
            started.add(job.requestId());
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                throw e;
            }
            return CompletionOutput.ok(Jsons.object().put("prompt", job.params().path("prompt").asText()));
        }
    }
}
