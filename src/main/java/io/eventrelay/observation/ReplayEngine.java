package io.eventrelay.observation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.error.NotFoundException;
import io.eventrelay.error.TransportException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventLog;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;
import io.eventrelay.model.ReplaySession;
import io.eventrelay.model.ReplayStatus;
import io.eventrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Re-emits historical events on a dedicated scheduler, keeping their relative spacing
 * divided by the replay speed. Each step is scheduled against the session start time,
 * so pacing does not drift with emission cost. Running sessions are tracked until they
 * finish; the most recent finished ones stay queryable.
 */
public final class ReplayEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    public static final String EVENT_STARTED = "observation:replay_started";
    public static final String EVENT_REPLAYED = "observation:replayed_event";
    public static final String EVENT_COMPLETED = "observation:replay_completed";
    public static final int DEFAULT_FINISHED_RETENTION = 32;

    private final EventLog eventLog;
    private final int maxEvents;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Run> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReplaySession> finished;
    private final AtomicInteger sessionCounter = new AtomicInteger();

    public ReplayEngine(EventLog eventLog, int maxEvents) {
        this(eventLog, maxEvents, DEFAULT_FINISHED_RETENTION);
    }

    public ReplayEngine(EventLog eventLog, int maxEvents, int finishedRetention) {
        this.eventLog = eventLog;
        this.maxEvents = Math.max(1, maxEvents);
        int keep = Math.max(1, finishedRetention);
        this.finished = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ReplaySession> eldest) {
                return size() > keep;
            }
        });
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "eventrelay-replay");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = executor;
    }

    public ReplaySession replay(ReplayRequest request, EventSink requester) {
        if (!(request.speed() > 0.0d) || Double.isInfinite(request.speed())) {
            throw new ValidationException("speed must be a positive number");
        }
        if (!request.asNewEvents() && requester == null) {
            throw new ValidationException("replay without as_new_events needs a push-capable connection");
        }
        Set<String> validated = EventPatterns.normalize(request.patterns());
        int limit = Math.min(maxEvents, request.limit() <= 0 ? maxEvents : request.limit());
        List<Event> selected = new ArrayList<>(eventLog.latest(event ->
                        !event.replayed()
                                && (request.target() == null || request.target().equals(event.origin()))
                                && (request.sinceMs() == null || event.timestampMs() >= request.sinceMs())
                                && (request.untilMs() == null || event.timestampMs() <= request.untilMs())
                                && EventPatterns.matchesAny(validated, event.name()),
                limit));
        if (selected.isEmpty()) {
            throw new NotFoundException("no events found to replay");
        }
        selected.sort(Comparator.comparingLong(Event::timestampMs).thenComparingLong(Event::sequenceNo));

        String sessionId = "replay_" + eventLog.clock().millis() + "_" + sessionCounter.incrementAndGet();
        Run run = new Run(sessionId, request, List.copyOf(validated), selected, requester,
                eventLog.clock().millis());
        sessions.put(sessionId, run);

        ObjectNode started = Jsons.object();
        started.put("session_id", sessionId);
        started.put("event_count", selected.size());
        started.put("speed", request.speed());
        started.put("as_new_events", request.asNewEvents());
        started.put("estimated_duration_seconds", run.estimatedDurationSeconds());
        if (request.target() != null) {
            started.put("target", request.target());
        }
        eventLog.append(EVENT_STARTED, started, request.requesterId());
        log.info("Replay {} started: {} events at speed {}", sessionId, selected.size(), request.speed());

        run.startNanos = System.nanoTime();
        run.status = ReplayStatus.RUNNING;
        scheduleStep(run, 0);
        return run.view();
    }

    public ReplaySession status(String sessionId) {
        String id = requireSessionId(sessionId);
        Run run = sessions.get(id);
        if (run != null) {
            return run.view();
        }
        return findFinished(id);
    }

    public List<ReplaySession> list() {
        List<ReplaySession> out = new ArrayList<>();
        for (Run run : sessions.values()) {
            out.add(run.view());
        }
        synchronized (finished) {
            for (ReplaySession session : finished.values()) {
                if (!sessions.containsKey(session.sessionId())) {
                    out.add(session);
                }
            }
        }
        out.sort(Comparator.comparingLong(ReplaySession::startedAtMs).thenComparing(ReplaySession::sessionId));
        return out;
    }

    public ReplaySession cancel(String sessionId) {
        String id = requireSessionId(sessionId);
        Run run = sessions.get(id);
        if (run == null) {
            return findFinished(id);
        }
        synchronized (run) {
            if (run.stopping) {
                return run.view();
            }
            run.stopping = true;
            if (run.next != null) {
                run.next.cancel(false);
            }
        }
        complete(run, ReplayStatus.CANCELLED);
        return run.view();
    }

    public int active() {
        int count = 0;
        for (Run run : sessions.values()) {
            if (!run.status.isFinished()) {
                count++;
            }
        }
        return count;
    }

    /** Sessions held in memory, running or recently finished. */
    public int tracked() {
        return sessions.size() + finished.size();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void scheduleStep(Run run, int index) {
        long dueNanos = run.startNanos + run.offsetNanos(index);
        long delay = Math.max(0L, dueNanos - System.nanoTime());
        synchronized (run) {
            if (run.stopping) {
                return;
            }
            run.next = scheduler.schedule(() -> step(run, index), delay, TimeUnit.NANOSECONDS);
        }
    }

    private void step(Run run, int index) {
        synchronized (run) {
            if (run.stopping) {
                return;
            }
        }
        Event original = run.events.get(index);
        try {
            emit(run, original, index);
            run.emitted.incrementAndGet();
        } catch (TransportException e) {
            log.info("Replay {} lost its requester: {}", run.sessionId, e.getMessage());
            finish(run, ReplayStatus.CANCELLED);
            return;
        } catch (RuntimeException e) {
            log.warn("Replay {} failed on #{}", run.sessionId, original.sequenceNo(), e);
            finish(run, ReplayStatus.CANCELLED);
            return;
        }
        if (index + 1 < run.events.size()) {
            scheduleStep(run, index + 1);
        } else {
            finish(run, ReplayStatus.COMPLETED);
        }
    }

    private void emit(Run run, Event original, int index) throws TransportException {
        if (run.request.asNewEvents()) {
            ObjectNode data = original.data();
            ObjectNode tag = Jsons.object();
            tag.put("session_id", run.sessionId);
            tag.put("original_sequence_no", original.sequenceNo());
            tag.put("original_timestamp", original.timestamp().toString());
            data.set(Event.REPLAY_TAG, tag);
            eventLog.append(original.name(), data, original.origin());
            return;
        }
        ObjectNode data = Jsons.object();
        data.put("session_id", run.sessionId);
        data.put("original_event", original.name());
        data.set("original_data", original.data());
        data.put("original_timestamp", original.timestamp().toString());
        data.put("original_sequence_no", original.sequenceNo());
        data.put("original_origin", original.origin());
        data.put("sequence", index + 1);
        data.put("total", run.events.size());
        ObjectNode frame = Jsons.object();
        frame.put("event", EVENT_REPLAYED);
        frame.put("push", true);
        frame.set("data", data);
        run.requester.send(frame);
    }

    private void finish(Run run, ReplayStatus status) {
        synchronized (run) {
            if (run.stopping) {
                return;
            }
            run.stopping = true;
        }
        complete(run, status);
    }

    private void complete(Run run, ReplayStatus status) {
        ObjectNode completed = Jsons.object();
        completed.put("session_id", run.sessionId);
        completed.put("status", status.wireName());
        completed.put("replayed", run.emitted.get());
        completed.put("total", run.events.size());
        try {
            eventLog.append(EVENT_COMPLETED, completed, run.request.requesterId());
        } catch (IllegalStateException e) {
            log.debug("Replay {} finished after the log closed", run.sessionId);
        }
        run.status = status;
        finished.put(run.sessionId, run.view());
        sessions.remove(run.sessionId);
        log.info("Replay {} {} after {} of {} events", run.sessionId, status.wireName(),
                run.emitted.get(), run.events.size());
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("field 'session_id' is required");
        }
        return sessionId.trim();
    }

    private ReplaySession findFinished(String sessionId) {
        ReplaySession session = finished.get(sessionId);
        if (session == null) {
            throw new NotFoundException("unknown replay session: " + sessionId);
        }
        return session;
    }

    private static final class Run {
        private final String sessionId;
        private final ReplayRequest request;
        private final List<String> patterns;
        private final List<Event> events;
        private final EventSink requester;
        private final long startedAtMs;
        private final AtomicInteger emitted = new AtomicInteger();
        private volatile ReplayStatus status = ReplayStatus.SCHEDULED;
        private volatile long startNanos;
        private boolean stopping;
        private ScheduledFuture<?> next;

        private Run(String sessionId, ReplayRequest request, List<String> patterns, List<Event> events,
                    EventSink requester, long startedAtMs) {
            this.sessionId = sessionId;
            this.request = request;
            this.patterns = patterns;
            this.events = events;
            this.requester = requester;
            this.startedAtMs = startedAtMs;
        }

        private long offsetNanos(int index) {
            long gapMs = events.get(index).timestampMs() - events.get(0).timestampMs();
            return (long) (gapMs * 1_000_000.0d / request.speed());
        }

        private double estimatedDurationSeconds() {
            long spanMs = events.get(events.size() - 1).timestampMs() - events.get(0).timestampMs();
            return spanMs / 1000.0d / request.speed();
        }

        private ReplaySession view() {
            return new ReplaySession(
                    sessionId,
                    patterns,
                    request.target(),
                    request.speed(),
                    request.asNewEvents(),
                    status,
                    events.size(),
                    emitted.get(),
                    estimatedDurationSeconds(),
                    startedAtMs
            );
        }
    }
}
