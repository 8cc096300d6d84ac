package io.eventrelay.log;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Append-only, sequence-numbered event log with a bounded in-memory window.
 * <p>
 * Sequence assignment happens under {@code writeLock}. Listener fan-out and journal
 * writes are handed to two single-threaded executors from inside the same lock, so both
 * observe events in sequence order without holding the lock while they work.
 */
public final class EventLog implements EventEmitter, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final EventJournal journal;
    private final Clock clock;
    private final int retention;
    private final int retryBudget;
    private final long retryBackoffMs;
    private final Object writeLock = new Object();
    private final ConcurrentSkipListMap<Long, Event> window = new ConcurrentSkipListMap<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService fanout;
    private final ExecutorService journalWriter;
    private final AtomicLong journalWritten = new AtomicLong();
    private final AtomicLong journalFailures = new AtomicLong();
    private final AtomicLong journalDropped = new AtomicLong();
    private final AtomicLong unrecordedHighWater = new AtomicLong();
    private volatile boolean journalDegraded;
    private volatile String journalLastError;
    private long lastSequence;
    private int windowSize;
    private boolean closed;

    public EventLog(EventJournal journal, Clock clock, int retention, int retryBudget, long retryBackoffMs) {
        this.journal = journal == null ? EventJournal.NONE : journal;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.retention = Math.max(1, retention);
        this.retryBudget = Math.max(0, retryBudget);
        this.retryBackoffMs = Math.max(0L, retryBackoffMs);
        this.fanout = Executors.newSingleThreadExecutor(r -> daemonThread(r, "eventrelay-fanout"));
        this.journalWriter = Executors.newSingleThreadExecutor(r -> daemonThread(r, "eventrelay-journal"));
    }

    public static EventLog inMemory(Clock clock, int retention) {
        return new EventLog(EventJournal.NONE, clock, retention, 0, 0L);
    }

    /** Seeds the window and the sequence counter from the journal. */
    public void recover() {
        long journalLast = journal.lastSequence();
        List<Event> recent = journal.loadRecent(retention);
        synchronized (writeLock) {
            for (Event event : recent) {
                window.put(event.sequenceNo(), event);
            }
            windowSize = window.size();
            lastSequence = Math.max(lastSequence, journalLast);
        }
        if (journalLast > 0L) {
            log.info("Recovered event log: lastSequence={}, window={}", journalLast, recent.size());
        }
    }

    public void addListener(EventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(EventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Event emit(String name, ObjectNode data, String origin) {
        return append(name, data, origin);
    }

    public Event append(String name, ObjectNode data, String origin) {
        String validName = EventPatterns.validateEventName(name);
        synchronized (writeLock) {
            if (closed) {
                throw new IllegalStateException("event log is closed");
            }
            Event event = new Event(++lastSequence, validName, data, clock.instant(), origin);
            window.put(event.sequenceNo(), event);
            windowSize++;
            while (windowSize > retention) {
                window.pollFirstEntry();
                windowSize--;
            }
            journalWriter.execute(() -> persist(event));
            fanout.execute(() -> deliver(event));
            return event;
        }
    }

    public List<Event> query(Collection<String> patterns, long since, int limit) {
        Set<String> validPatterns = EventPatterns.normalize(patterns);
        return scan(since, event -> EventPatterns.matchesAny(validPatterns, event.name()), limit);
    }

    /** Matching events after the {@code since} cursor, oldest first. */
    public List<Event> scan(long since, Predicate<Event> filter, int limit) {
        int safeLimit = Math.max(0, limit);
        List<Event> out = new ArrayList<>();
        if (safeLimit == 0) {
            return out;
        }
        for (Event event : window.tailMap(since, false).values()) {
            if (filter == null || filter.test(event)) {
                out.add(event);
                if (out.size() >= safeLimit) {
                    break;
                }
            }
        }
        return out;
    }

    /** The {@code limit} most recent matching events, oldest first. */
    public List<Event> latest(Predicate<Event> filter, int limit) {
        int safeLimit = Math.max(0, limit);
        List<Event> out = new ArrayList<>();
        if (safeLimit == 0) {
            return out;
        }
        for (Event event : window.descendingMap().values()) {
            if (filter == null || filter.test(event)) {
                out.add(event);
                if (out.size() >= safeLimit) {
                    break;
                }
            }
        }
        Collections.reverse(out);
        return out;
    }

    public Event get(long sequenceNo) {
        return window.get(sequenceNo);
    }

    public long lastSequence() {
        synchronized (writeLock) {
            return lastSequence;
        }
    }

    public long firstRetainedSequence() {
        Map.Entry<Long, Event> first = window.firstEntry();
        return first == null ? 0L : first.getKey();
    }

    public int size() {
        return window.size();
    }

    public Map<String, Long> countsByNamespace() {
        Map<String, Long> counts = new TreeMap<>();
        for (Event event : window.values()) {
            counts.merge(event.namespace(), 1L, Long::sum);
        }
        return counts;
    }

    public JournalHealth journalHealth() {
        return new JournalHealth(
                journalDegraded,
                journalWritten.get(),
                journalFailures.get(),
                journalDropped.get(),
                journalLastError
        );
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Waits until every event appended before this call has been handed to listeners
     * and to the journal.
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        synchronized (writeLock) {
            if (closed) {
                return true;
            }
            fanout.execute(latch::countDown);
            journalWriter.execute(latch::countDown);
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        fanout.shutdown();
        journalWriter.shutdown();
        try {
            if (!fanout.awaitTermination(5, TimeUnit.SECONDS)) {
                fanout.shutdownNow();
            }
            if (!journalWriter.awaitTermination(5, TimeUnit.SECONDS)) {
                journalWriter.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fanout.shutdownNow();
            journalWriter.shutdownNow();
        }
        long pending = unrecordedHighWater.get();
        if (pending > 0L) {
            try {
                journal.recordHighWater(pending);
                unrecordedHighWater.set(0L);
            } catch (RuntimeException e) {
                log.warn("Sequence numbers up to #{} were never journaled; a restart may hand them out again",
                        pending, e);
            }
        }
    }

    private void deliver(Event event) {
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed on {} #{}", listener.getClass().getSimpleName(),
                        event.name(), event.sequenceNo(), e);
            }
        }
    }

    private void persist(Event event) {
        if (journalDegraded) {
            drop(event);
            return;
        }
        int attempt = 0;
        while (true) {
            try {
                journal.append(event);
                journalWritten.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                journalFailures.incrementAndGet();
                journalLastError = e.getMessage();
                if (attempt >= retryBudget) {
                    journalDegraded = true;
                    log.error("Event journal failed {} times on #{}, journal writes disabled",
                            attempt + 1, event.sequenceNo(), e);
                    drop(event);
                    return;
                }
                attempt++;
                log.warn("Event journal write failed for #{} (attempt {}/{}): {}",
                        event.sequenceNo(), attempt, retryBudget, e.getMessage());
                if (!sleepBackoff(attempt)) {
                    drop(event);
                    return;
                }
            }
        }
    }

    /**
     * Counts an event the journal never got and tries to keep at least its sequence
     * number durable, so a restart does not reuse cursors clients already hold.
     */
    private void drop(Event event) {
        journalDropped.incrementAndGet();
        try {
            journal.recordHighWater(event.sequenceNo());
            unrecordedHighWater.set(0L);
        } catch (RuntimeException e) {
            unrecordedHighWater.accumulateAndGet(event.sequenceNo(), Math::max);
            log.debug("High-water mark #{} not recorded: {}", event.sequenceNo(), e.getMessage());
        }
    }

    private boolean sleepBackoff(int attempt) {
        if (retryBackoffMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(retryBackoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Thread daemonThread(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
