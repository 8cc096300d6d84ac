package io.eventrelay.log;

import io.eventrelay.model.Event;

import java.util.List;

/**
 * Durable backing store for the event log. Implementations may throw unchecked
 * exceptions from {@link #append}; the log retries and eventually stops writing.
 * {@link #lastSequence} covers both journaled events and recorded high-water marks.
 */
public interface EventJournal {
    EventJournal NONE = new EventJournal() {
        @Override
        public void append(Event event) {
        }

        @Override
        public List<Event> loadRecent(int limit) {
            return List.of();
        }

        @Override
        public long lastSequence() {
            return 0L;
        }
    };

    void append(Event event);

    List<Event> loadRecent(int limit);

    long lastSequence();

    /** Remembers that sequence numbers up to {@code sequenceNo} were handed out but not journaled. */
    default void recordHighWater(long sequenceNo) {
    }
}
