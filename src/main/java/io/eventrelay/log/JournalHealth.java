package io.eventrelay.log;

public record JournalHealth(
        boolean degraded,
        long written,
        long failures,
        long dropped,
        String lastError
) {
}
