package io.eventrelay.error;

public final class QueueFullException extends IllegalStateException implements EventRelayError {
    private final int limit;

    public QueueFullException(int limit) {
        super("completion queue is full (limit " + limit + ")");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.QUEUE_FULL;
    }
}
