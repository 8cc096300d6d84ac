package io.eventrelay.error;

public enum ErrorKind {
    VALIDATION("validation_error"),
    NOT_FOUND("not_found"),
    QUEUE_FULL("queue_full"),
    INVALID_PATTERN("invalid_pattern"),
    HANDLER_FAILURE("handler_failure"),
    TRANSPORT("transport_error"),
    INTERNAL("internal_error");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
