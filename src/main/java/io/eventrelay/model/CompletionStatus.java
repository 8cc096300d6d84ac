package io.eventrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CompletionStatus {
    QUEUED("queued"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    CompletionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canAdvanceTo(CompletionStatus next) {
        return switch (this) {
            case QUEUED -> next != QUEUED;
            case IN_PROGRESS -> next.isTerminal();
            default -> false;
        };
    }
}
