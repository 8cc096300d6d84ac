package io.eventrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReplayStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }
}
