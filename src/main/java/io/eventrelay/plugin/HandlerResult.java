package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ErrorKind;

public record HandlerResult(
        Kind kind,
        ObjectNode data,
        ErrorKind errorKind,
        String error
) {
    private static final HandlerResult NONE = new HandlerResult(Kind.NONE, null, null, null);

    public enum Kind {
        RESPOND,
        NONE,
        ERROR
    }

    public static HandlerResult respond(ObjectNode data) {
        return new HandlerResult(Kind.RESPOND, data, null, null);
    }

    public static HandlerResult none() {
        return NONE;
    }

    public static HandlerResult error(String message) {
        return new HandlerResult(Kind.ERROR, null, ErrorKind.VALIDATION, message);
    }

    public static HandlerResult error(ErrorKind kind, String message) {
        return new HandlerResult(Kind.ERROR, null, kind, message);
    }

    public boolean contributes() {
        return kind != Kind.NONE;
    }
}
