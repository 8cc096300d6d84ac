package io.eventrelay.error;

public final class HandlerFailureException extends RuntimeException implements EventRelayError {
    public HandlerFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.HANDLER_FAILURE;
    }
}
