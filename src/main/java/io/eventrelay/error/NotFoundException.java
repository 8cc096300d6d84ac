package io.eventrelay.error;

public final class NotFoundException extends RuntimeException implements EventRelayError {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
