package io.eventrelay.error;

public final class TransportException extends Exception implements EventRelayError {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSPORT;
    }
}
