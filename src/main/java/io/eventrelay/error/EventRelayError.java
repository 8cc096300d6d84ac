package io.eventrelay.error;

/**
 * Common view over every failure the daemon reports to a client.
 * The kind becomes {@code error.type} on the wire.
 */
public interface EventRelayError {
    ErrorKind kind();

    String getMessage();
}
