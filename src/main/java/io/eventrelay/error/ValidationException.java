package io.eventrelay.error;

public class ValidationException extends IllegalArgumentException implements EventRelayError {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
