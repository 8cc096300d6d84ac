package io.eventrelay.error;

public final class InvalidPatternException extends IllegalArgumentException implements EventRelayError {
    private final String pattern;

    public InvalidPatternException(String pattern, String reason) {
        super("invalid pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_PATTERN;
    }
}
