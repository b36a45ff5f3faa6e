package org.specrun.result;

import java.util.Optional;

/**
 * Thrown by example code to fail with a reason or with an expected/actual pair for diffing.
 */
public class ExampleFailedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public ExampleFailedException(String message) {
        super(message);
        this.expected = null;
        this.actual = null;
    }

    public ExampleFailedException(String message, String expected, String actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public static ExampleFailedException mismatch(Object expected, Object actual) {
        return new ExampleFailedException(null, String.valueOf(expected), String.valueOf(actual));
    }

    public Optional<String> expected() {
        return Optional.ofNullable(expected);
    }

    public Optional<String> actual() {
        return Optional.ofNullable(actual);
    }

    public FailureReason toReason() {
        if (expected != null && actual != null) {
            return FailureReason.mismatch(getMessage(), expected, actual);
        }
        String message = getMessage();
        return FailureReason.reason(message == null || message.isBlank() ? "example failed" : message);
    }
}
