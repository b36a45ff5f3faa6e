package org.specrun.result;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Why an example failed.
 */
public final class FailureReason {
    private final FailureKind kind;
    private final String message;
    private final String expected;
    private final String actual;
    private final Throwable fault;
    private final Duration timeout;

    private FailureReason(
        FailureKind kind,
        String message,
        String expected,
        String actual,
        Throwable fault,
        Duration timeout
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = normalize(message);
        this.expected = expected;
        this.actual = actual;
        this.fault = fault;
        this.timeout = timeout;
    }

    public static FailureReason reason(String message) {
        if (normalize(message) == null) {
            throw new IllegalArgumentException("message must not be blank");
        }
        return new FailureReason(FailureKind.REASON, message, null, null, null, null);
    }

    public static FailureReason mismatch(String preface, String expected, String actual) {
        return new FailureReason(
            FailureKind.EXPECTED_ACTUAL_MISMATCH,
            preface,
            Objects.requireNonNull(expected, "expected"),
            Objects.requireNonNull(actual, "actual"),
            null,
            null
        );
    }

    public static FailureReason fault(Throwable fault) {
        return new FailureReason(FailureKind.FAULT, null, null, null, Objects.requireNonNull(fault, "fault"), null);
    }

    public static FailureReason timeoutExceeded(Duration timeout) {
        return new FailureReason(
            FailureKind.TIMEOUT_EXCEEDED,
            null,
            null,
            null,
            null,
            Objects.requireNonNull(timeout, "timeout")
        );
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * Free-text reason, or the optional preface of a mismatch.
     */
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public Optional<String> expected() {
        return Optional.ofNullable(expected);
    }

    public Optional<String> actual() {
        return Optional.ofNullable(actual);
    }

    public Optional<Throwable> fault() {
        return Optional.ofNullable(fault);
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * One-line rendering used for failure reports and logs.
     */
    public String describe() {
        return switch (kind) {
            case REASON -> message;
            case EXPECTED_ACTUAL_MISMATCH -> (message == null ? "" : message + ": ")
                + "expected " + expected + " but got " + actual;
            case FAULT -> describeFault(fault);
            case TIMEOUT_EXCEEDED -> "timeout exceeded after " + timeout.toMillis() + "ms";
        };
    }

    public static String describeFault(Throwable fault) {
        String detail = fault.getMessage();
        if (detail == null || detail.isBlank()) {
            return fault.getClass().getName();
        }
        return fault.getClass().getName() + ": " + detail;
    }

    @Override
    public String toString() {
        return "FailureReason{" + kind + ": " + describe() + "}";
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
