package org.specrun.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one example.
 */
public final class Result {
    private static final Result SUCCESS = new Result(ResultStatus.SUCCESS, null, null, null, List.of());

    private final ResultStatus status;
    private final String pendingReason;
    private final FailureReason failureReason;
    private final SourceLocation location;
    private final List<Throwable> secondaryFaults;

    private Result(
        ResultStatus status,
        String pendingReason,
        FailureReason failureReason,
        SourceLocation location,
        List<Throwable> secondaryFaults
    ) {
        this.status = Objects.requireNonNull(status, "status");
        this.pendingReason = normalize(pendingReason);
        this.failureReason = failureReason;
        this.location = location;
        this.secondaryFaults = List.copyOf(Objects.requireNonNull(secondaryFaults, "secondaryFaults"));
        if (status == ResultStatus.FAILURE && failureReason == null) {
            throw new IllegalArgumentException("failureReason is required for failures");
        }
    }

    public static Result success() {
        return SUCCESS;
    }

    public static Result pending() {
        return new Result(ResultStatus.PENDING, null, null, null, List.of());
    }

    public static Result pending(String reason) {
        return new Result(ResultStatus.PENDING, reason, null, null, List.of());
    }

    public static Result failure(FailureReason reason) {
        return new Result(ResultStatus.FAILURE, null, Objects.requireNonNull(reason, "reason"), null, List.of());
    }

    public static Result failure(FailureReason reason, SourceLocation location) {
        return new Result(ResultStatus.FAILURE, null, Objects.requireNonNull(reason, "reason"), location, List.of());
    }

    public static Result failure(String message) {
        return failure(FailureReason.reason(message));
    }

    /**
     * Maps a throwable raised by example code onto a result.
     */
    public static Result fromThrowable(Throwable thrown) {
        Objects.requireNonNull(thrown, "thrown");
        if (thrown instanceof PendingException pending) {
            return pending(pending.getMessage());
        }
        SourceLocation location = locationOf(thrown);
        if (thrown instanceof ExampleFailedException failed) {
            return failure(failed.toReason(), location);
        }
        if (thrown instanceof AssertionError && thrown.getMessage() != null && !thrown.getMessage().isBlank()) {
            return failure(FailureReason.reason(thrown.getMessage()), location);
        }
        return failure(FailureReason.fault(thrown), location);
    }

    public ResultStatus status() {
        return status;
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    public boolean isPending() {
        return status == ResultStatus.PENDING;
    }

    public boolean isFailure() {
        return status == ResultStatus.FAILURE;
    }

    public Optional<String> pendingReason() {
        return Optional.ofNullable(pendingReason);
    }

    public Optional<FailureReason> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    /**
     * Faults raised by teardown hooks after this result was already decided.
     */
    public List<Throwable> secondaryFaults() {
        return secondaryFaults;
    }

    public Result withLocationIfAbsent(SourceLocation fallback) {
        if (status != ResultStatus.FAILURE || location != null || fallback == null) {
            return this;
        }
        return new Result(status, pendingReason, failureReason, fallback, secondaryFaults);
    }

    /**
     * Combines a teardown fault with this result without hiding the original outcome.
     */
    public Result withSecondaryFault(Throwable fault) {
        Objects.requireNonNull(fault, "fault");
        if (status != ResultStatus.FAILURE) {
            return failure(FailureReason.fault(fault), locationOf(fault));
        }
        List<Throwable> faults = new ArrayList<>(secondaryFaults);
        faults.add(fault);
        return new Result(status, pendingReason, failureReason, location, faults);
    }

    /**
     * Keeps the more severe of two results; on ties the receiver wins.
     */
    public Result worse(Result other) {
        if (other == null) {
            return this;
        }
        return other.status.ordinal() > status.ordinal() ? other : this;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCESS -> "Success";
            case PENDING -> "Pending(" + (pendingReason == null ? "" : pendingReason) + ")";
            case FAILURE -> "Failure(" + failureReason.describe() + ")";
        };
    }

    private static SourceLocation locationOf(Throwable thrown) {
        for (StackTraceElement frame : thrown.getStackTrace()) {
            String className = frame.getClassName();
            if (className.startsWith("java.")
                || className.startsWith("jdk.")
                || className.startsWith("sun.")
                || className.equals(ExampleFailedException.class.getName())
                || className.equals(Result.class.getName())) {
                continue;
            }
            if (frame.getFileName() == null || frame.getLineNumber() < 1) {
                return null;
            }
            return new SourceLocation(frame.getFileName(), frame.getLineNumber(), 0);
        }
        return null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
