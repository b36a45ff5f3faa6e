package org.specrun.clock;

import java.time.Duration;
import java.util.Objects;

/**
 * Point on a monotonic timeline. Only differences between instants of the same clock are meaningful.
 */
public final class MonotonicInstant implements Comparable<MonotonicInstant> {
    private final long nanos;

    private MonotonicInstant(long nanos) {
        this.nanos = nanos;
    }

    public static MonotonicInstant ofNanos(long nanos) {
        return new MonotonicInstant(nanos);
    }

    public long nanos() {
        return nanos;
    }

    public Duration durationUntil(MonotonicInstant later) {
        Objects.requireNonNull(later, "later");
        long delta = later.nanos - nanos;
        return Duration.ofNanos(Math.max(0L, delta));
    }

    public MonotonicInstant plus(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        return new MonotonicInstant(nanos + duration.toNanos());
    }

    @Override
    public int compareTo(MonotonicInstant other) {
        // overflow-safe ordering, same contract as System.nanoTime comparisons
        return Long.signum(nanos - other.nanos);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MonotonicInstant that)) {
            return false;
        }
        return nanos == that.nanos;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nanos);
    }

    @Override
    public String toString() {
        return "MonotonicInstant[" + nanos + "ns]";
    }
}
