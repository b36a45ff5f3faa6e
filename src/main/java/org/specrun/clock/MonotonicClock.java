package org.specrun.clock;

/**
 * Source of monotonic instants for durations and timeouts.
 */
@FunctionalInterface
public interface MonotonicClock {
    MonotonicInstant now();

    static MonotonicClock system() {
        return SystemMonotonicClock.INSTANCE;
    }

    final class SystemMonotonicClock implements MonotonicClock {
        private static final SystemMonotonicClock INSTANCE = new SystemMonotonicClock();

        private SystemMonotonicClock() {
        }

        @Override
        public MonotonicInstant now() {
            return MonotonicInstant.ofNanos(System.nanoTime());
        }
    }
}
