package org.specrun.engine;

import java.time.Duration;
import java.util.Objects;
import org.specrun.result.Result;
import org.specrun.tree.SpecPath;

/**
 * Result of one dispatched example; {@code skipped} when fail-fast stopped it before it ran.
 */
record ExampleOutcome(SpecPath path, Result result, Duration duration, boolean skipped) {
    ExampleOutcome {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(duration, "duration");
        if (!skipped) {
            Objects.requireNonNull(result, "result");
        }
    }

    static ExampleOutcome evaluated(SpecPath path, Result result, Duration duration) {
        return new ExampleOutcome(path, result, duration, false);
    }

    static ExampleOutcome skipped(SpecPath path) {
        return new ExampleOutcome(path, null, Duration.ZERO, true);
    }
}
