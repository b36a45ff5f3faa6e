package org.specrun.format;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.specrun.clock.MonotonicClock;
import org.specrun.clock.MonotonicInstant;

/**
 * Output primitives available to formatters. All writes go through one lock, so text written by one
 * callback is never interleaved with text from another thread.
 */
public final class FormatOutput {
    private final Appendable sink;
    private final boolean useColor;
    private final boolean useDiff;
    private final MonotonicClock clock;
    private final MonotonicInstant startedAt;
    private final long seed;
    private final RunProgress progress;

    public FormatOutput(
        Appendable sink,
        boolean useColor,
        boolean useDiff,
        MonotonicClock clock,
        long seed,
        RunProgress progress
    ) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.useColor = useColor;
        this.useDiff = useDiff;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.now();
        this.seed = seed;
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    public synchronized void writeText(String text) {
        append(text == null ? "null" : text);
    }

    public synchronized void writeLine(String text) {
        writeText(text);
        append("\n");
    }

    public synchronized void writeLine() {
        append("\n");
    }

    /**
     * Runs {@code body} with the given emphasis applied to everything it writes.
     */
    public synchronized void withColor(Color color, Runnable body) {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(body, "body");
        if (!useColor) {
            body.run();
            return;
        }
        append(color.start());
        try {
            body.run();
        } finally {
            append(Color.reset());
        }
    }

    public void writeColored(Color color, String text) {
        withColor(color, () -> writeText(text));
    }

    public Duration elapsed() {
        return startedAt.durationUntil(clock.now());
    }

    public RunCounts counts() {
        return progress.counts();
    }

    public List<FailedExample> failures() {
        return progress.failures();
    }

    public long seed() {
        return seed;
    }

    public boolean useColor() {
        return useColor;
    }

    public boolean useDiff() {
        return useDiff;
    }

    private void append(String text) {
        try {
            sink.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write formatter output", e);
        }
    }
}
