package org.specrun.format;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.specrun.diff.ChunkKind;
import org.specrun.diff.DiffChunk;
import org.specrun.diff.SequenceDiff;
import org.specrun.result.FailureReason;
import org.specrun.result.Result;
import org.specrun.result.Summary;
import org.specrun.tree.SpecPath;

/**
 * No-op callbacks plus the shared end-of-run failure listing and footer.
 */
public abstract class AbstractFormatter implements Formatter {
    private static final String INDENT = "       ";

    @Override
    public void runStarted(FormatOutput out) {
    }

    @Override
    public void groupStarted(FormatOutput out, List<String> parentLabels, String label) {
    }

    @Override
    public void groupDone(FormatOutput out) {
    }

    @Override
    public void exampleStarted(FormatOutput out, SpecPath path) {
    }

    @Override
    public void exampleSucceeded(FormatOutput out, SpecPath path, Duration duration) {
    }

    @Override
    public void exampleFailed(FormatOutput out, FailedExample failure, Duration duration) {
    }

    @Override
    public void examplePending(FormatOutput out, SpecPath path, Optional<String> reason) {
    }

    @Override
    public void runDone(FormatOutput out, Summary summary) {
        writeFailures(out);
        writeFooter(out, summary);
    }

    protected void writeFailures(FormatOutput out) {
        List<FailedExample> failures = out.failures();
        if (failures.isEmpty()) {
            return;
        }
        out.writeLine();
        out.writeLine("Failures:");
        for (FailedExample failure : failures) {
            out.writeLine();
            writeFailure(out, failure);
        }
        out.writeLine();
        out.writeLine("Randomized with seed " + out.seed());
    }

    protected void writeFooter(FormatOutput out, Summary summary) {
        RunCounts counts = out.counts();
        out.writeLine();
        out.writeLine(String.format(Locale.ROOT, "Finished in %.4f seconds", out.elapsed().toNanos() / 1e9));
        Color color = counts.failures() > 0 ? Color.FAILURE : counts.pending() > 0 ? Color.PENDING : Color.SUCCESS;
        StringBuilder line = new StringBuilder()
            .append(pluralize(summary.examples(), "example"))
            .append(", ")
            .append(pluralize(summary.failures(), "failure"));
        if (counts.pending() > 0) {
            line.append(", ").append(counts.pending()).append(" pending");
        }
        out.writeColored(color, line.toString());
        out.writeLine();
    }

    private static void writeFailure(FormatOutput out, FailedExample failure) {
        Result result = failure.result();
        result.location().ifPresent(location -> out.writeLine("  " + location + ":"));
        out.writeLine("  " + failure.number() + ") " + renderPath(failure.path()));
        FailureReason reason = result.failureReason().orElseThrow();
        switch (reason.kind()) {
            case REASON -> writeIndented(out, reason.message().orElse(""), Color.FAILURE);
            case EXPECTED_ACTUAL_MISMATCH -> writeMismatch(out, reason);
            case FAULT -> writeIndented(
                out,
                "uncaught exception: " + FailureReason.describeFault(reason.fault().orElseThrow()),
                Color.FAILURE);
            case TIMEOUT_EXCEEDED -> writeIndented(
                out,
                "timeout exceeded after " + reason.timeout().orElseThrow().toMillis() + "ms",
                Color.FAILURE);
        }
        for (Throwable secondary : result.secondaryFaults()) {
            writeIndented(out, "also: " + FailureReason.describeFault(secondary), Color.FAILURE);
        }
        out.writeLine();
        out.writeLine("  To rerun use: match: [\"" + failure.path().render() + "\"]");
    }

    private static void writeMismatch(FormatOutput out, FailureReason reason) {
        String expected = reason.expected().orElse("");
        String actual = reason.actual().orElse("");
        reason.message().ifPresent(preface -> writeIndented(out, preface, Color.FAILURE));
        if (!out.useDiff()) {
            out.writeLine(INDENT + "expected: " + expected);
            out.writeLine(INDENT + " but got: " + actual);
            return;
        }
        List<DiffChunk<String>> chunks = SequenceDiff.diffText(expected, actual);
        out.writeText(INDENT + "expected: ");
        writeSide(out, chunks, ChunkKind.EXPECTED_ONLY, Color.FAILURE);
        out.writeLine();
        out.writeText(INDENT + " but got: ");
        writeSide(out, chunks, ChunkKind.ACTUAL_ONLY, Color.SUCCESS);
        out.writeLine();
    }

    // without color, differing chunks are bracketed as [-expected-] and {+actual+}
    private static void writeSide(FormatOutput out, List<DiffChunk<String>> chunks, ChunkKind side, Color color) {
        for (DiffChunk<String> chunk : chunks) {
            if (chunk.kind() == ChunkKind.BOTH) {
                out.writeText(chunk.text());
            } else if (chunk.kind() != side) {
                continue;
            } else if (out.useColor()) {
                out.writeColored(color, chunk.text());
            } else if (side == ChunkKind.EXPECTED_ONLY) {
                out.writeText("[-" + chunk.text() + "-]");
            } else {
                out.writeText("{+" + chunk.text() + "+}");
            }
        }
    }

    private static void writeIndented(FormatOutput out, String text, Color color) {
        for (String line : text.split("\n", -1)) {
            out.writeColored(color, INDENT + line);
            out.writeLine();
        }
    }

    protected static String renderPath(SpecPath path) {
        if (path.groups().isEmpty()) {
            return path.requirement();
        }
        return String.join(", ", path.groups()) + " " + path.requirement();
    }

    protected static String pluralize(int count, String noun) {
        return count + " " + (count == 1 ? noun : noun + "s");
    }
}
