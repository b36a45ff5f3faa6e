package org.specrun.format;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.specrun.tree.SpecPath;

/**
 * Prints the spec tree as an outline: one line per group and example, indented by nesting depth.
 */
public final class SpecdocFormatter extends AbstractFormatter {
    static final Duration SLOW_EXAMPLE = Duration.ofMillis(100);

    @Override
    public String name() {
        return "specdoc";
    }

    @Override
    public void groupStarted(FormatOutput out, List<String> parentLabels, String label) {
        out.writeLine(indent(parentLabels.size()) + label);
    }

    @Override
    public void exampleSucceeded(FormatOutput out, SpecPath path, Duration duration) {
        out.writeColored(Color.SUCCESS, indent(path.groups().size()) + path.requirement());
        writeDuration(out, duration);
        out.writeLine();
    }

    @Override
    public void exampleFailed(FormatOutput out, FailedExample failure, Duration duration) {
        SpecPath path = failure.path();
        out.writeColored(
            Color.FAILURE,
            indent(path.groups().size()) + path.requirement() + " FAILED [" + failure.number() + "]");
        writeDuration(out, duration);
        out.writeLine();
    }

    @Override
    public void examplePending(FormatOutput out, SpecPath path, Optional<String> reason) {
        String indent = indent(path.groups().size());
        out.withColor(Color.PENDING, () -> {
            out.writeLine(indent + path.requirement());
            out.writeText(indent + "  # PENDING: " + reason.orElse("No reason given"));
        });
        out.writeLine();
    }

    private static void writeDuration(FormatOutput out, Duration duration) {
        if (duration != null && duration.compareTo(SLOW_EXAMPLE) >= 0) {
            out.writeColored(Color.EXTRA_INFO, " (" + duration.toMillis() + "ms)");
        }
    }

    private static String indent(int depth) {
        return "  ".repeat(depth);
    }
}
