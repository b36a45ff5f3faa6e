package org.specrun.format;

import java.time.Duration;
import java.util.Optional;
import org.specrun.result.Summary;
import org.specrun.tree.SpecPath;

/**
 * One character per example.
 */
public final class ProgressFormatter extends AbstractFormatter {
    @Override
    public String name() {
        return "progress";
    }

    @Override
    public void exampleSucceeded(FormatOutput out, SpecPath path, Duration duration) {
        out.writeColored(Color.SUCCESS, ".");
    }

    @Override
    public void exampleFailed(FormatOutput out, FailedExample failure, Duration duration) {
        out.writeColored(Color.FAILURE, "F");
    }

    @Override
    public void examplePending(FormatOutput out, SpecPath path, Optional<String> reason) {
        out.writeColored(Color.PENDING, ".");
    }

    @Override
    public void runDone(FormatOutput out, Summary summary) {
        out.writeLine();
        super.runDone(out, summary);
    }
}
