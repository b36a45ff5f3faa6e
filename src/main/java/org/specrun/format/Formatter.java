package org.specrun.format;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.specrun.result.Summary;
import org.specrun.tree.SpecPath;

/**
 * Renderer for run lifecycle events.
 *
 * <p>The runner invokes callbacks from a single reporting thread, in tree order: every
 * {@code groupStarted} is matched by a {@code groupDone}, and all events of the group's descendants
 * fall between the two. {@code exampleStarted} fires once a worker has begun the example and is always
 * directly followed by the outcome callback of the same example.
 */
public interface Formatter {
    String name();

    void runStarted(FormatOutput out);

    /**
     * @param parentLabels labels of the enclosing groups, outermost first
     */
    void groupStarted(FormatOutput out, List<String> parentLabels, String label);

    void groupDone(FormatOutput out);

    void exampleStarted(FormatOutput out, SpecPath path);

    void exampleSucceeded(FormatOutput out, SpecPath path, Duration duration);

    /**
     * @param failure the failure as numbered in {@link FormatOutput#failures()}
     */
    void exampleFailed(FormatOutput out, FailedExample failure, Duration duration);

    void examplePending(FormatOutput out, SpecPath path, Optional<String> reason);

    void runDone(FormatOutput out, Summary summary);
}
