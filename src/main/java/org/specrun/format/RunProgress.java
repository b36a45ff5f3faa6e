package org.specrun.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.specrun.result.Result;
import org.specrun.tree.SpecPath;

/**
 * Counts and failures reported so far; updated by the runner, read by formatters.
 */
public final class RunProgress {
    private int successes;
    private int pending;
    private final List<FailedExample> failures = new ArrayList<>();

    public synchronized void recordSuccess() {
        successes++;
    }

    public synchronized void recordPending() {
        pending++;
    }

    /**
     * Records a failure and returns its 1-based number.
     */
    public synchronized FailedExample recordFailure(SpecPath path, Result result) {
        Objects.requireNonNull(path, "path");
        FailedExample failed = new FailedExample(failures.size() + 1, path, result);
        failures.add(failed);
        return failed;
    }

    public synchronized RunCounts counts() {
        return new RunCounts(successes, pending, failures.size());
    }

    public synchronized List<FailedExample> failures() {
        return List.copyOf(failures);
    }
}
