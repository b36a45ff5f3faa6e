package org.specrun.engine;

import java.util.List;
import java.util.Objects;
import org.specrun.format.FailedExample;
import org.specrun.format.RunCounts;
import org.specrun.result.Summary;

/**
 * What a finished run hands back to its caller.
 */
public final class RunReport {
    private final Summary summary;
    private final long seed;
    private final RunCounts counts;
    private final List<FailedExample> failures;

    public RunReport(Summary summary, long seed, RunCounts counts, List<FailedExample> failures) {
        this.summary = Objects.requireNonNull(summary, "summary");
        this.seed = seed;
        this.counts = Objects.requireNonNull(counts, "counts");
        this.failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public Summary summary() {
        return summary;
    }

    public long seed() {
        return seed;
    }

    public RunCounts counts() {
        return counts;
    }

    public List<FailedExample> failures() {
        return failures;
    }

    public boolean allPassed() {
        return summary.isSuccess();
    }

    public ExitStatus exitStatus() {
        return ExitStatus.of(summary);
    }

    @Override
    public String toString() {
        return "RunReport{" + summary + ", seed=" + seed + ", counts=" + counts + "}";
    }
}
