package org.specrun.format;

/**
 * Outcome counts observed so far in a run.
 */
public record RunCounts(int successes, int pending, int failures) {
    public int total() {
        return successes + pending + failures;
    }
}
