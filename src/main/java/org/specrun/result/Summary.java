package org.specrun.result;

/**
 * Example and failure counts of a run; a commutative monoid under {@link #combine(Summary)}.
 */
public final class Summary {
    public static final Summary EMPTY = new Summary(0, 0);

    private final int examples;
    private final int failures;

    public Summary(int examples, int failures) {
        if (examples < 0 || failures < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        this.examples = examples;
        this.failures = failures;
    }

    public static Summary of(Result result) {
        return new Summary(1, result.isFailure() ? 1 : 0);
    }

    public int examples() {
        return examples;
    }

    public int failures() {
        return failures;
    }

    public boolean isSuccess() {
        return failures == 0;
    }

    public Summary combine(Summary other) {
        if (other == null) {
            return this;
        }
        return new Summary(examples + other.examples, failures + other.failures);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Summary that)) {
            return false;
        }
        return examples == that.examples && failures == that.failures;
    }

    @Override
    public int hashCode() {
        return 31 * examples + failures;
    }

    @Override
    public String toString() {
        return "Summary{examples=" + examples + ", failures=" + failures + "}";
    }
}
