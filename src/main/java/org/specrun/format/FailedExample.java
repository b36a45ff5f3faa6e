package org.specrun.format;

import java.util.Objects;
import org.specrun.result.Result;
import org.specrun.tree.SpecPath;

/**
 * Numbered failure as listed at the end of a run.
 */
public record FailedExample(int number, SpecPath path, Result result) {
    public FailedExample {
        if (number < 1) {
            throw new IllegalArgumentException("number must be >= 1");
        }
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(result, "result");
        if (!result.isFailure()) {
            throw new IllegalArgumentException("result must be a failure");
        }
    }
}
