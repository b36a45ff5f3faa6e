package org.specrun.engine;

import java.util.Objects;
import org.specrun.result.Summary;

/**
 * Process exit codes of a run.
 */
public enum ExitStatus {
    SUCCESS(0),
    FAILURE(1),
    FATAL(2);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitStatus of(Summary summary) {
        Objects.requireNonNull(summary, "summary");
        return summary.isSuccess() ? SUCCESS : FAILURE;
    }
}
