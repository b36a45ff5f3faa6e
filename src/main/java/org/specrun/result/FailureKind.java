package org.specrun.result;

public enum FailureKind {
    REASON,
    EXPECTED_ACTUAL_MISMATCH,
    FAULT,
    TIMEOUT_EXCEEDED
}
