package org.specrun.result;

public enum ResultStatus {
    SUCCESS,
    PENDING,
    FAILURE
}
