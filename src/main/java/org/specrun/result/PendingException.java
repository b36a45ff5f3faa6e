package org.specrun.result;

/**
 * Thrown by example code to mark the example as pending.
 */
public class PendingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public PendingException() {
        super(null, null, false, false);
    }

    public PendingException(String reason) {
        super(reason, null, false, false);
    }
}
