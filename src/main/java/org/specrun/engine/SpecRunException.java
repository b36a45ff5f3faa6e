package org.specrun.engine;

/**
 * Fatal error that aborts a run, such as an unwritable formatter sink or failure report.
 */
public final class SpecRunException extends RuntimeException {
    public SpecRunException(String message) {
        super(message);
    }

    public SpecRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
