package org.specrun.format;

/**
 * Prints nothing while running; only the failure list and the footer at the end.
 */
public final class FailedExamplesFormatter extends AbstractFormatter {
    @Override
    public String name() {
        return "failed-examples";
    }
}
