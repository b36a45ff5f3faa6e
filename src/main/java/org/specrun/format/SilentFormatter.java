package org.specrun.format;

import org.specrun.result.Summary;

public final class SilentFormatter extends AbstractFormatter {
    @Override
    public String name() {
        return "silent";
    }

    @Override
    public void runDone(FormatOutput out, Summary summary) {
    }
}
