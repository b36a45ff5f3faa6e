package org.specrun.engine;

import org.specrun.result.Result;
import org.specrun.result.Summary;

final class SummaryAccumulator {
    private Summary summary = Summary.EMPTY;

    synchronized void add(Result result) {
        summary = summary.combine(Summary.of(result));
    }

    synchronized Summary summary() {
        return summary;
    }
}
