package org.specrun.result;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SummaryTest {
    @Test
    void emptyIsTheIdentity() {
        Summary summary = new Summary(3, 1);

        assertEquals(summary, Summary.EMPTY.combine(summary));
        assertEquals(summary, summary.combine(Summary.EMPTY));
    }

    @Test
    void combineIsAssociativeAndCommutative() {
        Summary a = new Summary(1, 0);
        Summary b = new Summary(4, 2);
        Summary c = new Summary(2, 1);

        assertEquals(a.combine(b).combine(c), a.combine(b.combine(c)));
        assertEquals(a.combine(b), b.combine(a));
        assertEquals(new Summary(7, 3), a.combine(b).combine(c));
    }

    @Test
    void pendingCountsAsExampleButNotFailure() {
        Summary summary = Summary.of(Result.success())
            .combine(Summary.of(Result.pending("later")))
            .combine(Summary.of(Result.failure("boom")));

        assertEquals(3, summary.examples());
        assertEquals(1, summary.failures());
        assertFalse(summary.isSuccess());
        assertTrue(Summary.EMPTY.isSuccess());
    }

    @Test
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> new Summary(-1, 0));
    }
}
