package org.specrun.diff;

/**
 * Which side(s) of an alignment a diff chunk belongs to.
 */
public enum ChunkKind {
    BOTH,
    EXPECTED_ONLY,
    ACTUAL_ONLY;

    public boolean inExpected() {
        return this != ACTUAL_ONLY;
    }

    public boolean inActual() {
        return this != EXPECTED_ONLY;
    }
}
