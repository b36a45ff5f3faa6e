package org.specrun.tree;

/**
 * Parameters handed to every example; property-testing adapters read their seed and limits from here.
 */
public record ExampleParams(long seed, int maxSuccess, int maxSize, int maxDiscardRatio) {
    public static final int DEFAULT_MAX_SUCCESS = 100;
    public static final int DEFAULT_MAX_SIZE = 100;
    public static final int DEFAULT_MAX_DISCARD_RATIO = 10;

    public ExampleParams {
        if (maxSuccess <= 0 || maxSize <= 0 || maxDiscardRatio <= 0) {
            throw new IllegalArgumentException("maxSuccess, maxSize and maxDiscardRatio must be > 0");
        }
    }

    public static ExampleParams withSeed(long seed) {
        return new ExampleParams(seed, DEFAULT_MAX_SUCCESS, DEFAULT_MAX_SIZE, DEFAULT_MAX_DISCARD_RATIO);
    }
}
