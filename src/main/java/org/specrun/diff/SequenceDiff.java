package org.specrun.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Longest-common-subsequence differencer producing grouped, tagged chunks.
 *
 * <p>The alignment is minimal and deterministic: whenever several minimal alignments exist, the one that
 * consumes expected tokens at the earliest index wins, so expected-only tokens are emitted before
 * actual-only tokens at the same position.
 *
 * <p>The alignment table is quadratic in the token counts. Once the common prefix and suffix are
 * stripped, a remainder larger than {@link #MAX_TABLE_CELLS} is reported as one expected-only chunk
 * followed by one actual-only chunk instead of being aligned token by token.
 */
public final class SequenceDiff {
    static final long MAX_TABLE_CELLS = 4_000_000L;

    private SequenceDiff() {
    }

    public static List<DiffChunk<String>> diffText(String expected, String actual) {
        return diff(DiffTokenizer.tokenize(expected), DiffTokenizer.tokenize(actual));
    }

    public static <T> List<DiffChunk<T>> diff(List<T> expected, List<T> actual) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");

        if ((long) (expected.size() + 1) * (actual.size() + 1) > MAX_TABLE_CELLS) {
            return coarseDiff(expected, actual);
        }
        ChunkCollector<T> collector = new ChunkCollector<>();
        align(expected, actual, collector);
        return collector.chunks();
    }

    private static <T> void align(List<T> expected, List<T> actual, ChunkCollector<T> collector) {
        int[][] lcs = suffixTable(expected, actual);
        int i = 0;
        int j = 0;
        while (i < expected.size() && j < actual.size()) {
            if (Objects.equals(expected.get(i), actual.get(j))) {
                collector.add(ChunkKind.BOTH, expected.get(i));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                collector.add(ChunkKind.EXPECTED_ONLY, expected.get(i));
                i++;
            } else {
                collector.add(ChunkKind.ACTUAL_ONLY, actual.get(j));
                j++;
            }
        }
        while (i < expected.size()) {
            collector.add(ChunkKind.EXPECTED_ONLY, expected.get(i++));
        }
        while (j < actual.size()) {
            collector.add(ChunkKind.ACTUAL_ONLY, actual.get(j++));
        }
    }

    private static <T> List<DiffChunk<T>> coarseDiff(List<T> expected, List<T> actual) {
        int prefix = 0;
        int limit = Math.min(expected.size(), actual.size());
        while (prefix < limit && Objects.equals(expected.get(prefix), actual.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < limit - prefix
            && Objects.equals(expected.get(expected.size() - 1 - suffix), actual.get(actual.size() - 1 - suffix))) {
            suffix++;
        }
        List<T> expectedMiddle = expected.subList(prefix, expected.size() - suffix);
        List<T> actualMiddle = actual.subList(prefix, actual.size() - suffix);

        ChunkCollector<T> collector = new ChunkCollector<>();
        for (T token : expected.subList(0, prefix)) {
            collector.add(ChunkKind.BOTH, token);
        }
        if ((long) (expectedMiddle.size() + 1) * (actualMiddle.size() + 1) <= MAX_TABLE_CELLS) {
            align(expectedMiddle, actualMiddle, collector);
        } else {
            for (T token : expectedMiddle) {
                collector.add(ChunkKind.EXPECTED_ONLY, token);
            }
            for (T token : actualMiddle) {
                collector.add(ChunkKind.ACTUAL_ONLY, token);
            }
        }
        for (T token : expected.subList(expected.size() - suffix, expected.size())) {
            collector.add(ChunkKind.BOTH, token);
        }
        return collector.chunks();
    }

    /**
     * Rebuilds one side of the alignment from the chunks that belong to it.
     */
    public static <T> List<T> reconstruct(List<DiffChunk<T>> chunks, boolean expectedSide) {
        Objects.requireNonNull(chunks, "chunks");
        List<T> tokens = new ArrayList<>();
        for (DiffChunk<T> chunk : chunks) {
            boolean belongs = expectedSide ? chunk.kind().inExpected() : chunk.kind().inActual();
            if (belongs) {
                tokens.addAll(chunk.tokens());
            }
        }
        return tokens;
    }

    // lcs[i][j] = length of the LCS of expected[i..] and actual[j..]
    private static <T> int[][] suffixTable(List<T> expected, List<T> actual) {
        int n = expected.size();
        int m = actual.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (Objects.equals(expected.get(i), actual.get(j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }
        return lcs;
    }

    private static final class ChunkCollector<T> {
        private final List<DiffChunk<T>> chunks = new ArrayList<>();
        private ChunkKind currentKind;
        private List<T> current = new ArrayList<>();

        void add(ChunkKind kind, T token) {
            if (currentKind != null && currentKind != kind) {
                flush();
            }
            currentKind = kind;
            current.add(token);
        }

        List<DiffChunk<T>> chunks() {
            flush();
            return List.copyOf(chunks);
        }

        private void flush() {
            if (currentKind != null && !current.isEmpty()) {
                chunks.add(new DiffChunk<>(currentKind, current));
            }
            current = new ArrayList<>();
            currentKind = null;
        }
    }
}
