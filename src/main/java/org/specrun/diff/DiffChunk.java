package org.specrun.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maximal run of consecutive tokens sharing the same {@link ChunkKind}.
 */
public final class DiffChunk<T> {
    private final ChunkKind kind;
    private final List<T> tokens;

    public DiffChunk(ChunkKind kind, List<T> tokens) {
        this.kind = Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("tokens must not be empty");
        }
        this.tokens = List.copyOf(new ArrayList<>(tokens));
    }

    public ChunkKind kind() {
        return kind;
    }

    public List<T> tokens() {
        return tokens;
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (T token : tokens) {
            sb.append(token);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DiffChunk<?> that)) {
            return false;
        }
        return kind == that.kind && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tokens);
    }

    @Override
    public String toString() {
        return kind + tokens.toString();
    }
}
