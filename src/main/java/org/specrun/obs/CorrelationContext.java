package org.specrun.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every diagnostics event of a run.
 */
public final class CorrelationContext {
    private final String runId;
    private final String phase;
    private final String path;
    private final Long seed;

    private CorrelationContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.phase = requireText(builder.phase, "phase");
        this.path = normalize(builder.path);
        this.seed = builder.seed;
    }

    public static CorrelationContext of(String runId, String phase) {
        return builder(runId, phase).build();
    }

    public static Builder builder(String runId, String phase) {
        return new Builder(runId, phase);
    }

    public String runId() {
        return runId;
    }

    public String phase() {
        return phase;
    }

    public Optional<String> path() {
        return Optional.ofNullable(path);
    }

    public Optional<Long> seed() {
        return Optional.ofNullable(seed);
    }

    public CorrelationContext withPhase(String newPhase) {
        return builder(runId, newPhase).path(path).seed(seed).build();
    }

    public CorrelationContext withPath(String newPath) {
        return builder(runId, phase).path(newPath).seed(seed).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("phase", phase);
        if (path != null) {
            fields.put("path", path);
        }
        if (seed != null) {
            fields.put("seed", seed);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String phase;
        private String path;
        private Long seed;

        private Builder(String runId, String phase) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.phase = Objects.requireNonNull(phase, "phase");
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
