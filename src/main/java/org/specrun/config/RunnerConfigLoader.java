package org.specrun.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.specrun.tree.SpecPath;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads runner options from a JSON or YAML file.
 *
 * <p>Keys use the command-line spelling, for example {@code concurrency: 4}, {@code fail-fast: true},
 * {@code timeout-ms: 500} or {@code match: ["Stack/pop"]}.
 */
public final class RunnerConfigLoader {
    private RunnerConfigLoader() {}

    public static RunnerConfig load(final Path configPath) throws IOException {
        return load(configPath, RunnerConfig.defaults());
    }

    public static RunnerConfig load(final Path configPath, final RunnerConfig base) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new ConfigurationException("config path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new ConfigurationException("config path must be a file: " + normalized);
        }
        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString(), base);
    }

    static RunnerConfig parse(final String content, final String sourceName, final RunnerConfig base) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(base, "base");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        final Map<String, Object> options = normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")
                ? parseYaml(content)
                : parseJson(content);
        return apply(options, base);
    }

    private static Map<String, Object> parseYaml(final String content) {
        final Object root;
        try {
            root = new Yaml().load(content);
        } catch (final YAMLException e) {
            throw new ConfigurationException("config is not valid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ConfigurationException("config root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }

    private static Map<String, Object> parseJson(final String content) {
        if (content.isBlank()) {
            return Map.of();
        }
        try {
            return Document.parse(content);
        } catch (final JsonParseException | IllegalArgumentException e) {
            throw new ConfigurationException("config is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static RunnerConfig apply(final Map<String, Object> options, final RunnerConfig base) {
        final RunnerConfig.Builder builder = base.toBuilder();
        Predicate<SpecPath> matchFilter = null;
        for (final Map.Entry<String, Object> entry : options.entrySet()) {
            final String key = entry.getKey();
            final Object value = entry.getValue();
            switch (key) {
                case "concurrency" -> builder.concurrency(readInt(key, value));
                case "seed" -> builder.seed(readLong(key, value));
                case "randomize" -> builder.randomize(readBoolean(key, value));
                case "timeout-ms" -> builder.timeout(Duration.ofMillis(readLong(key, value)));
                case "color" -> builder.colorMode(ColorMode.parse(readText(key, value)));
                case "fail-fast" -> builder.fastFail(readBoolean(key, value));
                case "rerun" -> builder.rerun(readBoolean(key, value));
                case "formatter" -> builder.formatter(readText(key, value));
                case "failure-report" -> builder.failureReportPath(Path.of(readText(key, value)));
                case "write-failure-report" -> builder.writeFailureReport(readBoolean(key, value));
                case "dry-run" -> builder.dryRun(readBoolean(key, value));
                case "diff" -> builder.diff(readBoolean(key, value));
                case "max-success" -> builder.maxSuccess(readInt(key, value));
                case "max-size" -> builder.maxSize(readInt(key, value));
                case "max-discard-ratio" -> builder.maxDiscardRatio(readInt(key, value));
                case "diagnostics-log" -> builder.diagnosticsLog(Path.of(readText(key, value)));
                case "match" -> matchFilter = matchPredicate(readTextList(key, value));
                default -> throw new ConfigurationException("unknown config key: " + key);
            }
        }
        final RunnerConfig config = builder.build();
        return matchFilter == null ? config : config.addFilter(matchFilter);
    }

    /**
     * An example matches when its rendered path {@code group/.../requirement} contains any pattern.
     */
    public static Predicate<SpecPath> matchPredicate(final List<String> patterns) {
        final List<String> copied = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        if (copied.isEmpty()) {
            throw new ConfigurationException("match must list at least one pattern");
        }
        return path -> {
            final String rendered = path.render();
            for (final String pattern : copied) {
                if (rendered.contains(pattern)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static int readInt(final String key, final Object value) {
        final long parsed = readLong(key, value);
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new ConfigurationException(key + " is out of range");
        }
        return (int) parsed;
    }

    private static long readLong(final String key, final Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (final NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer", e);
            }
        }
        throw new ConfigurationException(key + " must be an integer");
    }

    private static boolean readBoolean(final String key, final Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            final String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "false".equals(normalized)) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw new ConfigurationException(key + " must be a boolean");
    }

    private static String readText(final String key, final Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        throw new ConfigurationException(key + " must be a non-blank string");
    }

    private static List<String> readTextList(final String key, final Object value) {
        if (value instanceof String) {
            return List.of(readText(key, value));
        }
        if (!(value instanceof List<?> items)) {
            throw new ConfigurationException(key + " must be a string or a list of strings");
        }
        final List<String> texts = new ArrayList<>(items.size());
        for (final Object item : items) {
            texts.add(readText(key, item));
        }
        return texts;
    }
}
