package org.specrun.format;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import org.specrun.config.ConfigurationException;

/**
 * Registry of built-in formatters.
 */
public final class Formatters {
    private static final List<String> NAMES = List.of("specdoc", "progress", "failed-examples", "silent");

    private Formatters() {}

    public static List<String> names() {
        return NAMES;
    }

    public static Formatter byName(final String name) {
        final String normalized = Objects.requireNonNull(name, "name").trim().toLowerCase(Locale.ROOT);
        final Supplier<Formatter> factory = switch (normalized) {
            case "specdoc" -> SpecdocFormatter::new;
            case "progress" -> ProgressFormatter::new;
            case "failed-examples" -> FailedExamplesFormatter::new;
            case "silent" -> SilentFormatter::new;
            default -> throw new ConfigurationException(
                    "unknown formatter: " + name + " (expected one of " + String.join(", ", NAMES) + ")");
        };
        return factory.get();
    }
}
