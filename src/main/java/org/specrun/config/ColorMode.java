package org.specrun.config;

import java.util.Locale;

public enum ColorMode {
    AUTO,
    ALWAYS,
    NEVER;

    public static ColorMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("color must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "always" -> ALWAYS;
            case "never" -> NEVER;
            default -> throw new ConfigurationException("unsupported color mode: " + value + " (auto|always|never)");
        };
    }
}
