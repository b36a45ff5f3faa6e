package org.specrun.format;

/**
 * Emphasis styles available to formatters, rendered as ANSI colors when color output is enabled.
 */
public enum Color {
    SUCCESS("32"),
    FAILURE("31"),
    PENDING("33"),
    EXTRA_INFO("2");

    private final String ansiCode;

    Color(String ansiCode) {
        this.ansiCode = ansiCode;
    }

    String start() {
        return "\u001b[" + ansiCode + "m";
    }

    static String reset() {
        return "\u001b[0m";
    }
}
