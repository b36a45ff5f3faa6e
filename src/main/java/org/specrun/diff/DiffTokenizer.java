package org.specrun.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits rendered values into diff tokens: runs of letters or digits, and single other characters.
 */
public final class DiffTokenizer {
    private DiffTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int codePoint = text.codePointAt(start);
            int end = start + Character.charCount(codePoint);
            if (Character.isLetterOrDigit(codePoint)) {
                while (end < text.length() && Character.isLetterOrDigit(text.codePointAt(end))) {
                    end += Character.charCount(text.codePointAt(end));
                }
            }
            tokens.add(text.substring(start, end));
            start = end;
        }
        return List.copyOf(tokens);
    }
}
