package org.specrun.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class DiffTokenizerTest {
    @Test
    void splitsWordsFromPunctuationAndWhitespace() {
        assertEquals(
            List.of("[", "1", ",", " ", "foo42", "]"),
            DiffTokenizer.tokenize("[1, foo42]"));
    }

    @Test
    void nullAndEmptyTextHaveNoTokens() {
        assertEquals(List.of(), DiffTokenizer.tokenize(null));
        assertEquals(List.of(), DiffTokenizer.tokenize(""));
    }
}
