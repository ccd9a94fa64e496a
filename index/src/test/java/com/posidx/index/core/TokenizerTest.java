package com.posidx.index.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void emptyAndNull_giveNoTokens() {
        assertEquals(List.of(), tokenizer.tokenize(""));
        assertEquals(List.of(), tokenizer.tokenize(null));
        assertEquals(List.of(), tokenizer.tokenize("  ,;!! "));
    }

    @Test
    void lowercasesAndSplitsOnNonAlphanumerics() {
        assertEquals(List.of("hello", "world", "123"), tokenizer.tokenize("Hello, World! 123"));
        assertEquals(List.of("don", "t", "stop", "e", "mail"), tokenizer.tokenize("Don't STOP e-mail"));
        assertEquals(List.of("a1b2", "c3"), tokenizer.tokenize("a1b2_c3"));
    }

    @Test
    void nonAsciiLettersAreSeparators() {
        assertEquals(List.of("caf", "na", "ve"), tokenizer.tokenize("café naïve"));
        assertEquals(List.of("x", "y"), tokenizer.tokenize("x 中文y"));
    }

    @Test
    void everyTokenMatchesAlphabet() {
        List<String> tokens = tokenizer.tokenize("The Quick-Brown fox; jumps over 2 LAZY dogs!\n\tEnd.");
        assertFalse(tokens.isEmpty());
        for (String t : tokens) {
            assertTrue(t.matches("[a-z0-9]+"), t);
        }
    }

    @Test
    void deterministic() {
        String text = "Repeat, repeat; REPEAT";
        assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
        assertEquals(List.of("repeat", "repeat", "repeat"), tokenizer.tokenize(text));
    }
}
