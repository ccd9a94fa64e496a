package com.posidx.index.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into lowercase ASCII alphanumeric terms.
 *
 * Case folding runs before matching, so any character whose lowercase form is ASCII
 * (the Kelvin sign, for one) still yields a term. Everything else separates terms.
 */
public final class Tokenizer {

    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        String lower = text.toLowerCase(Locale.ROOT);

        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(lower);
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }
}
