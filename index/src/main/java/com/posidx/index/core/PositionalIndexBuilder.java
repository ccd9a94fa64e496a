package com.posidx.index.core;

import com.posidx.common.PositionalEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the term -> positions map of one document.
 *
 * A position is the index of the token in the token stream, not a character offset.
 * Positions come out ascending because the stream is scanned once, left to right.
 */
public final class PositionalIndexBuilder {

    public Map<String, List<Integer>> build(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        Map<String, List<Integer>> index = new LinkedHashMap<>();
        for (int position = 0; position < tokens.size(); position++) {
            index.computeIfAbsent(tokens.get(position), t -> new ArrayList<>()).add(position);
        }
        return index;
    }

    public PositionalEntry build(String docId, List<String> tokens) {
        return new PositionalEntry(docId, build(tokens), tokens.size());
    }
}
