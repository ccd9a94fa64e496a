package com.posidx.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PositionalEntry: term -> ascending token positions for a single document.
 *
 * Terms keep first-seen order so flattened output is stable across runs.
 */
public final class PositionalEntry {
    private final String docId;
    private final Map<String, List<Integer>> terms;
    private final int tokenCount;

    public PositionalEntry(String docId, Map<String, List<Integer>> terms, int tokenCount) {
        this.docId = Objects.requireNonNull(docId, "docId cannot be null");
        Objects.requireNonNull(terms, "terms cannot be null");
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        terms.forEach((t, p) -> copy.put(t, List.copyOf(p)));
        this.terms = Collections.unmodifiableMap(copy);
        this.tokenCount = tokenCount;
    }

    public String getDocId() { return docId; }
    public Map<String, List<Integer>> getTerms() { return terms; }
    public int getTokenCount() { return tokenCount; }
    public int termCount() { return terms.size(); }
    public boolean isEmpty() { return terms.isEmpty(); }

    public List<Integer> positionsOf(String term) {
        return terms.getOrDefault(term, List.of());
    }

    /** Flattens into one {@link IndexRow} per distinct term, in term order. */
    public List<IndexRow> toRows() {
        List<IndexRow> rows = new ArrayList<>(terms.size());
        terms.forEach((term, positions) -> rows.add(new IndexRow(term, docId, positions)));
        return rows;
    }

    @Override
    public String toString() {
        return String.format("PositionalEntry{docId=%s, terms=%d, tokens=%d}", docId, terms.size(), tokenCount);
    }
}
