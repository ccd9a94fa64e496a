package com.posidx.common;

import java.util.List;
import java.util.Objects;

/**
 * One persisted row of the positional index: (term, docId) -> ascending positions.
 */
public final class IndexRow {
    private final String term;
    private final String docId;
    private final List<Integer> positions;

    public IndexRow(String term, String docId, List<Integer> positions) {
        this.term = Objects.requireNonNull(term, "term cannot be null");
        this.docId = Objects.requireNonNull(docId, "docId cannot be null");
        this.positions = List.copyOf(Objects.requireNonNull(positions, "positions cannot be null"));
    }

    public String getTerm() { return term; }
    public String getDocId() { return docId; }
    public List<Integer> getPositions() { return positions; }

    /** Positions boxed for {@link java.sql.Connection#createArrayOf}. */
    public Integer[] positionsArray() {
        return positions.toArray(new Integer[0]);
    }

    @Override
    public String toString() {
        return "(" + term + ", " + docId + ", " + positions + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IndexRow that)) return false;
        return term.equals(that.term) && docId.equals(that.docId) && positions.equals(that.positions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, docId, positions);
    }
}
