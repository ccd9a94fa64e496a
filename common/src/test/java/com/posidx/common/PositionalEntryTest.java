package com.posidx.common;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PositionalEntryTest {

    @Test
    void toRows_keepsTermOrderAndDocId() {
        Map<String, List<Integer>> terms = new LinkedHashMap<>();
        terms.put("the", List.of(0));
        terms.put("cat", List.of(1));
        terms.put("sat", List.of(2));

        PositionalEntry entry = new PositionalEntry("doc1", terms, 3);
        List<IndexRow> rows = entry.toRows();

        assertEquals(List.of(
                new IndexRow("the", "doc1", List.of(0)),
                new IndexRow("cat", "doc1", List.of(1)),
                new IndexRow("sat", "doc1", List.of(2))
        ), rows);
        assertEquals(3, entry.termCount());
        assertEquals(3, entry.getTokenCount());
    }

    @Test
    void terms_areDefensivelyCopiedAndUnmodifiable() {
        Map<String, List<Integer>> terms = new LinkedHashMap<>();
        terms.put("a", new java.util.ArrayList<>(List.of(0, 2)));
        PositionalEntry entry = new PositionalEntry("d", terms, 3);

        terms.get("a").add(99);
        terms.put("b", List.of(1));

        assertEquals(List.of(0, 2), entry.positionsOf("a"));
        assertTrue(entry.positionsOf("b").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> entry.getTerms().put("x", List.of()));
    }

    @Test
    void emptyEntry_hasNoRows() {
        PositionalEntry entry = new PositionalEntry("d", Map.of(), 0);
        assertTrue(entry.isEmpty());
        assertTrue(entry.toRows().isEmpty());
    }
}
