package com.posidx.common;

import java.util.List;

/**
 * PositionalIndexWriter: persistent sink for the positional index.
 *
 * A write replaces the whole index. Readers see either the previous index or the new one.
 */
public interface PositionalIndexWriter {

    /**
     * Clears the index and stores the given rows as one all-or-nothing unit.
     *
     * @param rows every (term, docId, positions) triple of the run; keys must be unique
     * @return statistics of the index after commit
     * @throws IndexPersistenceException if the write fails; the previous index is kept
     */
    IndexStatistics replaceAll(List<IndexRow> rows) throws IndexPersistenceException;

    /**
     * Counts over the currently persisted index.
     */
    IndexStatistics statistics() throws IndexPersistenceException;

    /**
     * First rows of the index ordered by term, then docId.
     */
    List<IndexRow> sample(int limit) throws IndexPersistenceException;

    /**
     * Every persisted row ordered by term, then docId.
     */
    List<IndexRow> readAll() throws IndexPersistenceException;
}
