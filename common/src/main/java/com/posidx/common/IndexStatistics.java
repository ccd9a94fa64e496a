package com.posidx.common;

/**
 * Read-only counts over the persisted index, queried after a committed write.
 */
public record IndexStatistics(
        long distinctTerms,
        long distinctDocuments,
        long totalRows
) {
    public static final IndexStatistics EMPTY = new IndexStatistics(0, 0, 0);
}
