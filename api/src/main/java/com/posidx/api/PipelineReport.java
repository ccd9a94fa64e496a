package com.posidx.api;

import com.posidx.common.IndexRow;
import com.posidx.common.IndexStatistics;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one index build.
 *
 * @param failures doc_id to failure message, only populated under the skip policy
 */
public record PipelineReport(
        Status status,
        int documentsLoaded,
        List<String> indexed,
        List<String> skipped,
        Map<String, String> failures,
        long rowsWritten,
        long tokensTotal,
        IndexStatistics statistics,
        List<IndexRow> sample,
        Duration elapsed
) {
    public enum Status {
        /** Index rebuilt and committed. */
        COMPLETED,
        /** Source was empty; nothing written. */
        NO_DOCUMENTS,
        /** Every document was empty or failed; nothing written. */
        NO_INDEXABLE_DOCUMENTS
    }

    public PipelineReport {
        indexed = List.copyOf(indexed);
        skipped = List.copyOf(skipped);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        sample = List.copyOf(sample);
    }

    static PipelineReport noDocuments(Duration elapsed) {
        return new PipelineReport(Status.NO_DOCUMENTS, 0, List.of(), List.of(), Map.of(),
                0, 0, IndexStatistics.EMPTY, List.of(), elapsed);
    }

    public boolean wroteIndex() {
        return status == Status.COMPLETED;
    }
}
