package com.posidx.api;

import com.posidx.common.DocumentOutcome;
import com.posidx.common.DocumentSource;
import com.posidx.common.EncryptedDocument;
import com.posidx.common.FailurePolicy;
import com.posidx.common.IndexPersistenceException;
import com.posidx.common.IndexRow;
import com.posidx.common.IndexStatistics;
import com.posidx.common.PositionalIndexWriter;
import com.posidx.crypto.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Full rebuild of the positional index: load, parallel map, fan-in, one transactional write.
 *
 * <ul>
 *   <li>Load: every document of the source, in doc_id order.</li>
 *   <li>Map: decrypt, tokenize and build positions per document on a fixed pool; {@code invokeAll}
 *       is the barrier, nothing is written while a worker is still running.</li>
 *   <li>Fan-in: outcomes are consumed in source order, so the row list is deterministic.</li>
 *   <li>Write: {@link PositionalIndexWriter#replaceAll(List)} once, then statistics and a sample.</li>
 * </ul>
 * An empty source, or one where no document yields content, ends the run without touching the index.
 */
public class PositionalIndexPipeline {

    private static final Logger log = LoggerFactory.getLogger(PositionalIndexPipeline.class);

    private final DocumentSource source;
    private final PositionalIndexWriter writer;
    private final PipelineContext context;

    public PositionalIndexPipeline(DocumentSource source, PositionalIndexWriter writer, PipelineContext context) {
        this.source = Objects.requireNonNull(source, "source");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * @throws PipelineException under {@link FailurePolicy#FAIL_FAST} when a document cannot be decrypted,
     *         and under any policy when a worker fails for a reason other than decryption
     * @throws IndexPersistenceException when the source cannot be read or the write is rolled back
     */
    public PipelineReport run() throws IndexPersistenceException {
        long t0 = System.nanoTime();
        PipelineMetrics metrics = context.getMetrics();

        metrics.start("load");
        List<EncryptedDocument> documents;
        try {
            documents = source.loadAll();
        } finally {
            metrics.stop("load");
        }
        log.info("Loaded {} documents", documents.size());

        if (documents.isEmpty()) {
            log.info("No documents found, index left untouched");
            return PipelineReport.noDocuments(elapsedSince(t0));
        }

        metrics.start("map");
        List<DocumentOutcome> outcomes;
        try {
            outcomes = mapAll(documents);
        } finally {
            metrics.stop("map");
        }

        List<String> indexed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        List<IndexRow> rows = new ArrayList<>();
        long tokens = 0;

        for (DocumentOutcome o : outcomes) {
            metrics.recordOutcome(o.getStatus());
            switch (o.getStatus()) {
                case INDEXED -> {
                    indexed.add(o.getDocId());
                    rows.addAll(o.getEntry().toRows());
                    tokens += o.getEntry().getTokenCount();
                }
                case SKIPPED -> skipped.add(o.getDocId());
                case FAILED -> {
                    if (context.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                        throw new PipelineException(o.getDocId(), "Index build aborted, document could not be processed",
                                o.getFailure());
                    }
                    log.warn("Skipping document {}: {}", o.getDocId(), o.getFailure().getMessage());
                    failures.put(o.getDocId(), o.getFailure().getMessage());
                }
            }
        }
        log.info("Decrypted {} documents for indexing ({} empty, {} failed)",
                indexed.size(), skipped.size(), failures.size());

        if (indexed.isEmpty()) {
            log.info("No decryptable documents found, index left untouched");
            return new PipelineReport(PipelineReport.Status.NO_INDEXABLE_DOCUMENTS, documents.size(),
                    indexed, skipped, failures, 0, 0, IndexStatistics.EMPTY, List.of(), elapsedSince(t0));
        }
        log.info("Built index with {} term-document pairs", rows.size());

        metrics.start("write");
        IndexStatistics stats;
        try {
            stats = writer.replaceAll(rows);
        } finally {
            metrics.stop("write");
        }
        metrics.recordRowsWritten(rows.size());
        log.info("Index statistics: {} terms, {} documents, {} rows",
                stats.distinctTerms(), stats.distinctDocuments(), stats.totalRows());

        List<IndexRow> sample = writer.sample(context.getSampleSize());
        return new PipelineReport(PipelineReport.Status.COMPLETED, documents.size(), indexed, skipped, failures,
                rows.size(), tokens, stats, sample, elapsedSince(t0));
    }

    private List<DocumentOutcome> mapAll(List<EncryptedDocument> documents) {
        int threads = Math.min(context.getParallelism(), documents.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<DocumentOutcome>> tasks = new ArrayList<>(documents.size());
            for (EncryptedDocument d : documents) {
                tasks.add(() -> context.getIndexer().index(d));
            }
            List<Future<DocumentOutcome>> futures = pool.invokeAll(tasks);

            List<DocumentOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(collect(futures.get(i), documents.get(i).getDocId()));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(null, "Interrupted while indexing documents", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static DocumentOutcome collect(Future<DocumentOutcome> future, String docId) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // decryption failures come back as outcomes; anything thrown here is a defect
            Throwable cause = e.getCause();
            if (cause instanceof DecryptionException de) {
                return DocumentOutcome.failed(docId, de);
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new PipelineException(docId, "Unexpected worker failure", cause);
        }
    }

    private static Duration elapsedSince(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }
}
