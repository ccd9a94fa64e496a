package com.posidx.api;

import com.posidx.common.DocumentOutcome;
import com.posidx.common.DocumentSource;
import com.posidx.common.EncryptedDocument;
import com.posidx.common.FailurePolicy;
import com.posidx.common.IndexRow;
import com.posidx.common.IndexStatistics;
import com.posidx.common.PositionalIndexWriter;
import com.posidx.crypto.AesGcmDocumentDecryptor;
import com.posidx.crypto.AuthenticationFailureException;
import com.posidx.crypto.DocumentEncryptor;
import com.posidx.index.core.PositionalIndexBuilder;
import com.posidx.index.core.Tokenizer;
import com.posidx.key.LegacyKeyNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.crypto.SecretKey;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class PositionalIndexPipelineTest {

    private static final SecretKey KEY = LegacyKeyNormalizer.toSecretKey("pipeline-test-secret");

    private DocumentSource source;
    private PositionalIndexWriter writer;
    private SimpleMeterRegistry registry;
    private DocumentEncryptor encryptor;

    @BeforeEach
    void setUp() throws Exception {
        source = mock(DocumentSource.class);
        writer = mock(PositionalIndexWriter.class);
        registry = new SimpleMeterRegistry();
        encryptor = new DocumentEncryptor(KEY);
        when(writer.replaceAll(anyList())).thenReturn(new IndexStatistics(1, 1, 1));
        when(writer.sample(anyInt())).thenReturn(List.of());
    }

    private PositionalIndexPipeline pipeline(FailurePolicy policy) {
        PipelineContext ctx = new PipelineContext(KEY, new AesGcmDocumentDecryptor(), new Tokenizer(),
                new PositionalIndexBuilder(), policy, 4, 10, new PipelineMetrics(registry));
        return new PositionalIndexPipeline(source, writer, ctx);
    }

    private EncryptedDocument tampered(String docId, String content) {
        EncryptedDocument d = encryptor.encrypt(docId, content);
        char first = d.getAuthTag().charAt(0);
        String tag = (first == '0' ? '1' : '0') + d.getAuthTag().substring(1);
        return new EncryptedDocument(docId, d.getEncryptedContent(), d.getIv(), tag);
    }

    private double outcomes(String outcome) {
        return registry.get(PipelineMetrics.DOCUMENTS_COUNTER).tag("outcome", outcome).counter().count();
    }

    @Test
    void emptySource_isNoOpWithoutWriterCall() throws Exception {
        when(source.loadAll()).thenReturn(List.of());

        PipelineReport report = pipeline(FailurePolicy.FAIL_FAST).run();

        assertEquals(PipelineReport.Status.NO_DOCUMENTS, report.status());
        assertFalse(report.wroteIndex());
        verifyNoInteractions(writer);
    }

    @Test
    void allDocumentsEmpty_isNoOpWithoutWriterCall() throws Exception {
        when(source.loadAll()).thenReturn(List.of(
                new EncryptedDocument("1", null, null, null),
                new EncryptedDocument("2", "", "", ""),
                encryptor.encrypt("3", "")));

        PipelineReport report = pipeline(FailurePolicy.FAIL_FAST).run();

        assertEquals(PipelineReport.Status.NO_INDEXABLE_DOCUMENTS, report.status());
        assertEquals(List.of("1", "2", "3"), report.skipped());
        assertEquals(3, report.documentsLoaded());
        verifyNoInteractions(writer);
        assertEquals(3.0, outcomes("skipped"));
    }

    @Test
    void rowsFollowSourceOrder() throws Exception {
        when(source.loadAll()).thenReturn(List.of(
                encryptor.encrypt("1", "the cat sat"),
                new EncryptedDocument("2", null, null, null),
                encryptor.encrypt("3", "the dog sat")));

        PipelineReport report = pipeline(FailurePolicy.FAIL_FAST).run();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IndexRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(writer).replaceAll(rows.capture());
        assertEquals(List.of(
                new IndexRow("the", "1", List.of(0)),
                new IndexRow("cat", "1", List.of(1)),
                new IndexRow("sat", "1", List.of(2)),
                new IndexRow("the", "3", List.of(0)),
                new IndexRow("dog", "3", List.of(1)),
                new IndexRow("sat", "3", List.of(2))), rows.getValue());
        verify(writer).sample(10);

        assertEquals(PipelineReport.Status.COMPLETED, report.status());
        assertEquals(List.of("1", "3"), report.indexed());
        assertEquals(List.of("2"), report.skipped());
        assertEquals(6, report.rowsWritten());
        assertEquals(6, report.tokensTotal());
        assertEquals(2.0, outcomes("indexed"));
        assertEquals(6.0, registry.get(PipelineMetrics.ROWS_SUMMARY).summary().totalAmount());
        assertEquals(1, registry.get(PipelineMetrics.PHASE_TIMER).tag("phase", "write").timer().count());
    }

    @Test
    void failFast_abortsBeforeAnyWrite() throws Exception {
        when(source.loadAll()).thenReturn(List.of(
                encryptor.encrypt("1", "fine"),
                tampered("2", "corrupt"),
                encryptor.encrypt("3", "also fine")));

        PipelineException e = assertThrows(PipelineException.class, () -> pipeline(FailurePolicy.FAIL_FAST).run());

        assertEquals("2", e.getDocId());
        assertInstanceOf(AuthenticationFailureException.class, e.getCause());
        verifyNoInteractions(writer);
    }

    @Test
    void skipFailed_indexesTheRestAndReportsFailures() throws Exception {
        when(source.loadAll()).thenReturn(List.of(
                encryptor.encrypt("1", "alpha beta"),
                tampered("2", "corrupt"),
                encryptor.encrypt("3", "beta gamma")));

        PipelineReport report = pipeline(FailurePolicy.SKIP_FAILED).run();

        assertEquals(PipelineReport.Status.COMPLETED, report.status());
        assertEquals(List.of("1", "3"), report.indexed());
        assertEquals(List.of("2"), List.copyOf(report.failures().keySet()));
        assertEquals(4, report.rowsWritten());
        verify(writer).replaceAll(anyList());
        assertEquals(1.0, outcomes("failed"));
    }

    @Test
    void skipFailed_allFailing_isNoOp() throws Exception {
        when(source.loadAll()).thenReturn(List.of(tampered("1", "x"), tampered("2", "y")));

        PipelineReport report = pipeline(FailurePolicy.SKIP_FAILED).run();

        assertEquals(PipelineReport.Status.NO_INDEXABLE_DOCUMENTS, report.status());
        assertEquals(2, report.failures().size());
        verifyNoInteractions(writer);
    }

    @Test
    void unexpectedWorkerException_abortsEvenUnderSkipPolicy() throws Exception {
        AesGcmDocumentDecryptor broken = mock(AesGcmDocumentDecryptor.class);
        when(broken.decrypt(any(EncryptedDocument.class), any(SecretKey.class)))
                .thenThrow(new IllegalStateException("boom"));
        when(source.loadAll()).thenReturn(List.of(encryptor.encrypt("1", "text"), encryptor.encrypt("2", "more")));
        PipelineContext ctx = new PipelineContext(KEY, broken, new Tokenizer(), new PositionalIndexBuilder(),
                FailurePolicy.SKIP_FAILED, 2, 10, new PipelineMetrics(registry));

        PipelineException e = assertThrows(PipelineException.class,
                () -> new PositionalIndexPipeline(source, writer, ctx).run());

        assertEquals("1", e.getDocId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("boom", e.getCause().getMessage());
        assertEquals(0.0, outcomes("failed"));
        verifyNoInteractions(writer);
    }

    @Test
    void indexerOutcome_matchesContextIndexer() {
        PipelineContext ctx = new PipelineContext(KEY, new AesGcmDocumentDecryptor(), new Tokenizer(),
                new PositionalIndexBuilder(), FailurePolicy.FAIL_FAST, 1, 0, PipelineMetrics.disabled());
        DocumentOutcome o = ctx.getIndexer().index(encryptor.encrypt("9", "a b a"));
        assertEquals(List.of(0, 2), o.getEntry().positionsOf("a"));
    }
}
