package com.posidx.api;

import com.posidx.common.DocumentOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    @Test
    void recordsPhasesOutcomesAndRows() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PipelineMetrics metrics = new PipelineMetrics(registry);

        metrics.start("map");
        metrics.stop("map");
        metrics.stop("write");
        metrics.recordOutcome(DocumentOutcome.Status.INDEXED);
        metrics.recordOutcome(DocumentOutcome.Status.INDEXED);
        metrics.recordOutcome(DocumentOutcome.Status.FAILED);
        metrics.recordRowsWritten(6);

        assertEquals(1, registry.get(PipelineMetrics.PHASE_TIMER).tag("phase", "map").timer().count());
        assertNull(registry.find(PipelineMetrics.PHASE_TIMER).tag("phase", "write").timer());
        assertEquals(2.0, registry.get(PipelineMetrics.DOCUMENTS_COUNTER).tag("outcome", "indexed").counter().count());
        assertEquals(1.0, registry.get(PipelineMetrics.DOCUMENTS_COUNTER).tag("outcome", "failed").counter().count());
        assertEquals(0.0, registry.get(PipelineMetrics.DOCUMENTS_COUNTER).tag("outcome", "skipped").counter().count());
        assertEquals(6.0, registry.get(PipelineMetrics.ROWS_SUMMARY).summary().totalAmount());
    }

    @Test
    void describe_listsEveryMeterSorted() {
        PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
        metrics.start("write");
        metrics.stop("write");
        metrics.recordOutcome(DocumentOutcome.Status.INDEXED);
        metrics.recordRowsWritten(6);

        List<String> lines = metrics.describe();

        assertEquals(5, lines.size());
        assertEquals(lines.stream().sorted().toList(), lines);
        assertTrue(lines.contains("posidx.documents{outcome=indexed} count=1"));
        assertTrue(lines.contains("posidx.documents{outcome=failed} count=0"));
        assertTrue(lines.contains("posidx.rows.written{} count=1 total=6"));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("posidx.phase.duration{phase=write} count=1 total=")));
        assertTrue(PipelineMetrics.disabled().describe().isEmpty());
    }

    @Test
    void disabledMetricsRecordNothing() {
        PipelineMetrics metrics = PipelineMetrics.disabled();
        metrics.start("load");
        metrics.stop("load");
        metrics.recordOutcome(DocumentOutcome.Status.SKIPPED);
        metrics.recordRowsWritten(3);

        assertFalse(metrics.isEnabled());
        assertNull(metrics.getRegistry().find(PipelineMetrics.PHASE_TIMER).timer());
        assertEquals(0.0, metrics.getRegistry().get(PipelineMetrics.DOCUMENTS_COUNTER)
                .tag("outcome", "skipped").counter().count());
    }
}
