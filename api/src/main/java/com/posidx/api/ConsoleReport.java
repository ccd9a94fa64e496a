package com.posidx.api;

import com.posidx.common.IndexRow;
import com.posidx.common.IndexStatistics;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operator-facing text for a finished run. Not a machine-readable format.
 */
public final class ConsoleReport {

    private static final String RULE = "=".repeat(80);

    private final int samplePositions;

    public ConsoleReport(int samplePositions) {
        if (samplePositions <= 0) throw new IllegalArgumentException("samplePositions must be positive");
        this.samplePositions = samplePositions;
    }

    public String render(PipelineReport report) {
        return render(report, PipelineMetrics.disabled());
    }

    /** Same as {@link #render(PipelineReport)}, followed by the run's meters when metrics are enabled. */
    public String render(PipelineReport report, PipelineMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
          .append("POSITIONAL INDEX BUILDER").append('\n')
          .append(RULE).append('\n');

        sb.append(String.format(Locale.ROOT, "Loaded %d documents from database%n", report.documentsLoaded()));

        switch (report.status()) {
            case NO_DOCUMENTS -> sb.append("No documents found. Upload documents first.\n");
            case NO_INDEXABLE_DOCUMENTS -> {
                appendFailures(sb, report.failures());
                sb.append("No decryptable documents found. Upload documents first.\n");
            }
            case COMPLETED -> {
                sb.append(String.format(Locale.ROOT, "Decrypted %d documents for indexing (%d empty, %d failed)%n",
                        report.indexed().size(), report.skipped().size(), report.failures().size()));
                appendFailures(sb, report.failures());
                sb.append(String.format(Locale.ROOT, "Built index with %d term-document pairs from %d tokens%n",
                        report.rowsWritten(), report.tokensTotal()));

                IndexStatistics s = report.statistics();
                sb.append('\n').append("Index statistics:\n")
                  .append("   Total unique terms: ").append(s.distinctTerms()).append('\n')
                  .append("   Total documents indexed: ").append(s.distinctDocuments()).append('\n')
                  .append("   Total term-document pairs: ").append(s.totalRows()).append('\n');

                if (!report.sample().isEmpty()) {
                    sb.append('\n').append("Sample index entries:\n");
                    for (IndexRow row : report.sample()) {
                        sb.append("   ").append(formatRow(row)).append('\n');
                    }
                }
            }
        }

        List<String> meters = metrics.describe();
        if (!meters.isEmpty()) {
            sb.append('\n').append("Metrics:\n");
            for (String line : meters) {
                sb.append("   ").append(line).append('\n');
            }
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append(report.wroteIndex()
                ? "POSITIONAL INDEX BUILD COMPLETED SUCCESSFULLY"
                : "POSITIONAL INDEX BUILD FINISHED, NOTHING TO INDEX").append('\n');
        sb.append(String.format(Locale.ROOT, "Elapsed: %d ms%n", report.elapsed().toMillis()));
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    public void print(PipelineReport report, PipelineMetrics metrics, PrintStream out) {
        out.print(render(report, metrics));
        out.flush();
    }

    /** {@code term: doc -> [p1, p2, ..., ...]}, cut after the configured number of positions. */
    String formatRow(IndexRow row) {
        List<Integer> positions = row.getPositions();
        String shown = positions.stream()
                .limit(samplePositions)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        if (positions.size() > samplePositions) {
            shown += ", ...";
        }
        return row.getTerm() + ": " + row.getDocId() + " -> [" + shown + "]";
    }

    private static void appendFailures(StringBuilder sb, Map<String, String> failures) {
        failures.forEach((id, msg) -> sb.append("   failed ").append(id).append(": ").append(msg).append('\n'));
    }
}
