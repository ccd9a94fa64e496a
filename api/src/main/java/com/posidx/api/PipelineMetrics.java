package com.posidx.api;

import com.posidx.common.DocumentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Micrometer meters of an index build.
 *
 * A disabled instance keeps the same call surface and records nothing.
 */
public final class PipelineMetrics {

    private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);

    public static final String PHASE_TIMER = "posidx.phase.duration";
    public static final String DOCUMENTS_COUNTER = "posidx.documents";
    public static final String ROWS_SUMMARY = "posidx.rows.written";

    private final MeterRegistry registry;
    private final boolean enabled;

    private final Map<String, Timer> timers = new HashMap<>();
    private final Map<String, Long> startTimes = new HashMap<>();
    private final Map<DocumentOutcome.Status, Counter> outcomes = new EnumMap<>(DocumentOutcome.Status.class);
    private final DistributionSummary rowsWritten;

    public PipelineMetrics(MeterRegistry registry) {
        this(registry, true);
    }

    private PipelineMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.enabled = enabled;
        for (DocumentOutcome.Status s : DocumentOutcome.Status.values()) {
            outcomes.put(s, Counter.builder(DOCUMENTS_COUNTER)
                    .tag("outcome", s.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.rowsWritten = DistributionSummary.builder(ROWS_SUMMARY)
                .description("Rows written per index build")
                .register(registry);
    }

    public static PipelineMetrics disabled() {
        return new PipelineMetrics(new SimpleMeterRegistry(), false);
    }

    public synchronized void start(String phase) {
        if (!enabled) return;
        timers.computeIfAbsent(
                phase,
                k -> Timer.builder(PHASE_TIMER)
                        .tag("phase", k)
                        .register(registry)
        );
        startTimes.put(phase, System.nanoTime());
    }

    public synchronized void stop(String phase) {
        if (!enabled) return;
        Long st = startTimes.remove(phase);
        Timer t = timers.get(phase);
        if (t != null && st != null) {
            long nanos = System.nanoTime() - st;
            t.record(nanos, TimeUnit.NANOSECONDS);
            log.debug("Phase {} took {} ms", phase, TimeUnit.NANOSECONDS.toMillis(nanos));
        }
    }

    public void recordOutcome(DocumentOutcome.Status status) {
        if (enabled) outcomes.get(status).increment();
    }

    public void recordRowsWritten(long rows) {
        if (enabled) rowsWritten.record(rows);
    }

    /**
     * One line per meter of this run, sorted by name and tags. Empty when disabled.
     */
    public List<String> describe() {
        if (!enabled) return List.of();
        List<String> lines = new ArrayList<>();
        for (Meter m : registry.getMeters()) {
            String id = m.getId().getName() + m.getId().getTags().stream()
                    .map(tag -> tag.getKey() + "=" + tag.getValue())
                    .collect(Collectors.joining(",", "{", "}"));
            if (m instanceof Timer t) {
                lines.add(String.format(Locale.ROOT, "%s count=%d total=%.3fms max=%.3fms",
                        id, t.count(), t.totalTime(TimeUnit.MILLISECONDS), t.max(TimeUnit.MILLISECONDS)));
            } else if (m instanceof Counter c) {
                lines.add(String.format(Locale.ROOT, "%s count=%.0f", id, c.count()));
            } else if (m instanceof DistributionSummary s) {
                lines.add(String.format(Locale.ROOT, "%s count=%d total=%.0f", id, s.count(), s.totalAmount()));
            }
        }
        Collections.sort(lines);
        return lines;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
