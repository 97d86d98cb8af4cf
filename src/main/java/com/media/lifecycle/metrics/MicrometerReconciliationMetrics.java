package com.media.lifecycle.metrics;

import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link ReconciliationMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code media.reconcile.duration}: Timer (tags: kind, status)</li>
 *   <li>{@code media.reconcile.rejected}: Counter (tag: kind)</li>
 *   <li>{@code media.ingest.items}: DistributionSummary (tag: source)</li>
 *   <li>{@code media.source.failures}: Counter (tag: source)</li>
 *   <li>{@code media.deletion.candidates}: DistributionSummary</li>
 *   <li>{@code media.deleted}: Counter (tag: type)</li>
 *   <li>{@code media.deletion.failed}: Counter (tag: type)</li>
 * </ul>
 */
public class MicrometerReconciliationMetrics implements ReconciliationMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidateSummary;

    public MicrometerReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.candidateSummary = DistributionSummary.builder("media.deletion.candidates")
                .description("Number of deletion candidates per full reconciliation")
                .register(registry);
    }

    @Override
    public void recordRunDuration(JobKind kind, JobStatus status, Duration duration) {
        String key = kind.name() + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("media.reconcile.duration")
                        .description("Duration of reconciliation runs")
                        .tag("kind", kind.code())
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRunRejected(JobKind kind) {
        counter("rejected:" + kind.name(), "media.reconcile.rejected",
                "Reconciliation runs rejected because another run was in flight", "kind", kind.code())
                .increment();
    }

    @Override
    public void recordItemsIngested(String source, int count) {
        DistributionSummary summary = summaryCache.computeIfAbsent(source, k ->
                DistributionSummary.builder("media.ingest.items")
                        .description("Items ingested per source per run")
                        .tag("source", source)
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void incrementSourceFailure(String source) {
        counter("failure:" + source, "media.source.failures",
                "Failed source calls during reconciliation", "source", source)
                .increment();
    }

    @Override
    public void recordDeletionCandidates(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void incrementDeleted(MediaType type) {
        counter("deleted:" + type.name(), "media.deleted",
                "Media items deleted", "type", type.code())
                .increment();
    }

    @Override
    public void incrementDeletionFailed(MediaType type) {
        counter("deleteFailed:" + type.name(), "media.deletion.failed",
                "Media deletions that failed", "type", type.code())
                .increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
