package com.media.lifecycle.metrics;

import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconciliationMetrics Tests")
class ReconciliationMetricsTest {

    @Nested
    @DisplayName("NoOpReconciliationMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallable() {
            NoOpReconciliationMetrics noOp = new NoOpReconciliationMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordRunDuration(JobKind.FULL_RECONCILIATION, JobStatus.COMPLETED, Duration.ofSeconds(1));
                noOp.incrementRunRejected(JobKind.INCREMENTAL_RECONCILIATION);
                noOp.recordItemsIngested("movies", 10);
                noOp.incrementSourceFailure("movies");
                noOp.recordDeletionCandidates(3);
                noOp.incrementDeleted(MediaType.MOVIE);
                noOp.incrementDeletionFailed(MediaType.TV_SHOW);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerReconciliationMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerReconciliationMetrics metrics = new MicrometerReconciliationMetrics(registry);

        @Test
        @DisplayName("Should record run duration tagged by kind and status")
        void runDuration() {
            metrics.recordRunDuration(JobKind.FULL_RECONCILIATION, JobStatus.COMPLETED, Duration.ofMillis(250));
            metrics.recordRunDuration(JobKind.FULL_RECONCILIATION, JobStatus.COMPLETED, Duration.ofMillis(750));

            Timer timer = registry.find("media.reconcile.duration")
                    .tag("kind", "full_sync").tag("status", "COMPLETED").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(1000, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        }

        @Test
        @DisplayName("Should count source failures per source")
        void sourceFailures() {
            metrics.incrementSourceFailure("radarr");
            metrics.incrementSourceFailure("radarr");
            metrics.incrementSourceFailure("sonarr");

            Counter radarr = registry.find("media.source.failures").tag("source", "radarr").counter();
            assertNotNull(radarr);
            assertEquals(2.0, radarr.count());
        }

        @Test
        @DisplayName("Should count deletions by media type code")
        void deletions() {
            metrics.incrementDeleted(MediaType.TV_SHOW);
            metrics.incrementDeletionFailed(MediaType.MOVIE);

            assertEquals(1.0, registry.find("media.deleted").tag("type", "tv").counter().count());
            assertEquals(1.0, registry.find("media.deletion.failed").tag("type", "movie").counter().count());
        }

        @Test
        @DisplayName("Should record ingest and candidate distributions")
        void distributions() {
            metrics.recordItemsIngested("radarr", 12);
            metrics.recordDeletionCandidates(4);

            DistributionSummary ingest = registry.find("media.ingest.items").tag("source", "radarr").summary();
            assertNotNull(ingest);
            assertEquals(12.0, ingest.totalAmount());
            assertEquals(4.0, registry.find("media.deletion.candidates").summary().totalAmount());
        }

        @Test
        @DisplayName("Should count rejected runs")
        void rejected() {
            metrics.incrementRunRejected(JobKind.INCREMENTAL_RECONCILIATION);

            assertEquals(1.0, registry.find("media.reconcile.rejected")
                    .tag("kind", "incremental_sync").counter().count());
        }
    }
}
