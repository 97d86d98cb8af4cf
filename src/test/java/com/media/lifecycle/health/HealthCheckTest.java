package com.media.lifecycle.health;

import com.media.lifecycle.job.InMemoryJobLedger;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobRecord;
import com.media.lifecycle.job.JobStatus;
import com.media.lifecycle.source.MediaSource;
import com.media.lifecycle.source.SourceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should set the status")
        void factories() {
            assertEquals(HealthStatus.Status.UP, HealthStatus.up().status());
            assertTrue(HealthStatus.down("x").isDown());
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.degraded("y").status());
            assertEquals("OK", HealthStatus.up().message());
        }

        @Test
        @DisplayName("worse() should pick the more severe status")
        void worse() {
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.Status.UP.worse(HealthStatus.Status.DEGRADED));
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.DOWN.worse(HealthStatus.Status.UP));
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.Status.DEGRADED.worse(HealthStatus.Status.DEGRADED));
        }

        @Test
        @DisplayName("failed() should be DOWN and record the exception type")
        void failedCarriesExceptionType() {
            HealthStatus status = HealthStatus.failed("Unreachable", new IllegalStateException("refused"));

            assertTrue(status.isDown());
            assertEquals("Unreachable: refused", status.message());
            assertEquals("IllegalStateException", status.details().get("error"));
        }

        @Test
        @DisplayName("withDetail() should add details without changing status")
        void withDetail() {
            HealthStatus status = HealthStatus.up().withDetail("latencyMs", 3L);

            assertEquals(HealthStatus.Status.UP, status.status());
            assertEquals(3L, status.details().get("latencyMs"));
        }
    }

    @Nested
    @DisplayName("SourceHealthCheck")
    class SourceHealthCheckTests {

        @Test
        @DisplayName("Reachable source should be UP with latency")
        void reachable() {
            MediaSource source = mock(MediaSource.class);
            when(source.name()).thenReturn("radarr");

            SourceHealthCheck check = new SourceHealthCheck(source);
            HealthStatus status = check.check();

            assertEquals("source:radarr", check.name());
            assertEquals(HealthStatus.Status.UP, status.status());
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("Unreachable source should be DOWN")
        void unreachable() {
            MediaSource source = mock(MediaSource.class);
            when(source.name()).thenReturn("sonarr");
            doThrow(new SourceUnavailableException("sonarr", "connection refused")).when(source).ping(any());

            HealthStatus status = new SourceHealthCheck(source).check();

            assertTrue(status.isDown());
            assertTrue(status.message().contains("connection refused"));
            assertEquals("SourceUnavailableException", status.details().get("error"));
        }
    }

    @Nested
    @DisplayName("ReconciliationHealthCheck")
    class ReconciliationHealthCheckTests {

        @Test
        @DisplayName("No finished full run should be UP")
        void noRuns() {
            InMemoryJobLedger jobs = new InMemoryJobLedger();
            jobs.add(JobRecord.start(JobKind.FULL_RECONCILIATION, T0));

            assertEquals(HealthStatus.Status.UP, new ReconciliationHealthCheck(jobs).check().status());
        }

        @Test
        @DisplayName("Completed run with errors should be DEGRADED")
        void completedWithErrors() {
            InMemoryJobLedger jobs = new InMemoryJobLedger();
            jobs.add(JobRecord.start(JobKind.FULL_RECONCILIATION, T0)
                    .finish(JobStatus.COMPLETED, T0.plusSeconds(1), Map.of(), "series: timeout"));

            assertEquals(HealthStatus.Status.DEGRADED, new ReconciliationHealthCheck(jobs).check().status());
        }

        @Test
        @DisplayName("Failed run should be DOWN, ignoring later incremental runs")
        void failed() {
            InMemoryJobLedger jobs = new InMemoryJobLedger();
            jobs.add(JobRecord.start(JobKind.FULL_RECONCILIATION, T0)
                    .finish(JobStatus.FAILED, T0.plusSeconds(1), Map.of(), "boom"));
            jobs.add(JobRecord.start(JobKind.INCREMENTAL_RECONCILIATION, T0.plusSeconds(5))
                    .finish(JobStatus.COMPLETED, T0.plusSeconds(6), Map.of(), null));

            assertTrue(new ReconciliationHealthCheck(jobs).check().isDown());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry should be UP")
        void empty() {
            assertEquals(HealthStatus.Status.UP, new HealthCheckRegistry().checkAll().status());
        }

        @Test
        @DisplayName("Worst status should win")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            registry.register(fixed("c", HealthStatus.down("gone")));

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDown());
            assertEquals("c: gone", aggregate.message());
            assertEquals(3, aggregate.details().size());
        }

        @Test
        @DisplayName("Degraded without down should be DEGRADED")
        void degraded() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));

            assertEquals(HealthStatus.Status.DEGRADED, registry.checkAll().status());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("A throwing check should be reported DOWN without failing the others")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("no ledger");
                }
            });

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDown());
            assertEquals("broken: check failed: no ledger", aggregate.message());
            assertEquals(2, aggregate.details().size());
        }

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String name() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }
}
