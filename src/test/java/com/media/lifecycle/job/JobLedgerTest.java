package com.media.lifecycle.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobLedger Tests")
class JobLedgerTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Nested
    @DisplayName("JobRecord")
    class JobRecordTests {

        @Test
        @DisplayName("start() should create a running job")
        void startCreatesRunning() {
            JobRecord job = JobRecord.start(JobKind.FULL_RECONCILIATION, T0);

            assertNotNull(job.id());
            assertEquals(JobStatus.RUNNING, job.status());
            assertFalse(job.isCompleted());
            assertTrue(job.summary().isEmpty());
        }

        @Test
        @DisplayName("finish() should compute duration and keep the error")
        void finishComputesDuration() {
            JobRecord job = JobRecord.start(JobKind.FULL_RECONCILIATION, T0)
                    .finish(JobStatus.COMPLETED, T0.plusMillis(1500), Map.of("movies", 3), "series: timeout");

            assertEquals(1500, job.durationMs());
            assertTrue(job.isCompleted());
            assertEquals(3, job.summary().get("movies"));
            assertEquals("series: timeout", job.error());
        }

        @Test
        @DisplayName("A job should move to a terminal status only once")
        void terminalOnce() {
            JobRecord done = JobRecord.start(JobKind.INCREMENTAL_RECONCILIATION, T0)
                    .finish(JobStatus.FAILED, T0.plusSeconds(1), Map.of(), "boom");

            assertThrows(IllegalStateException.class,
                    () -> done.finish(JobStatus.COMPLETED, T0.plusSeconds(2), Map.of(), null));
            assertThrows(IllegalArgumentException.class,
                    () -> JobRecord.start(JobKind.FULL_RECONCILIATION, T0)
                            .finish(JobStatus.RUNNING, T0, Map.of(), null));
        }
    }

    @Nested
    @DisplayName("InMemoryJobLedger")
    class InMemoryTests {

        @Test
        @DisplayName("Should keep the newest jobs first and evict beyond capacity")
        void boundedNewestFirst() {
            InMemoryJobLedger ledger = new InMemoryJobLedger(3);
            for (int i = 0; i < 5; i++) {
                ledger.add(JobRecord.start(JobKind.FULL_RECONCILIATION, T0.plusSeconds(i)));
            }

            List<JobRecord> all = ledger.getAll();
            assertEquals(3, all.size());
            assertEquals(T0.plusSeconds(4), all.get(0).startedAt());
            assertEquals(T0.plusSeconds(2), all.get(2).startedAt());
            assertEquals(all.get(0), ledger.getLatest().orElseThrow());
            assertEquals(2, ledger.getRecent(2).size());
            assertTrue(ledger.getRecent(0).isEmpty());
        }

        @Test
        @DisplayName("update() should replace by id and report misses")
        void updateById() {
            InMemoryJobLedger ledger = new InMemoryJobLedger();
            JobRecord job = JobRecord.start(JobKind.FULL_RECONCILIATION, T0);
            ledger.add(job);

            assertTrue(ledger.update(job.finish(JobStatus.COMPLETED, T0.plusSeconds(1), Map.of(), null)));
            assertEquals(JobStatus.COMPLETED, ledger.get(job.id()).orElseThrow().status());
            assertFalse(ledger.update(JobRecord.start(JobKind.FULL_RECONCILIATION, T0)));
        }
    }

    @Nested
    @DisplayName("FileJobLedger")
    class FileLedgerTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Jobs should survive a restart, newest first")
        void persistsAcrossInstances() {
            FileJobLedger ledger = new FileJobLedger(tempDir);
            JobRecord first = JobRecord.start(JobKind.FULL_RECONCILIATION, T0);
            JobRecord second = JobRecord.start(JobKind.INCREMENTAL_RECONCILIATION, T0.plusSeconds(60));
            ledger.add(first);
            ledger.add(second);
            ledger.update(first.finish(JobStatus.COMPLETED, T0.plusSeconds(5),
                    Map.of("movies", 2, "source_errors", List.of()), null));

            FileJobLedger reopened = new FileJobLedger(tempDir);

            List<JobRecord> all = reopened.getAll();
            assertEquals(2, all.size());
            assertEquals(second.id(), all.get(0).id());
            JobRecord restored = reopened.get(first.id()).orElseThrow();
            assertEquals(JobStatus.COMPLETED, restored.status());
            assertEquals(5000, restored.durationMs());
            assertEquals(2, restored.summary().get("movies"));
        }

        @Test
        @DisplayName("Loading should trim to capacity")
        void trimsOnLoad() {
            FileJobLedger ledger = new FileJobLedger(tempDir, 10);
            for (int i = 0; i < 6; i++) {
                ledger.add(JobRecord.start(JobKind.FULL_RECONCILIATION, T0.plusSeconds(i)));
            }

            FileJobLedger smaller = new FileJobLedger(tempDir, 4);

            assertEquals(4, smaller.getAll().size());
            assertEquals(T0.plusSeconds(5), smaller.getLatest().orElseThrow().startedAt());
        }

        @Test
        @DisplayName("Corrupt file should start an empty ledger")
        void corruptFileStartsFresh() throws IOException {
            Files.writeString(tempDir.resolve(FileJobLedger.FILE_NAME), "[[[");

            assertTrue(new FileJobLedger(tempDir).getAll().isEmpty());
        }
    }
}
