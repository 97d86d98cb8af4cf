package com.media.lifecycle.reconcile;

import com.media.lifecycle.cache.CacheConfig;
import com.media.lifecycle.cache.CaffeineMediaCache;
import com.media.lifecycle.cache.MediaCache;
import com.media.lifecycle.cache.NoOpMediaCache;
import com.media.lifecycle.config.AtomicConfigProvider;
import com.media.lifecycle.config.ConfigProvider;
import com.media.lifecycle.config.LifecycleConfig;
import com.media.lifecycle.config.RuleType;
import com.media.lifecycle.config.SyncSettings;
import com.media.lifecycle.core.NotFoundException;
import com.media.lifecycle.core.SyncContext;
import com.media.lifecycle.core.model.DeletionCandidate;
import com.media.lifecycle.core.model.DeletionTimeline;
import com.media.lifecycle.core.model.MediaIds;
import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.core.model.ScheduledDeletion;
import com.media.lifecycle.exclusion.ExclusionRecord;
import com.media.lifecycle.exclusion.ExclusionStore;
import com.media.lifecycle.exclusion.FileExclusionStore;
import com.media.lifecycle.exclusion.InMemoryExclusionStore;
import com.media.lifecycle.health.HealthCheck;
import com.media.lifecycle.health.HealthCheckRegistry;
import com.media.lifecycle.health.HealthStatus;
import com.media.lifecycle.health.ReconciliationHealthCheck;
import com.media.lifecycle.health.SourceHealthCheck;
import com.media.lifecycle.job.FileJobLedger;
import com.media.lifecycle.job.InMemoryJobLedger;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobLedger;
import com.media.lifecycle.job.JobRecord;
import com.media.lifecycle.job.JobStatus;
import com.media.lifecycle.lock.LocalRunLock;
import com.media.lifecycle.lock.RunLock;
import com.media.lifecycle.logging.LogContext;
import com.media.lifecycle.metrics.NoOpReconciliationMetrics;
import com.media.lifecycle.metrics.ReconciliationMetrics;
import com.media.lifecycle.policy.PolicyDecision;
import com.media.lifecycle.policy.PolicyEngine;
import com.media.lifecycle.source.MediaSource;
import com.media.lifecycle.source.MovieCatalog;
import com.media.lifecycle.source.PlaybackHistorySource;
import com.media.lifecycle.source.RequestSource;
import com.media.lifecycle.source.SeriesCatalog;
import com.media.lifecycle.source.WatchHistorySource;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main entry point of the media lifecycle engine.
 *
 * <p>Keeps an in-memory library of every movie and show held by the catalogs, enriches it
 * with watch history and requests, evaluates the retention policy and, when deletion is
 * enabled and dry run is off, removes overdue items through their catalogs.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ReconciliationEngine engine = ReconciliationEngine.builder()
 *     .configProvider(configProvider)
 *     .movieCatalog(movies)
 *     .seriesCatalog(series)
 *     .watchHistorySource(mediaServer)
 *     .dataDirectory(Path.of("/var/lib/media-lifecycle"))
 *     .build();
 *
 * engine.start();
 * ReconciliationResult result = engine.fullReconciliation(SyncContext.of(SyncContext.API));
 * List&lt;MediaItem&gt; leaving = engine.getLeavingSoon();
 * </pre>
 *
 * <p>Only one reconciliation, full or incremental, runs at a time. A second caller gets
 * an {@link AlreadyRunningException} instead of waiting.</p>
 */
public class ReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final String RUN_LOCK_KEY = "reconciliation";
    static final int WOULD_DELETE_PREVIEW_LIMIT = 100;
    private static final int STATUS_JOB_LOOKBACK = 10;

    private final ConfigProvider configProvider;
    private final ExclusionStore exclusions;
    private final JobLedger jobs;
    private final MovieCatalog movieCatalog;
    private final SeriesCatalog seriesCatalog;
    private final WatchHistorySource watchHistory;
    private final PlaybackHistorySource playbackHistory;
    private final RequestSource requestSource;
    private final MediaCache cache;
    private final ReconciliationMetrics metrics;
    private final RunLock runLock;
    private final Clock clock;

    private final MediaLibrary library = new MediaLibrary();
    private final PolicyEngine policyEngine;
    private final CatalogIngestor ingestor;
    private final WatchHistoryMatcher watchMatcher;
    private final RequestMatcher requestMatcher;
    private final DeletionExecutor deletionExecutor;
    private final ReconciliationScheduler scheduler = new ReconciliationScheduler();
    private final ExecutorService manualExecutor;
    private final HealthCheckRegistry healthCheckRegistry;

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile boolean running;

    private ReconciliationEngine(Builder builder) {
        this.configProvider = builder.configProvider != null
                ? builder.configProvider : new AtomicConfigProvider();
        this.exclusions = builder.exclusionStore != null
                ? builder.exclusionStore : new InMemoryExclusionStore();
        this.jobs = builder.jobLedger != null
                ? builder.jobLedger : new InMemoryJobLedger();
        this.movieCatalog = builder.movieCatalog;
        this.seriesCatalog = builder.seriesCatalog;
        this.watchHistory = builder.watchHistorySource;
        this.playbackHistory = builder.playbackHistorySource;
        this.requestSource = builder.requestSource;
        this.cache = builder.cache != null ? builder.cache : new NoOpMediaCache();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpReconciliationMetrics();
        this.runLock = builder.runLock != null ? builder.runLock : new LocalRunLock();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.policyEngine = new PolicyEngine(configProvider, exclusions, clock);
        this.ingestor = new CatalogIngestor(library, clock);
        this.watchMatcher = new WatchHistoryMatcher(library);
        this.requestMatcher = new RequestMatcher(library);
        this.deletionExecutor = new DeletionExecutor(movieCatalog, seriesCatalog, watchHistory);
        this.manualExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("media-reconcile-manual-"));

        this.healthCheckRegistry = new HealthCheckRegistry();
        for (MediaSource source : configuredSources()) {
            healthCheckRegistry.register(new SourceHealthCheck(source));
        }
        healthCheckRegistry.register(new ReconciliationHealthCheck(jobs));
        for (HealthCheck check : builder.healthChecks) {
            healthCheckRegistry.register(check);
        }

        log.info("engine.initialized sources={} exclusions={}", configuredSources().size(), exclusions.size());
    }

    // ========== Lifecycle ==========

    /**
     * Arms the full and incremental timers with the configured intervals and, when
     * {@code autoStart} is set, launches one full reconciliation in the background.
     *
     * @throws AlreadyRunningException if the engine is already started
     */
    public void start() {
        SyncSettings sync = configProvider.current().sync();
        stateLock.lock();
        try {
            if (running) {
                throw new AlreadyRunningException("Reconciliation engine is already running");
            }
            scheduler.start(sync.fullInterval(), sync.incrementalInterval(),
                    this::scheduledFullRun, this::scheduledIncrementalRun);
            running = true;
        } finally {
            stateLock.unlock();
        }
        log.info("engine.started fullInterval={} incrementalInterval={} autoStart={}",
                sync.fullInterval(), sync.incrementalInterval(), sync.autoStart());

        if (sync.autoStart()) {
            triggerFullReconciliation(SyncContext.background());
        }
    }

    /**
     * Cancels both timers. Calling it on a stopped engine does nothing.
     * A run already in progress is not interrupted and finishes normally.
     */
    public void stop() {
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            scheduler.stop();
        } finally {
            stateLock.unlock();
        }
        log.info("engine.stopped");
    }

    /**
     * Re-arms the timers with the intervals of the current configuration.
     *
     * @return false if the engine is not running
     */
    public boolean restartScheduler() {
        SyncSettings sync = configProvider.current().sync();
        stateLock.lock();
        try {
            if (!running) {
                return false;
            }
            scheduler.stop();
            scheduler.start(sync.fullInterval(), sync.incrementalInterval(),
                    this::scheduledFullRun, this::scheduledIncrementalRun);
        } finally {
            stateLock.unlock();
        }
        log.info("engine.schedulerRestarted fullInterval={} incrementalInterval={}",
                sync.fullInterval(), sync.incrementalInterval());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs a full reconciliation on a background thread.
     * The future fails with {@link AlreadyRunningException} if another run holds the lock.
     */
    public CompletableFuture<ReconciliationResult> triggerFullReconciliation(SyncContext ctx) {
        CompletableFuture<ReconciliationResult> future =
                CompletableFuture.supplyAsync(() -> fullReconciliation(ctx), manualExecutor);
        future.whenComplete((result, error) -> {
            if (error != null) {
                log.warn("reconcile.triggeredRunFailed correlationId={} error={}",
                        ctx.correlationId(), error.getMessage());
            }
        });
        return future;
    }

    private void scheduledFullRun() {
        if (!running) {
            return;
        }
        try {
            fullReconciliation(SyncContext.background());
        } catch (AlreadyRunningException e) {
            log.debug("reconcile.scheduledSkipped kind={} reason={}", JobKind.FULL_RECONCILIATION, e.getMessage());
        }
    }

    private void scheduledIncrementalRun() {
        if (!running) {
            return;
        }
        try {
            incrementalReconciliation(SyncContext.background());
        } catch (AlreadyRunningException e) {
            log.debug("reconcile.scheduledSkipped kind={} reason={}",
                    JobKind.INCREMENTAL_RECONCILIATION, e.getMessage());
        }
    }

    // ========== Reconciliation ==========

    /**
     * Ingests every configured source, then applies exclusions and the retention policy,
     * computes deletion candidates and deletes them when deletion is live.
     *
     * <p>A failing source is logged, counted and recorded on the job; the run continues
     * with the remaining sources and still ends {@link JobStatus#COMPLETED}.</p>
     *
     * @throws AlreadyRunningException if another reconciliation is in progress
     */
    public ReconciliationResult fullReconciliation(SyncContext ctx) {
        acquireRunLock(JobKind.FULL_RECONCILIATION);
        try {
            return runFull(ctx);
        } finally {
            runLock.unlock(RUN_LOCK_KEY);
        }
    }

    private ReconciliationResult runFull(SyncContext ctx) {
        JobKind kind = JobKind.FULL_RECONCILIATION;
        Instant startedAt = clock.instant();
        JobRecord job = JobRecord.start(kind, startedAt);
        recordJob(job);

        try (LogContext lc = LogContext.forJob(ctx.correlationId(), job.id(), kind.code())) {
            LifecycleConfig config = configProvider.current();
            log.info("reconcile.started kind={} triggeredBy={} dryRun={} enableDeletion={}",
                    kind, ctx.triggeredBy(), config.app().dryRun(), config.app().enableDeletion());

            List<String> sourceErrors = new ArrayList<>();
            try {
                runStep("movies", movieCatalog, () -> ingestMovies(ctx), sourceErrors);
                runStep("series", seriesCatalog, () -> ingestSeries(ctx), sourceErrors);
                runStep("watch-history", watchHistory, () -> matchToWatchHistory(ctx), sourceErrors);
                runStep("playback-history", playbackHistory, () -> mergePlaybackHistory(ctx), sourceErrors);
                if (requestSource == null && config.hasActiveRule(RuleType.USER)) {
                    log.warn("reconcile.userRulesWithoutRequestSource rules will never match");
                }
                runStep("requests", requestSource, () -> matchToRequestSource(ctx), sourceErrors);

                applyExclusions();
                applyPolicy();
                CandidateSet candidates = computeDeletionCandidates();
                metrics.recordDeletionCandidates(candidates.count());

                DeletionOutcome outcome = DeletionOutcome.none();
                if (config.app().deletionsLive()) {
                    outcome = executeDeletions(ctx, candidates.candidates());
                } else if (!candidates.isEmpty()) {
                    log.info("reconcile.deletionsSkipped candidates={} dryRun={} enableDeletion={}",
                            candidates.count(), config.app().dryRun(), config.app().enableDeletion());
                }

                String lastError = sourceErrors.isEmpty() ? null : sourceErrors.get(sourceErrors.size() - 1);
                Map<String, Object> summary = fullSummary(config, candidates, outcome, sourceErrors);
                Instant completedAt = clock.instant();
                finishJob(job.finish(JobStatus.COMPLETED, completedAt, summary, lastError));

                Duration duration = Duration.between(startedAt, completedAt);
                metrics.recordRunDuration(kind, JobStatus.COMPLETED, duration);
                log.info("reconcile.completed kind={} totalMedia={} candidates={} deleted={} errors={} durationMs={}",
                        kind, summary.get("total_media"), candidates.count(), outcome.deletedCount(),
                        sourceErrors.size(), duration.toMillis());

                return new ReconciliationResult(job.id(), kind, JobStatus.COMPLETED,
                        countType(MediaType.MOVIE), countType(MediaType.TV_SHOW), library.size(),
                        candidates.count(), outcome.deletedCount(),
                        config.app().dryRun(), config.app().enableDeletion(),
                        sourceErrors, lastError, duration);
            } catch (RuntimeException e) {
                Instant completedAt = clock.instant();
                finishJob(job.finish(JobStatus.FAILED, completedAt,
                        Map.of("source_errors", sourceErrors), e.getMessage()));
                metrics.recordRunDuration(kind, JobStatus.FAILED, Duration.between(startedAt, completedAt));
                log.error("reconcile.failed kind={} error={}", kind, e.getMessage(), e);
                throw e;
            } finally {
                cache.invalidateAll();
            }
        }
    }

    /**
     * Refreshes watch data from the watch-history source only. No ingest, policy pass or
     * deletion happens. A source failure marks the job failed and is reported in the result.
     *
     * @throws AlreadyRunningException if another reconciliation is in progress
     */
    public ReconciliationResult incrementalReconciliation(SyncContext ctx) {
        acquireRunLock(JobKind.INCREMENTAL_RECONCILIATION);
        try {
            return runIncremental(ctx);
        } finally {
            runLock.unlock(RUN_LOCK_KEY);
        }
    }

    private ReconciliationResult runIncremental(SyncContext ctx) {
        JobKind kind = JobKind.INCREMENTAL_RECONCILIATION;
        Instant startedAt = clock.instant();
        JobRecord job = JobRecord.start(kind, startedAt);
        recordJob(job);

        try (LogContext lc = LogContext.forJob(ctx.correlationId(), job.id(), kind.code())) {
            log.info("reconcile.started kind={} triggeredBy={}", kind, ctx.triggeredBy());
            JobStatus status = JobStatus.COMPLETED;
            String error = null;
            List<String> sourceErrors = new ArrayList<>();
            WatchMatchStats stats = WatchMatchStats.empty();
            if (watchHistory == null) {
                log.debug("reconcile.stepSkipped step=watch-history reason=not configured");
            } else {
                try {
                    stats = matchToWatchHistory(ctx);
                } catch (RuntimeException e) {
                    status = JobStatus.FAILED;
                    error = e.getMessage();
                    sourceErrors.add("watch-history: " + e.getMessage());
                    metrics.incrementSourceFailure(watchHistory.name());
                    log.error("reconcile.stepFailed step=watch-history source={} error={}",
                            watchHistory.name(), e.getMessage(), e);
                }
            }
            cache.invalidateAll();

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("matched", stats.matched());
            summary.put("not_found", stats.notFound());
            summary.put("metadata_mismatch", stats.mismatched());
            summary.put("total_media", library.size());
            summary.put("source_errors", sourceErrors);

            Instant completedAt = clock.instant();
            finishJob(job.finish(status, completedAt, summary, error));
            Duration duration = Duration.between(startedAt, completedAt);
            metrics.recordRunDuration(kind, status, duration);
            log.info("reconcile.completed kind={} status={} compared={} matched={} durationMs={}",
                    kind, status, stats.total(), stats.matched(), duration.toMillis());

            LifecycleConfig config = configProvider.current();
            return new ReconciliationResult(job.id(), kind, status,
                    countType(MediaType.MOVIE), countType(MediaType.TV_SHOW), library.size(),
                    0, 0, config.app().dryRun(), config.app().enableDeletion(),
                    sourceErrors, error, duration);
        }
    }

    private void acquireRunLock(JobKind kind) {
        if (!runLock.tryLock(RUN_LOCK_KEY)) {
            metrics.incrementRunRejected(kind);
            throw new AlreadyRunningException("A reconciliation is already in progress; rejected " + kind.code());
        }
    }

    private void runStep(String step, MediaSource source, Runnable action, List<String> sourceErrors) {
        if (source == null) {
            log.debug("reconcile.stepSkipped step={} reason=not configured", step);
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            metrics.incrementSourceFailure(source.name());
            sourceErrors.add(step + ": " + e.getMessage());
            log.error("reconcile.stepFailed step={} source={} error={}", step, source.name(), e.getMessage(), e);
        }
    }

    private Map<String, Object> fullSummary(LifecycleConfig config, CandidateSet candidates,
                                            DeletionOutcome outcome, List<String> sourceErrors) {
        List<DeletionCandidate> preview = candidates.candidates();
        if (preview.size() > WOULD_DELETE_PREVIEW_LIMIT) {
            preview = preview.subList(0, WOULD_DELETE_PREVIEW_LIMIT);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("movies", countType(MediaType.MOVIE));
        summary.put("tv_shows", countType(MediaType.TV_SHOW));
        summary.put("total_media", library.size());
        summary.put("scheduled_deletions", candidates.count());
        summary.put("deleted_count", outcome.deletedCount());
        summary.put("dry_run", config.app().dryRun());
        summary.put("enable_deletion", config.app().enableDeletion());
        summary.put("would_delete", List.copyOf(preview));
        summary.put("deleted_items", outcome.deletedItems());
        summary.put("source_errors", List.copyOf(sourceErrors));
        return summary;
    }

    private void recordJob(JobRecord job) {
        try {
            jobs.add(job);
        } catch (RuntimeException e) {
            log.warn("job.persistFailed jobId={} error={}", job.id(), e.getMessage());
        }
    }

    private void finishJob(JobRecord job) {
        try {
            if (!jobs.update(job)) {
                jobs.add(job);
            }
        } catch (RuntimeException e) {
            log.warn("job.persistFailed jobId={} status={} error={}", job.id(), job.status(), e.getMessage());
        }
    }

    // ========== Ingest and enrichment ==========

    /**
     * Pulls every movie from the movie catalog and replaces the matching library entries.
     *
     * @return number of movies ingested, 0 when no movie catalog is configured
     */
    public int ingestMovies(SyncContext ctx) {
        if (movieCatalog == null) {
            return 0;
        }
        int count = ingestor.ingestMovies(movieCatalog.name(), movieCatalog.listMovies(ctx),
                movieCatalog::listTags, ctx);
        metrics.recordItemsIngested(movieCatalog.name(), count);
        return count;
    }

    /**
     * Pulls every series from the series catalog and replaces the matching library entries.
     *
     * @return number of series ingested, 0 when no series catalog is configured
     */
    public int ingestSeries(SyncContext ctx) {
        if (seriesCatalog == null) {
            return 0;
        }
        int count = ingestor.ingestSeries(seriesCatalog.name(), seriesCatalog.listSeries(ctx),
                seriesCatalog::listTags, ctx);
        metrics.recordItemsIngested(seriesCatalog.name(), count);
        return count;
    }

    /**
     * Matches movies by TMDB id and shows by TVDB id against the watch-history source.
     */
    public WatchMatchStats matchToWatchHistory(SyncContext ctx) {
        if (watchHistory == null) {
            return WatchMatchStats.empty();
        }
        String name = watchHistory.name();
        WatchMatchStats stats = watchMatcher.match(MediaType.MOVIE, watchHistory.listMovies(ctx), name);
        stats = stats.plus(watchMatcher.match(MediaType.TV_SHOW, watchHistory.listShows(ctx), name));
        metrics.recordItemsIngested(name, stats.matched());
        return stats;
    }

    /**
     * Applies play activity from the playback-history source to already matched items.
     *
     * @return number of items updated
     */
    public int mergePlaybackHistory(SyncContext ctx) {
        if (playbackHistory == null) {
            return 0;
        }
        int updated = watchMatcher.mergePlaybackHistory(playbackHistory.listPlaybackHistory(ctx),
                playbackHistory.name());
        metrics.recordItemsIngested(playbackHistory.name(), updated);
        return updated;
    }

    /**
     * Marks items requested from approved and available requests.
     *
     * @return number of requests matched to an item
     */
    public int matchToRequestSource(SyncContext ctx) {
        if (requestSource == null) {
            return 0;
        }
        int matched = requestMatcher.match(requestSource.listRequests(ctx), requestSource.name());
        metrics.recordItemsIngested(requestSource.name(), matched);
        return matched;
    }

    // ========== Policy ==========

    /**
     * Sets the excluded flag of every item from the exclusion store.
     *
     * @return number of items whose flag changed
     */
    public int applyExclusions() {
        int changed = library.write(items -> {
            int count = 0;
            for (MediaItem item : items.values()) {
                boolean excluded = exclusions.isExcluded(MediaIds.externalId(item));
                if (item.isExcluded() != excluded) {
                    item.setExcluded(excluded);
                    count++;
                }
            }
            return count;
        });
        log.debug("policy.exclusionsApplied changed={} stored={}", changed, exclusions.size());
        return changed;
    }

    /**
     * Writes the schedule of every item from the current retention policy.
     *
     * @return number of items with a scheduled deletion
     */
    public int applyPolicy() {
        Instant now = clock.instant();
        int scheduled = library.write(items -> {
            int count = 0;
            for (MediaItem item : items.values()) {
                if (applyDecision(item, now)) {
                    count++;
                }
            }
            return count;
        });
        log.info("policy.applied items={} scheduled={}", library.size(), scheduled);
        return scheduled;
    }

    /**
     * Re-evaluates every item after a configuration change and clears derived caches.
     */
    public int reapplyRetentionRules() {
        int scheduled = applyPolicy();
        cache.invalidateAll();
        return scheduled;
    }

    private boolean applyDecision(MediaItem item, Instant now) {
        PolicyDecision decision = policyEngine.evaluate(item);
        if (!decision.hasSchedule()) {
            item.clearSchedule();
            return false;
        }
        int daysUntilDue = (int) Duration.between(now, decision.deleteAfter()).toDays();
        item.applySchedule(decision.deleteAfter(), daysUntilDue,
                policyEngine.generateDeletionReason(item, decision));
        return true;
    }

    /**
     * Returns the non-excluded items whose scheduled deletion time has passed,
     * earliest first. Nothing is modified.
     */
    public CandidateSet computeDeletionCandidates() {
        Instant now = clock.instant();
        List<DeletionCandidate> candidates = library.read(items -> {
            List<DeletionCandidate> found = new ArrayList<>();
            for (MediaItem item : items.values()) {
                if (item.isExcluded() || item.getDeleteAfter() == null || !now.isAfter(item.getDeleteAfter())) {
                    continue;
                }
                long daysOverdue = Duration.between(item.getDeleteAfter(), now).toDays();
                found.add(DeletionCandidate.of(item, daysOverdue));
            }
            return found;
        });
        candidates.sort(Comparator.comparing(DeletionCandidate::deleteAfter));
        log.info("policy.candidatesComputed count={}", candidates.size());
        return CandidateSet.of(candidates);
    }

    // ========== Deletion ==========

    /**
     * Deletes each candidate. Candidates without an id are skipped; a failing item is logged
     * and the batch continues.
     */
    public DeletionOutcome executeDeletions(SyncContext ctx, List<DeletionCandidate> candidates) {
        List<DeletionCandidate> deleted = new ArrayList<>();
        for (DeletionCandidate candidate : candidates) {
            if (candidate.id() == null || candidate.id().isBlank()) {
                log.warn("deletion.skipped title='{}' reason=missing id", candidate.title());
                continue;
            }
            try {
                deleteMedia(ctx, candidate.id(), false);
                deleted.add(candidate);
            } catch (RuntimeException e) {
                log.error("deletion.failed mediaId={} title='{}' error={}",
                        candidate.id(), candidate.title(), e.getMessage(), e);
            }
        }
        log.info("deletion.batchCompleted candidates={} deleted={}", candidates.size(), deleted.size());
        return new DeletionOutcome(deleted.size(), deleted);
    }

    /**
     * Deletes one item through the catalogs that own it and removes it from the library.
     * With {@code simulate} set, only logs what would be deleted.
     *
     * @throws NotFoundException if the item is not in the library
     */
    public void deleteMedia(SyncContext ctx, String mediaId, boolean simulate) {
        try (LogContext lc = LogContext.forDeletion(ctx.correlationId(), mediaId, simulate)) {
            MediaItem item = library.get(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
            if (simulate) {
                log.info("deletion.simulated mediaId={} title='{}' type={} sizeBytes={}",
                        mediaId, item.getTitle(), item.getType(), item.getFileSize());
                return;
            }
            try {
                deletionExecutor.delete(ctx, item);
            } catch (RuntimeException e) {
                metrics.incrementDeletionFailed(item.getType());
                throw e;
            }
            library.remove(mediaId);
            metrics.incrementDeleted(item.getType());
            cache.invalidateAll();
            log.info("deletion.completed mediaId={} title='{}' type={} sizeBytes={} triggeredBy={}",
                    mediaId, item.getTitle(), item.getType(), item.getFileSize(), ctx.triggeredBy());
        }
    }

    // ========== Exclusions ==========

    /**
     * Protects an item from deletion. The record is persisted before the item is updated.
     *
     * @throws NotFoundException if the item is not in the library
     * @throws com.media.lifecycle.storage.PersistenceException if the record cannot be saved
     */
    public ExclusionRecord addExclusion(SyncContext ctx, String mediaId, String reason) {
        try (LogContext lc = LogContext.forExclusion(ctx.correlationId(), mediaId)) {
            MediaItem item = library.get(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
            ExclusionRecord record = new ExclusionRecord(
                    MediaIds.externalId(item),
                    MediaIds.sourceSystem(item),
                    item.getType(),
                    item.getTitle(),
                    clock.instant(),
                    ctx.triggeredBy(),
                    reason);
            exclusions.add(record);
            library.update(mediaId, stored -> {
                stored.setExcluded(true);
                stored.clearSchedule();
            });
            cache.invalidateAll();
            log.info("exclusion.added mediaId={} externalId={} title='{}' by={}",
                    mediaId, record.externalId(), item.getTitle(), ctx.triggeredBy());
            return record;
        }
    }

    /**
     * Lifts the exclusion of an item and recomputes its schedule.
     *
     * @return true if an exclusion was removed
     * @throws NotFoundException if the item is not in the library
     */
    public boolean removeExclusion(SyncContext ctx, String mediaId) {
        try (LogContext lc = LogContext.forExclusion(ctx.correlationId(), mediaId)) {
            MediaItem item = library.get(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
            boolean removed = exclusions.remove(MediaIds.externalId(item));
            Instant now = clock.instant();
            library.update(mediaId, stored -> {
                stored.setExcluded(false);
                applyDecision(stored, now);
            });
            cache.invalidateAll();
            log.info("exclusion.removed mediaId={} removed={} by={}", mediaId, removed, ctx.triggeredBy());
            return removed;
        }
    }

    public List<ExclusionRecord> getExclusions() {
        return exclusions.getAll();
    }

    // ========== Queries ==========

    public List<MediaItem> getMediaList() {
        return library.snapshot();
    }

    public Optional<MediaItem> getMediaById(String mediaId) {
        return library.get(mediaId);
    }

    public int getMediaCount() {
        return library.size();
    }

    /**
     * Copies of every item keyed by id.
     */
    public Map<String, MediaItem> getMediaLibrarySnapshot() {
        return library.snapshotMap();
    }

    public EngineStatus getStatus() {
        int[] counts = library.read(items -> {
            int movies = 0;
            int shows = 0;
            int excluded = 0;
            for (MediaItem item : items.values()) {
                if (item.getType() == MediaType.MOVIE) {
                    movies++;
                } else {
                    shows++;
                }
                if (item.isExcluded()) {
                    excluded++;
                }
            }
            return new int[]{items.size(), movies, shows, excluded};
        });

        Instant lastFull = null;
        Instant lastIncremental = null;
        for (JobRecord job : jobs.getRecent(STATUS_JOB_LOOKBACK)) {
            if (job.status() != JobStatus.COMPLETED) {
                continue;
            }
            if (job.kind() == JobKind.FULL_RECONCILIATION && lastFull == null) {
                lastFull = job.completedAt();
            } else if (job.kind() == JobKind.INCREMENTAL_RECONCILIATION && lastIncremental == null) {
                lastIncremental = job.completedAt();
            }
        }

        SyncSettings sync = configProvider.current().sync();
        return new EngineStatus(running, counts[0], counts[1], counts[2], counts[3],
                sync.fullInterval(), sync.incrementalInterval(), lastFull, lastIncremental,
                runLock.isLocked(RUN_LOCK_KEY));
    }

    /**
     * Items due for deletion within the configured leaving-soon window, with their
     * schedule and reason. Cached until the next reconciliation or library change.
     */
    public List<MediaItem> getLeavingSoon() {
        Optional<LeavingSoon> cached = cache.get(MediaCache.LEAVING_SOON, LeavingSoon.class);
        if (cached.isPresent()) {
            return copies(cached.get().items());
        }
        int window = configProvider.current().app().leavingSoonDays();
        List<MediaItem> items = library.read(map -> policyEngine.getLeavingSoon(map.values(), window));
        items.sort(Comparator.comparing(MediaItem::getDeleteAfter));
        cache.put(MediaCache.LEAVING_SOON, new LeavingSoon(List.copyOf(items)));
        return copies(items);
    }

    /**
     * Scheduled deletions of non-excluded items grouped by UTC due date.
     */
    public DeletionTimeline getDeletionTimeline() {
        Optional<DeletionTimeline> cached = cache.get(MediaCache.DELETION_TIMELINE, DeletionTimeline.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        Instant now = clock.instant();
        int window = configProvider.current().app().leavingSoonDays();
        DeletionTimeline timeline = library.read(items -> {
            Map<LocalDate, List<ScheduledDeletion>> byDate = new TreeMap<>();
            List<ScheduledDeletion> leavingSoon = new ArrayList<>();
            int total = 0;
            long totalSize = 0;
            for (MediaItem item : items.values()) {
                if (item.isExcluded() || item.getDeleteAfter() == null) {
                    continue;
                }
                int daysUntilDue = (int) Duration.between(now, item.getDeleteAfter()).toDays();
                ScheduledDeletion entry = new ScheduledDeletion(item.getId(), item.getTitle(), item.getYear(),
                        item.getType(), item.getFileSize(), item.getDeleteAfter(), daysUntilDue,
                        item.getDeletionReason());
                LocalDate due = LocalDate.ofInstant(item.getDeleteAfter(), ZoneOffset.UTC);
                byDate.computeIfAbsent(due, d -> new ArrayList<>()).add(entry);
                if (daysUntilDue > 0 && daysUntilDue <= window) {
                    leavingSoon.add(entry);
                }
                total++;
                totalSize += item.getFileSize();
            }
            leavingSoon.sort(Comparator.comparing(ScheduledDeletion::deleteAfter));
            return new DeletionTimeline(total, totalSize, byDate, leavingSoon);
        });
        cache.put(MediaCache.DELETION_TIMELINE, timeline);
        return timeline;
    }

    /**
     * @throws NotFoundException if no job with that id is retained
     */
    public JobRecord getJob(String jobId) {
        return jobs.get(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    }

    public List<JobRecord> getRecentJobs(int limit) {
        return jobs.getRecent(limit);
    }

    public Optional<JobRecord> getLatestJob() {
        return jobs.getLatest();
    }

    /**
     * Pings every configured source and reports on the latest full reconciliation.
     */
    public HealthStatus checkHealth() {
        HealthStatus health = healthCheckRegistry.checkAll();
        if (health.isDown()) {
            log.warn("health.down message={}", health.message());
        }
        return health;
    }

    public PolicyEngine policyEngine() {
        return policyEngine;
    }

    @Override
    public void close() {
        stop();
        manualExecutor.shutdown();
        try {
            if (!manualExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                manualExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            manualExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("engine.closed");
    }

    private int countType(MediaType type) {
        return library.read(items -> (int) items.values().stream()
                .filter(item -> item.getType() == type)
                .count());
    }

    private List<MediaSource> configuredSources() {
        List<MediaSource> sources = new ArrayList<>();
        for (MediaSource source : new MediaSource[]{movieCatalog, seriesCatalog, watchHistory,
                playbackHistory, requestSource}) {
            if (source != null) {
                sources.add(source);
            }
        }
        return sources;
    }

    private static List<MediaItem> copies(List<MediaItem> items) {
        List<MediaItem> result = new ArrayList<>(items.size());
        for (MediaItem item : items) {
            result.add(item.copy());
        }
        return result;
    }

    private record LeavingSoon(List<MediaItem> items) {}

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConfigProvider configProvider;
        private ExclusionStore exclusionStore;
        private JobLedger jobLedger;
        private MovieCatalog movieCatalog;
        private SeriesCatalog seriesCatalog;
        private WatchHistorySource watchHistorySource;
        private PlaybackHistorySource playbackHistorySource;
        private RequestSource requestSource;
        private MediaCache cache;
        private ReconciliationMetrics metrics;
        private RunLock runLock;
        private Clock clock;
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Sets the configuration source. Defaults to an {@link AtomicConfigProvider} with defaults.
         */
        public Builder configProvider(ConfigProvider configProvider) {
            this.configProvider = configProvider;
            return this;
        }

        /**
         * Uses a fixed configuration snapshot.
         */
        public Builder config(LifecycleConfig config) {
            this.configProvider = ConfigProvider.fixed(config);
            return this;
        }

        public Builder exclusionStore(ExclusionStore exclusionStore) {
            this.exclusionStore = exclusionStore;
            return this;
        }

        public Builder jobLedger(JobLedger jobLedger) {
            this.jobLedger = jobLedger;
            return this;
        }

        /**
         * Persists exclusions and job history as JSON files in the given directory.
         */
        public Builder dataDirectory(Path dataDir) {
            this.exclusionStore = new FileExclusionStore(dataDir);
            this.jobLedger = new FileJobLedger(dataDir);
            return this;
        }

        public Builder movieCatalog(MovieCatalog movieCatalog) {
            this.movieCatalog = movieCatalog;
            return this;
        }

        public Builder seriesCatalog(SeriesCatalog seriesCatalog) {
            this.seriesCatalog = seriesCatalog;
            return this;
        }

        /**
         * Sets the media server used for watch data and library rescans.
         */
        public Builder watchHistorySource(WatchHistorySource watchHistorySource) {
            this.watchHistorySource = watchHistorySource;
            return this;
        }

        public Builder playbackHistorySource(PlaybackHistorySource playbackHistorySource) {
            this.playbackHistorySource = playbackHistorySource;
            return this;
        }

        public Builder requestSource(RequestSource requestSource) {
            this.requestSource = requestSource;
            return this;
        }

        public Builder cache(MediaCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Caches derived views as described by the config, publishing cache meters to the
         * registry when one is given.
         */
        public Builder cache(CacheConfig config, MeterRegistry registry) {
            this.cache = CaffeineMediaCache.create(config, registry);
            return this;
        }

        public Builder metrics(ReconciliationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder runLock(RunLock runLock) {
            this.runLock = runLock;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Registers an additional health check.
         */
        public Builder healthCheck(HealthCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public ReconciliationEngine build() {
            return new ReconciliationEngine(this);
        }
    }
}
