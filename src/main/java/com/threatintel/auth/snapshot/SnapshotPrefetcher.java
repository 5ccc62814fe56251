package com.threatintel.auth.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.auth.cache.CacheLockSet;
import com.threatintel.auth.cache.CachePayloadCodec;
import com.threatintel.auth.cache.PickleCacheStore;
import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.dto.CacheMetadata;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.engine.DirectoryViews;
import com.threatintel.auth.error.CacheIntegrityException;
import com.threatintel.auth.error.CommunicationException;
import com.threatintel.auth.error.UnrecoverableStalenessException;
import com.threatintel.auth.util.AlertLogger;
import com.threatintel.auth.util.AuthCoreMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the published directory snapshot fresh.
 * <p>
 * Each cycle peeks at the backend version and then either keeps the published
 * snapshot ({@link PrefetchOutcome#REUSE_LAST}), takes the one from the on-disk
 * cache when it is current or acceptably stale ({@link PrefetchOutcome#REUSE_PICKLE}),
 * or fetches and builds a new one ({@link PrefetchOutcome#REBUILD}). A rebuilt
 * snapshot has its expensive views computed before it is published, and is
 * written to the cache. With a shared cache, one process rebuilds while the
 * others wait and load its result (see {@link CacheLockSet}).
 * <p>
 * Cycles run on one background thread, each scheduling the next one. The delay
 * is the maximum sleep, or less if the published snapshot would otherwise become
 * unacceptably stale. A failed cycle is tolerated while the last successful one
 * is recent enough; beyond that the process is terminated, since serving
 * arbitrarily old authorization data is worse than not serving at all.
 */
@ApplicationScoped
public class SnapshotPrefetcher {

    private static final Logger LOG = Logger.getLogger(SnapshotPrefetcher.class);

    private static final Duration MIN_SLEEP = Duration.ofSeconds(1);

    private final DirectoryBackend backend;
    private final SnapshotAssembler assembler;
    private final DirectoryViews views;
    private final SnapshotHolder holder;
    private final AuthCoreMetrics metrics;
    private final AuthCoreConfig config;
    private final FatalErrorHandler fatalErrorHandler;
    private final ObjectMapper objectMapper;

    Clock clock = Clock.systemUTC();
    PickleCacheStore pickleStore;
    CacheLockSet locks;

    private final CancellationToken cancellationToken = new CancellationToken();
    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    private volatile Instant startedAt;
    private volatile Instant lastFreshAt;
    private volatile Instant staleDeadline;
    private volatile Long lastSeenVersion;
    private volatile double lastJobDurationSeconds;

    @Inject
    public SnapshotPrefetcher(DirectoryBackend backend,
                              SnapshotAssembler assembler,
                              DirectoryViews views,
                              SnapshotHolder holder,
                              AuthCoreMetrics metrics,
                              AuthCoreConfig config,
                              FatalErrorHandler fatalErrorHandler,
                              ObjectMapper objectMapper) {
        this.backend = backend;
        this.assembler = assembler;
        this.views = views;
        this.holder = holder;
        this.metrics = metrics;
        this.config = config;
        this.fatalErrorHandler = fatalErrorHandler;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        if (!config.isCacheEnabled()) {
            LOG.info("Snapshot cache is disabled");
            return;
        }
        Path dir = Paths.get(config.cacheDir.get());
        pickleStore = new PickleCacheStore(dir,
                new CachePayloadCodec(config.cacheSigningKey.orElseThrow(), clock),
                objectMapper,
                assembler);
        if (config.cacheShared) {
            locks = new CacheLockSet(dir);
        }
        LOG.infof("Snapshot cache at %s (shared: %s)", dir, config.cacheShared);
    }

    /**
     * Starts background refreshing, or, when prefetching is disabled, loads one
     * snapshot synchronously (errors propagate to the caller).
     */
    public void start() {
        startedAt = clock.instant();
        if (!config.prefetchEnabled) {
            LOG.info("Snapshot prefetching is disabled, loading one snapshot now");
            PrefetchOutcome outcome = runCycle();
            LOG.infof("Initial snapshot loaded (%s)", outcome);
            return;
        }

        LOG.infof("Starting SnapshotPrefetcher (max sleep: %ds, acceptable staleness: %ds, error tolerance: %ds)",
                config.maxSleepSeconds, config.acceptableStalenessSeconds, config.errorToleranceSeconds);
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "snapshot-prefetcher");
            thread.setDaemon(true);
            return thread;
        });
        schedule(Duration.ZERO);
    }

    @PreDestroy
    public void stop() {
        if (!running) {
            return;
        }
        LOG.info("Stopping SnapshotPrefetcher...");
        running = false;
        cancellationToken.cancel();

        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("SnapshotPrefetcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void schedule(Duration delay) {
        if (!running) {
            return;
        }
        try {
            scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Prefetcher scheduler shut down, not scheduling the next cycle");
        }
    }

    void tick() {
        if (!running) {
            return;
        }
        try {
            PrefetchOutcome outcome = runCycle();
            Duration delay = nextDelay();
            LOG.debugf("Prefetch cycle done (%s), next in %dms", outcome, delay.toMillis());
            schedule(delay);
        } catch (CancellationException e) {
            LOG.info("Prefetch cycle cancelled");
        } catch (RuntimeException e) {
            if (handleFailure(e)) {
                schedule(config.maxSleep());
            }
        } catch (Error e) {
            LOG.fatal("Prefetch cycle died", e);
            running = false;
            holder.failFirst(e);
            fatalErrorHandler.terminate(e);
        }
    }

    /**
     * Runs one refresh cycle on the calling thread.
     */
    PrefetchOutcome runCycle() {
        DirectoryVersion current = backend.peekVersion();
        boolean discardComparisonData = false;
        Long previous = lastSeenVersion;
        if (previous != null && current.version() < previous) {
            AlertLogger.backendVersionMovedBackward(current.version(), previous);
            discardComparisonData = true;
        }
        lastSeenVersion = current.version();

        DirectorySnapshot published = holder.peek();
        PrefetchOutcome outcome;
        if (!discardComparisonData && published != null && published.getVersion() == current.version()) {
            metrics.incrementReuseLast();
            outcome = PrefetchOutcome.REUSE_LAST;
        } else if (!discardComparisonData && reusePickle(current, published)) {
            metrics.incrementReusePickle();
            outcome = PrefetchOutcome.REUSE_PICKLE;
        } else if (locks != null) {
            outcome = locks.coordinate(() -> rebuildUnlessCached(current), () -> loadAfterRebuild(current));
        } else {
            rebuild();
            outcome = PrefetchOutcome.REBUILD;
        }

        lastFreshAt = clock.instant();
        updateStaleDeadline(current);
        return outcome;
    }

    private boolean reusePickle(DirectoryVersion current, DirectorySnapshot published) {
        if (pickleStore == null) {
            return false;
        }
        CacheMetadata metadata = pickleStore.readMetadata();
        if (metadata == null || !isAcceptable(metadata, current)) {
            return false;
        }
        if (published != null && published.getVersion() == metadata.version) {
            return true;
        }
        if (published != null && published.getVersion() > metadata.version) {
            return false;
        }
        DirectorySnapshot snapshot = loadPickle(metadata);
        if (snapshot == null) {
            return false;
        }
        lastJobDurationSeconds = metadata.jobDuration;
        publishLoaded(snapshot);
        return true;
    }

    /**
     * The cache is usable when it holds the current version, or an older one
     * while the directory has been at the current version for no longer than the
     * acceptable staleness plus the duration of the job that wrote the cache.
     */
    boolean isAcceptable(CacheMetadata metadata, DirectoryVersion current) {
        if (metadata.version == current.version()) {
            return true;
        }
        if (metadata.version > current.version()) {
            return false;
        }
        double staleSeconds = nowSeconds() - current.timestamp();
        return staleSeconds <= config.acceptableStalenessSeconds + metadata.jobDuration;
    }

    private PrefetchOutcome rebuildUnlessCached(DirectoryVersion current) {
        CacheMetadata metadata = pickleStore.readMetadata();
        if (metadata != null && metadata.version == current.version()) {
            DirectorySnapshot snapshot = loadPickle(metadata);
            if (snapshot != null) {
                LOG.infof("Snapshot cache already holds v%d, not rebuilding", metadata.version);
                lastJobDurationSeconds = metadata.jobDuration;
                publishLoaded(snapshot);
                metrics.incrementReusePickle();
                return PrefetchOutcome.REUSE_PICKLE;
            }
        }
        rebuild();
        return PrefetchOutcome.REBUILD;
    }

    /**
     * Takes the snapshot another process has just written. If that process failed,
     * the cache may still hold an old version, which is only taken while acceptable.
     */
    private PrefetchOutcome loadAfterRebuild(DirectoryVersion current) {
        CacheMetadata metadata = pickleStore.readMetadata();
        if (metadata == null) {
            throw new CacheIntegrityException("No snapshot cache after another process's rebuild");
        }
        if (!isAcceptable(metadata, current)) {
            throw new CommunicationException(String.format(
                    "Snapshot cache holds v%d after another process's rebuild, directory is at v%d",
                    metadata.version, current.version()));
        }
        DirectorySnapshot snapshot = pickleStore.load(metadata);
        lastJobDurationSeconds = metadata.jobDuration;
        publishLoaded(snapshot);
        metrics.incrementReusePickle();
        return PrefetchOutcome.REUSE_PICKLE;
    }

    private DirectorySnapshot loadPickle(CacheMetadata metadata) {
        try {
            return pickleStore.load(metadata);
        } catch (CacheIntegrityException e) {
            metrics.incrementCacheIntegrityFailure();
            AlertLogger.cacheIntegrityFailed(pickleStore.getPayloadPath().toString(), e.getMessage());
            return null;
        }
    }

    private void rebuild() {
        long start = clock.millis();
        DirectoryDocument document = backend.fetch(cancellationToken);
        DirectorySnapshot snapshot = assembler.assemble(document);
        views.warmUp(snapshot);
        long durationMs = clock.millis() - start;
        lastJobDurationSeconds = durationMs / 1000.0;
        metrics.incrementRebuild();
        metrics.recordRebuildDuration(durationMs);
        LOG.infof("Rebuilt directory snapshot v%d in %dms", snapshot.getVersion(), durationMs);

        if (pickleStore != null) {
            try {
                pickleStore.write(snapshot, lastJobDurationSeconds);
                metrics.incrementCacheWrite();
            } catch (IOException | RuntimeException e) {
                metrics.incrementCacheWriteFailure();
                LOG.errorf(e, "Failed to write snapshot v%d to cache", snapshot.getVersion());
            }
        }
        publish(snapshot);
    }

    private void publishLoaded(DirectorySnapshot snapshot) {
        views.warmUp(snapshot);
        publish(snapshot);
    }

    private void publish(DirectorySnapshot snapshot) {
        holder.publish(snapshot);
        metrics.recordPublishedVersion(snapshot.getVersion());
    }

    private void updateStaleDeadline(DirectoryVersion current) {
        DirectorySnapshot published = holder.peek();
        if (published == null || published.getVersion() >= current.version()) {
            staleDeadline = null;
            return;
        }
        double deadlineSeconds = current.timestamp() + config.acceptableStalenessSeconds + lastJobDurationSeconds;
        staleDeadline = Instant.ofEpochMilli((long) (deadlineSeconds * 1000));
    }

    /**
     * Delay before the next cycle.
     */
    Duration nextDelay() {
        Duration maxSleep = config.maxSleep();
        Instant deadline = staleDeadline;
        if (deadline == null) {
            return maxSleep;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.compareTo(MIN_SLEEP) < 0) {
            return MIN_SLEEP;
        }
        return remaining.compareTo(maxSleep) < 0 ? remaining : maxSleep;
    }

    /**
     * @return whether to keep going
     */
    boolean handleFailure(RuntimeException error) {
        metrics.incrementPrefetchFailure();
        Instant reference = lastFreshAt != null ? lastFreshAt : startedAt;
        long staleSeconds = reference == null ? 0 : Duration.between(reference, clock.instant()).getSeconds();
        DirectorySnapshot published = holder.peek();

        if (staleSeconds <= config.errorToleranceSeconds) {
            LOG.errorf(error, "Prefetch cycle failed");
            AlertLogger.snapshotRefreshFailed(published != null ? published.getVersion() : -1,
                    staleSeconds, error.toString());
            return true;
        }

        AlertLogger.stalenessUnrecoverable(staleSeconds, config.errorToleranceSeconds, error.toString());
        UnrecoverableStalenessException fatal = new UnrecoverableStalenessException(
                "No fresh directory snapshot for " + staleSeconds + "s", error);
        running = false;
        holder.failFirst(fatal);
        fatalErrorHandler.terminate(fatal);
        return false;
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    Instant getLastFreshAt() {
        return lastFreshAt;
    }

    void markStarted() {
        startedAt = clock.instant();
    }
}
