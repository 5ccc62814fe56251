package com.threatintel.auth.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters for snapshot prefetching, cache activity and authentication
 * failures, read through {@link #snapshot()}.
 */
@ApplicationScoped
public class AuthCoreMetrics {

    private final AtomicLong prefetchReuseLastTotal = new AtomicLong();
    private final AtomicLong prefetchReusePickleTotal = new AtomicLong();
    private final AtomicLong prefetchRebuildTotal = new AtomicLong();
    private final AtomicLong prefetchFailureTotal = new AtomicLong();
    private final AtomicLong rebuildDurationMsLast = new AtomicLong();
    private final AtomicLong publishedVersionLast = new AtomicLong(-1);

    private final AtomicLong cacheWriteTotal = new AtomicLong();
    private final AtomicLong cacheWriteFailureTotal = new AtomicLong();
    private final AtomicLong cacheIntegrityFailureTotal = new AtomicLong();

    private final AtomicLong authenticationFailureTotal = new AtomicLong();

    public void incrementReuseLast() {
        prefetchReuseLastTotal.incrementAndGet();
    }

    public void incrementReusePickle() {
        prefetchReusePickleTotal.incrementAndGet();
    }

    public void incrementRebuild() {
        prefetchRebuildTotal.incrementAndGet();
    }

    public void incrementPrefetchFailure() {
        prefetchFailureTotal.incrementAndGet();
    }

    public void recordRebuildDuration(long ms) {
        rebuildDurationMsLast.set(ms);
    }

    public void recordPublishedVersion(long version) {
        publishedVersionLast.set(version);
    }

    public void incrementCacheWrite() {
        cacheWriteTotal.incrementAndGet();
    }

    public void incrementCacheWriteFailure() {
        cacheWriteFailureTotal.incrementAndGet();
    }

    public void incrementCacheIntegrityFailure() {
        cacheIntegrityFailureTotal.incrementAndGet();
    }

    public void incrementAuthenticationFailure() {
        authenticationFailureTotal.incrementAndGet();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("prefetch_reuse_last_total", prefetchReuseLastTotal.get());
        m.put("prefetch_reuse_pickle_total", prefetchReusePickleTotal.get());
        m.put("prefetch_rebuild_total", prefetchRebuildTotal.get());
        m.put("prefetch_failure_total", prefetchFailureTotal.get());
        m.put("rebuild_duration_ms_last", rebuildDurationMsLast.get());
        m.put("published_version_last", publishedVersionLast.get());
        m.put("cache_write_total", cacheWriteTotal.get());
        m.put("cache_write_failure_total", cacheWriteFailureTotal.get());
        m.put("cache_integrity_failure_total", cacheIntegrityFailureTotal.get());
        m.put("authentication_failure_total", authenticationFailureTotal.get());
        return m;
    }
}
