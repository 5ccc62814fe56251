package com.threatintel.auth.cache;

import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * The four advisory locks through which processes sharing one snapshot cache
 * agree on who rebuilds it.
 * <ul>
 *   <li>{@code GETJOB}: held briefly (exclusive) while deciding who rebuilds.</li>
 *   <li>{@code JOB}: held exclusive by the rebuilding process; others wait on it in shared mode.</li>
 *   <li>{@code ACTIVITY}: shared while a process is inside the coordinated section; the
 *       rebuilder takes it exclusive to wait until everybody else has left.</li>
 *   <li>{@code OUTCOME}: shared while waiting to consume a freshly written cache; the
 *       rebuilder takes it exclusive to wait until all consumers are done.</li>
 * </ul>
 * One instance stands for one process; it is not thread-safe.
 */
public class CacheLockSet {

    private static final Logger LOG = Logger.getLogger(CacheLockSet.class);

    private final CacheLock getJob;
    private final CacheLock job;
    private final CacheLock activity;
    private final CacheLock outcome;

    public CacheLockSet(Path dir) {
        this.getJob = new CacheLock(dir.resolve("GETJOB.lock"));
        this.job = new CacheLock(dir.resolve("JOB.lock"));
        this.activity = new CacheLock(dir.resolve("ACTIVITY.lock"));
        this.outcome = new CacheLock(dir.resolve("OUTCOME.lock"));
    }

    /**
     * Decides whether this process is the one that loads the directory and writes the cache.
     * On {@code true} the caller holds {@code JOB} (exclusive) and must release it.
     */
    public boolean designateLoadingAndPicklingJob() {
        getJob.lockExclusive();
        try {
            return job.tryLockExclusive();
        } finally {
            getJob.unlock();
        }
    }

    /**
     * Runs one coordinated refresh. Exactly one of the processes entering
     * concurrently runs {@code rebuild} (which is expected to write the cache);
     * the others wait for it to finish and then run {@code loadFromCache}.
     * <p>
     * The rebuilder starts only once every other process has left the section,
     * and returns only once every waiting process has consumed its result.
     */
    public <T> T coordinate(Supplier<T> rebuild, Supplier<T> loadFromCache) {
        activity.lockShared();
        try {
            if (designateLoadingAndPicklingJob()) {
                return runAsRebuilder(rebuild);
            }
            return runAsWaiter(loadFromCache);
        } finally {
            if (activity.isHeld()) {
                activity.unlock();
            }
        }
    }

    private <T> T runAsRebuilder(Supplier<T> rebuild) {
        LOG.debug("Designated to rebuild the shared snapshot cache");
        try {
            activity.unlock();
            activity.lockExclusive();
            return rebuild.get();
        } finally {
            if (activity.isHeld()) {
                activity.unlock();
            }
            job.unlock();
            outcome.lockExclusive();
            outcome.unlock();
        }
    }

    private <T> T runAsWaiter(Supplier<T> loadFromCache) {
        LOG.debug("Another process rebuilds the shared snapshot cache, waiting for it");
        outcome.lockShared();
        try {
            activity.unlock();
            job.lockShared();
            job.unlock();
            return loadFromCache.get();
        } finally {
            outcome.unlock();
        }
    }

    CacheLock getJobLock() {
        return job;
    }
}
