package com.threatintel.auth.snapshot;

/**
 * What one prefetch cycle did.
 */
public enum PrefetchOutcome {
    /** The published snapshot is current; nothing changed. */
    REUSE_LAST,
    /** The snapshot came from (or stayed as) the on-disk cache. */
    REUSE_PICKLE,
    /** The snapshot was built from a fresh backend fetch. */
    REBUILD
}
