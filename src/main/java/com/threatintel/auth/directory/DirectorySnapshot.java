package com.threatintel.auth.directory;

import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.util.IpAddresses.IpRange;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Immutable in-memory copy of the whole directory at one version, plus a table
 * of views derived from it.
 * <p>
 * Nodes are held in typed id-to-node tables, sorted by id. All references
 * between nodes were checked when the snapshot was assembled (see
 * {@link SnapshotAssembler}), so lookups by a referenced id never fail.
 * <p>
 * Derived views are computed at most once per snapshot through {@link #memoize}.
 * The snapshot also keeps the document it was assembled from, which is what the
 * snapshot cache persists.
 */
public final class DirectorySnapshot {

    private final long version;
    private final double timestamp;
    private final List<String> ignoredIpNetworks;
    private final List<IpRange> ignoredIpRanges;
    private final SortedMap<String, Organization> organizations;
    private final SortedMap<String, OrganizationGroup> organizationGroups;
    private final SortedMap<String, Source> sources;
    private final SortedMap<String, Subsource> subsources;
    private final SortedMap<String, SubsourceGroup> subsourceGroups;
    private final SortedMap<String, CriteriaContainer> criteriaContainers;
    private final DirectoryDocument document;

    private final ConcurrentMap<String, Object> memo = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> memoLocks = new ConcurrentHashMap<>();

    DirectorySnapshot(long version,
                      double timestamp,
                      List<String> ignoredIpNetworks,
                      List<IpRange> ignoredIpRanges,
                      Map<String, Organization> organizations,
                      Map<String, OrganizationGroup> organizationGroups,
                      Map<String, Source> sources,
                      Map<String, Subsource> subsources,
                      Map<String, SubsourceGroup> subsourceGroups,
                      Map<String, CriteriaContainer> criteriaContainers,
                      DirectoryDocument document) {
        this.version = version;
        this.timestamp = timestamp;
        this.ignoredIpNetworks = List.copyOf(ignoredIpNetworks);
        this.ignoredIpRanges = List.copyOf(ignoredIpRanges);
        this.organizations = sorted(organizations);
        this.organizationGroups = sorted(organizationGroups);
        this.sources = sorted(sources);
        this.subsources = sorted(subsources);
        this.subsourceGroups = sorted(subsourceGroups);
        this.criteriaContainers = sorted(criteriaContainers);
        this.document = document;
    }

    private static <V> SortedMap<String, V> sorted(Map<String, V> nodes) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
    }

    public long getVersion() {
        return version;
    }

    /**
     * Seconds since the epoch at which the directory reached this version.
     */
    public double getTimestamp() {
        return timestamp;
    }

    public List<String> getIgnoredIpNetworks() {
        return ignoredIpNetworks;
    }

    public List<IpRange> getIgnoredIpRanges() {
        return ignoredIpRanges;
    }

    public SortedMap<String, Organization> getOrganizations() {
        return organizations;
    }

    public SortedMap<String, OrganizationGroup> getOrganizationGroups() {
        return organizationGroups;
    }

    public SortedMap<String, Source> getSources() {
        return sources;
    }

    public SortedMap<String, Subsource> getSubsources() {
        return subsources;
    }

    public SortedMap<String, SubsourceGroup> getSubsourceGroups() {
        return subsourceGroups;
    }

    public SortedMap<String, CriteriaContainer> getCriteriaContainers() {
        return criteriaContainers;
    }

    public Organization getOrganization(String id) {
        return organizations.get(id);
    }

    public Subsource getSubsource(String id) {
        return subsources.get(id);
    }

    /**
     * The document this snapshot was assembled from. Must not be modified.
     */
    public DirectoryDocument getDocument() {
        return document;
    }

    /**
     * Returns the view stored under {@code key}, computing it first if this is the
     * first request. Concurrent first requests for one key compute it once; the
     * others wait. Requests for other keys do not wait.
     * <p>
     * Computations may memoize other views, as long as no two views depend on each
     * other. A computation that throws or returns null leaves nothing stored, so
     * the next request retries.
     */
    @SuppressWarnings("unchecked")
    public <T> T memoize(String key, Supplier<T> computation) {
        Object value = memo.get(key);
        if (value != null) {
            return (T) value;
        }
        ReentrantLock lock = memoLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            value = memo.get(key);
            if (value == null) {
                value = computation.get();
                if (value != null) {
                    memo.put(key, value);
                }
            }
            return (T) value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the view under {@code key} has been computed already.
     */
    public boolean isMemoized(String key) {
        return memo.containsKey(key);
    }

    @Override
    public String toString() {
        return "DirectorySnapshot{version=" + version + ", timestamp=" + timestamp
                + ", organizations=" + organizations.size() + "}";
    }
}
