package com.threatintel.auth.inside;

import com.threatintel.auth.domain.EventRecord;
import com.threatintel.auth.domain.EventRecord.Address;
import com.threatintel.auth.util.IpAddresses;
import com.threatintel.auth.util.IpAddresses.IpRange;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only lookup structure that tells which organizations an event concerns,
 * built once per snapshot from the organizations' inside criteria.
 * <p>
 * IP ranges are decomposed into half-open intervals: {@code borderIps[i]} starts
 * an interval in which exactly the organizations of {@code orgSets[i]} match.
 * The first and last borders are sentinels ({@code -1} and {@code 2^32}) whose
 * sets are empty, so a lookup of any IPv4 address lands on a real interval.
 * FQDN suffixes, ASNs and country codes are exact-match maps.
 * <p>
 * Instances are immutable and safe for concurrent use.
 */
public final class InsideCriteriaIndex {

    private static final Logger LOG = Logger.getLogger(InsideCriteriaIndex.class);

    public static final String FIELD_FQDN = "fqdn";
    public static final String FIELD_CATEGORY = "category";
    public static final String FIELD_URL_PATTERN = "url_pattern";

    static final long LOWER_SENTINEL = -1L;
    static final long UPPER_SENTINEL = IpAddresses.IPV4_LIMIT;

    private final long[] borderIps;
    private final List<Set<String>> orgSets;
    private final Map<String, Set<String>> fqdnSuffixToOrgIds;
    private final Map<Long, Set<String>> asnToOrgIds;
    private final Map<String, Set<String>> ccToOrgIds;
    private final Map<String, List<String>> orgIdToUrls;

    private InsideCriteriaIndex(long[] borderIps,
                                List<Set<String>> orgSets,
                                Map<String, Set<String>> fqdnSuffixToOrgIds,
                                Map<Long, Set<String>> asnToOrgIds,
                                Map<String, Set<String>> ccToOrgIds,
                                Map<String, List<String>> orgIdToUrls) {
        this.borderIps = borderIps;
        this.orgSets = orgSets;
        this.fqdnSuffixToOrgIds = fqdnSuffixToOrgIds;
        this.asnToOrgIds = asnToOrgIds;
        this.ccToOrgIds = ccToOrgIds;
        this.orgIdToUrls = orgIdToUrls;
    }

    /**
     * Builds the index.
     *
     * @throws IllegalStateException if the interval sweep ends unbalanced (an internal error)
     */
    public static InsideCriteriaIndex build(Collection<InsideCriteria> criteria) {
        Map<String, Set<String>> fqdnSuffixToOrgIds = new HashMap<>();
        Map<Long, Set<String>> asnToOrgIds = new HashMap<>();
        Map<String, Set<String>> ccToOrgIds = new HashMap<>();
        Map<String, List<String>> orgIdToUrls = new LinkedHashMap<>();
        List<Endpoint> endpoints = new ArrayList<>();

        for (InsideCriteria orgCriteria : criteria) {
            String orgId = orgCriteria.orgId();
            for (String fqdn : orgCriteria.fqdns()) {
                fqdnSuffixToOrgIds.computeIfAbsent(fqdn, key -> new TreeSet<>()).add(orgId);
            }
            for (Long asn : orgCriteria.asns()) {
                asnToOrgIds.computeIfAbsent(asn, key -> new TreeSet<>()).add(orgId);
            }
            for (String cc : orgCriteria.ccs()) {
                ccToOrgIds.computeIfAbsent(cc, key -> new TreeSet<>()).add(orgId);
            }
            for (IpRange range : orgCriteria.ipRanges()) {
                endpoints.add(new Endpoint(range.min(), orgId, 1));
                endpoints.add(new Endpoint(range.max() + 1, orgId, -1));
            }
            if (!orgCriteria.urls().isEmpty()) {
                orgIdToUrls.computeIfAbsent(orgId, key -> new ArrayList<>()).addAll(orgCriteria.urls());
            }
        }

        endpoints.add(new Endpoint(LOWER_SENTINEL, null, 0));
        endpoints.add(new Endpoint(UPPER_SENTINEL, null, 0));
        endpoints.sort(Comparator.comparingLong(Endpoint::ip));

        long[] borders = new long[endpoints.size()];
        List<Set<String>> sets = new ArrayList<>(endpoints.size());
        Map<String, Integer> active = new TreeMap<>();
        int count = 0;
        int i = 0;
        while (i < endpoints.size()) {
            long ip = endpoints.get(i).ip();
            while (i < endpoints.size() && endpoints.get(i).ip() == ip) {
                Endpoint endpoint = endpoints.get(i++);
                if (endpoint.orgId() != null) {
                    active.merge(endpoint.orgId(), endpoint.delta(), Integer::sum);
                    if (active.get(endpoint.orgId()) == 0) {
                        active.remove(endpoint.orgId());
                    }
                }
            }
            borders[count++] = ip;
            sets.add(Collections.unmodifiableSet(new TreeSet<>(active.keySet())));
        }

        if (borders[0] != LOWER_SENTINEL || !sets.get(0).isEmpty()
                || borders[count - 1] != UPPER_SENTINEL || !sets.get(count - 1).isEmpty()) {
            throw new IllegalStateException("Unbalanced inside-criteria IP intervals (first set: "
                    + sets.get(0) + ", last set: " + sets.get(count - 1) + ")");
        }

        return new InsideCriteriaIndex(
                Arrays.copyOf(borders, count),
                List.copyOf(sets),
                freeze(fqdnSuffixToOrgIds),
                freeze(asnToOrgIds),
                freeze(ccToOrgIds),
                freezeLists(orgIdToUrls));
    }

    /**
     * Tells which organizations the event concerns.
     *
     * @param fqdnOnlyCategories categories for which only the FQDN is examined
     */
    public InsideCriteriaMatch match(EventRecord event, Set<String> fqdnOnlyCategories) {
        Set<String> orgIds = new HashSet<>();
        Map<String, List<String>> urlsMatched = new HashMap<>();

        String fqdn = event.getString(FIELD_FQDN);
        if (fqdn != null) {
            String suffix = fqdn;
            while (true) {
                Set<String> matched = fqdnSuffixToOrgIds.get(suffix);
                if (matched != null) {
                    orgIds.addAll(matched);
                }
                int dot = suffix.indexOf('.');
                if (dot < 0) {
                    break;
                }
                suffix = suffix.substring(dot + 1);
            }
        }

        String category = event.getString(FIELD_CATEGORY);
        if (category != null && fqdnOnlyCategories.contains(category)) {
            return new InsideCriteriaMatch(orgIds, urlsMatched);
        }

        for (Address address : event.getAddresses()) {
            if (address.asn() != null) {
                addAll(orgIds, asnToOrgIds.get(address.asn()));
            }
            if (address.cc() != null) {
                addAll(orgIds, ccToOrgIds.get(address.cc()));
            }
            if (address.ip() != null) {
                orgIds.addAll(orgIdsForIp(IpAddresses.toLong(address.ip())));
            }
        }

        String urlPattern = event.getString(FIELD_URL_PATTERN);
        if (urlPattern != null && !orgIdToUrls.isEmpty()) {
            UrlPatternMatcher matcher = UrlPatternMatcher.compile(urlPattern);
            if (matcher != null) {
                matchUrls(matcher, orgIds, urlsMatched);
            }
        }
        return new InsideCriteriaMatch(orgIds, urlsMatched);
    }

    private void matchUrls(UrlPatternMatcher matcher, Set<String> orgIds, Map<String, List<String>> urlsMatched) {
        for (Map.Entry<String, List<String>> entry : orgIdToUrls.entrySet()) {
            Set<String> matched = new TreeSet<>();
            for (String url : entry.getValue()) {
                try {
                    if (matcher.matches(url)) {
                        matched.add(url);
                    }
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Cannot match url '%s' against url_pattern '%s'", url, matcher.getPattern());
                }
            }
            if (!matched.isEmpty()) {
                orgIds.add(entry.getKey());
                urlsMatched.put(entry.getKey(), List.copyOf(matched));
            }
        }
    }

    /**
     * Organizations whose IP ranges contain the given address.
     */
    public Set<String> orgIdsForIp(long ip) {
        return orgSets.get(bisectRight(borderIps, ip) - 1);
    }

    long[] getBorderIps() {
        return borderIps.clone();
    }

    List<Set<String>> getOrgSets() {
        return orgSets;
    }

    private static int bisectRight(long[] sorted, long value) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (value < sorted[mid]) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private static void addAll(Set<String> sink, Set<String> values) {
        if (values != null) {
            sink.addAll(values);
        }
    }

    private static <K> Map<K, Set<String>> freeze(Map<K, Set<String>> map) {
        Map<K, Set<String>> frozen = new HashMap<>(map.size() * 2);
        map.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, List<String>> freezeLists(Map<String, List<String>> map) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        map.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }

    private record Endpoint(long ip, String orgId, int delta) {}
}
