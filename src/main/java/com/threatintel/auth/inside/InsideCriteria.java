package com.threatintel.auth.inside;

import com.threatintel.auth.util.IpAddresses.IpRange;

import java.util.List;
import java.util.Objects;

/**
 * Criteria by which inbound events are recognized as concerning an organization's own assets.
 *
 * @param orgId    owning organization
 * @param fqdns    domain suffixes; an event FQDN matches when it equals one or ends with {@code "." + suffix}
 * @param asns     autonomous system numbers
 * @param ccs      country codes
 * @param ipRanges inclusive IP ranges (never containing the reserved address 0)
 * @param urls     URL patterns, regular expression or glob syntax
 */
public record InsideCriteria(
        String orgId,
        List<String> fqdns,
        List<Long> asns,
        List<String> ccs,
        List<IpRange> ipRanges,
        List<String> urls) {

    public InsideCriteria {
        Objects.requireNonNull(orgId, "orgId");
        fqdns = List.copyOf(fqdns);
        asns = List.copyOf(asns);
        ccs = List.copyOf(ccs);
        ipRanges = List.copyOf(ipRanges);
        urls = List.copyOf(urls);
    }

    public static InsideCriteria empty(String orgId) {
        return new InsideCriteria(orgId, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return fqdns.isEmpty() && asns.isEmpty() && ccs.isEmpty() && ipRanges.isEmpty() && urls.isEmpty();
    }
}
