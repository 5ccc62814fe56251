package com.threatintel.auth.directory;

import com.threatintel.auth.util.IpAddresses.IpRange;

import java.util.List;

/**
 * A reusable named bundle of field criteria; each list may be empty.
 */
public record CriteriaContainer(
        String id,
        List<Long> asns,
        List<String> ccs,
        List<IpRange> ipRanges,
        List<String> categories,
        List<String> names) {

    public CriteriaContainer {
        asns = List.copyOf(asns);
        ccs = List.copyOf(ccs);
        ipRanges = List.copyOf(ipRanges);
        categories = List.copyOf(categories);
        names = List.copyOf(names);
    }

    public boolean isEmpty() {
        return asns.isEmpty() && ccs.isEmpty() && ipRanges.isEmpty() && categories.isEmpty() && names.isEmpty();
    }
}
