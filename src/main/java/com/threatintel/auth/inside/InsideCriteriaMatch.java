package com.threatintel.auth.inside;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of matching one event against the inside criteria.
 *
 * @param matchedOrgIds organizations the event concerns
 * @param matchedUrls   per organization, the sorted distinct URLs of that organization matched by
 *                      the event's URL pattern; organizations without such URLs have no entry
 */
public record InsideCriteriaMatch(Set<String> matchedOrgIds, Map<String, List<String>> matchedUrls) {

    public InsideCriteriaMatch {
        matchedOrgIds = Set.copyOf(matchedOrgIds);
        matchedUrls = Map.copyOf(matchedUrls);
    }
}
