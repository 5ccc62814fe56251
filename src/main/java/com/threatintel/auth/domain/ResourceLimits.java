package com.threatintel.auth.domain;

import java.util.Map;

/**
 * Request limits of one resource for one organization.
 *
 * @param window            rate-limit window, in seconds
 * @param queriesLimit      maximum number of queries per window, or null for no limit
 * @param resultsLimit      maximum number of results per query, or null for no limit
 * @param maxDaysOld        how far back queries may reach, in days
 * @param requestParameters allowed parameter name to "is required"; null when every parameter is allowed
 */
public record ResourceLimits(
        int window,
        Integer queriesLimit,
        Integer resultsLimit,
        int maxDaysOld,
        Map<String, Boolean> requestParameters) {

    public static final int DEFAULT_WINDOW = 3600;
    public static final int DEFAULT_MAX_DAYS_OLD = 100;

    public ResourceLimits {
        requestParameters = requestParameters == null ? null : Map.copyOf(requestParameters);
    }
}
