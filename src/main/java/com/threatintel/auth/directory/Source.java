package com.threatintel.auth.directory;

/**
 * A data source.
 *
 * @param anonymizedId            id shown to clients instead of {@code id}; null when not anonymized
 * @param dipAnonymizationEnabled whether destination IPs of the source's events are anonymized
 */
public record Source(String id, String anonymizedId, boolean dipAnonymizationEnabled) {
}
