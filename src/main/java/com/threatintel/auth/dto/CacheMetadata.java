package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of the snapshot cache metadata file.
 */
public class CacheMetadata {

    @JsonProperty("version")
    public long version;

    @JsonProperty("timestamp")
    public double timestamp;

    /**
     * Duration of the rebuild that produced the cached payload, in seconds.
     */
    @JsonProperty("job_duration")
    public double jobDuration;

    public CacheMetadata() {
    }

    public CacheMetadata(long version, double timestamp, double jobDuration) {
        this.version = version;
        this.timestamp = timestamp;
        this.jobDuration = jobDuration;
    }
}
