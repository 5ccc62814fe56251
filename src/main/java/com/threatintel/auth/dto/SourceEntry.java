package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SourceEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("anonymized_id")
    public String anonymizedId;

    @JsonProperty("dip_anonymization_enabled")
    public String dipAnonymizationEnabled;

    public SourceEntry() {
    }

    public SourceEntry(String id, String anonymizedId) {
        this.id = id;
        this.anonymizedId = anonymizedId;
    }
}
