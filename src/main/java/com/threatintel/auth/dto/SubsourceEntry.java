package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class SubsourceEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("source")
    public String source;

    @JsonProperty("inclusion_criteria")
    public List<String> inclusionCriteria = new ArrayList<>();

    @JsonProperty("exclusion_criteria")
    public List<String> exclusionCriteria = new ArrayList<>();

    public SubsourceEntry() {
    }

    public SubsourceEntry(String id, String source) {
        this.id = id;
        this.source = source;
    }
}
