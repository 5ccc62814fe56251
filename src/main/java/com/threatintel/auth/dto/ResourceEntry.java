package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-organization settings of one report/search resource. Numeric limits are
 * raw directory strings; absent ones fall back to defaults.
 */
public class ResourceEntry {

    @JsonProperty("window")
    public String window;

    @JsonProperty("queries_limit")
    public String queriesLimit;

    @JsonProperty("results_limit")
    public String resultsLimit;

    @JsonProperty("max_days_old")
    public String maxDaysOld;

    /**
     * Whitelist of request parameters; empty means "all parameters allowed".
     */
    @JsonProperty("request_parameters")
    public List<String> requestParameters = new ArrayList<>();

    @JsonProperty("required_request_parameters")
    public List<String> requiredRequestParameters = new ArrayList<>();

    public ResourceEntry() {
    }
}
