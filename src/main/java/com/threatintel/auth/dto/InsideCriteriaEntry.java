package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Criteria identifying events that concern an organization's own network.
 */
public class InsideCriteriaEntry {

    @JsonProperty("asn")
    public List<Long> asn = new ArrayList<>();

    @JsonProperty("cc")
    public List<String> cc = new ArrayList<>();

    @JsonProperty("fqdn")
    public List<String> fqdn = new ArrayList<>();

    @JsonProperty("ip_network")
    public List<String> ipNetwork = new ArrayList<>();

    @JsonProperty("url")
    public List<String> url = new ArrayList<>();

    public InsideCriteriaEntry() {
    }
}
