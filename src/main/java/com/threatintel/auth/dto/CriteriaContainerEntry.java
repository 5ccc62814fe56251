package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A reusable named bundle of field criteria.
 */
public class CriteriaContainerEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("asn")
    public List<Long> asn = new ArrayList<>();

    @JsonProperty("cc")
    public List<String> cc = new ArrayList<>();

    /**
     * CIDR notation.
     */
    @JsonProperty("ip_network")
    public List<String> ipNetwork = new ArrayList<>();

    @JsonProperty("category")
    public List<String> category = new ArrayList<>();

    @JsonProperty("name")
    public List<String> name = new ArrayList<>();

    public CriteriaContainerEntry() {
    }

    public CriteriaContainerEntry(String id) {
        this.id = id;
    }
}
