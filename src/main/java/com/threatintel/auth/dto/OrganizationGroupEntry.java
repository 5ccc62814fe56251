package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public class OrganizationGroupEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("channels")
    public Map<String, ChannelEntry> channels = new LinkedHashMap<>();

    @JsonProperty("excluded_channels")
    public Map<String, ChannelEntry> excludedChannels = new LinkedHashMap<>();

    public OrganizationGroupEntry() {
    }

    public OrganizationGroupEntry(String id) {
        this.id = id;
    }
}
