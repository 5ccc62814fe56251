package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Edge set of one channel: direct subsource references plus subsource-group references.
 */
public class ChannelEntry {

    @JsonProperty("subsources")
    public List<String> subsources = new ArrayList<>();

    @JsonProperty("subsource_groups")
    public List<String> subsourceGroups = new ArrayList<>();

    public ChannelEntry() {
    }

    public ChannelEntry(List<String> subsources, List<String> subsourceGroups) {
        this.subsources = new ArrayList<>(subsources);
        this.subsourceGroups = new ArrayList<>(subsourceGroups);
    }
}
