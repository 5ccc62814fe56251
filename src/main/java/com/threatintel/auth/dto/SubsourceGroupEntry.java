package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class SubsourceGroupEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("subsources")
    public List<String> subsources = new ArrayList<>();

    public SubsourceGroupEntry() {
    }

    public SubsourceGroupEntry(String id, List<String> subsources) {
        this.id = id;
        this.subsources = new ArrayList<>(subsources);
    }
}
