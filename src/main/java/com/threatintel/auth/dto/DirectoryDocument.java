package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of one point-in-time state of the directory.
 * <p>
 * This is what the directory backend delivers and what the snapshot cache
 * persists. Cross-references between entries are by id; they are resolved
 * (and checked) when a {@link com.threatintel.auth.directory.DirectorySnapshot}
 * is assembled from the document.
 */
public class DirectoryDocument {

    @JsonProperty("version")
    public long version;

    /**
     * Seconds since the epoch, with fractional part.
     */
    @JsonProperty("timestamp")
    public double timestamp;

    @JsonProperty("ignored_ip_networks")
    public List<String> ignoredIpNetworks = new ArrayList<>();

    @JsonProperty("organizations")
    public List<OrganizationEntry> organizations = new ArrayList<>();

    @JsonProperty("organization_groups")
    public List<OrganizationGroupEntry> organizationGroups = new ArrayList<>();

    @JsonProperty("sources")
    public List<SourceEntry> sources = new ArrayList<>();

    @JsonProperty("subsources")
    public List<SubsourceEntry> subsources = new ArrayList<>();

    @JsonProperty("subsource_groups")
    public List<SubsourceGroupEntry> subsourceGroups = new ArrayList<>();

    @JsonProperty("criteria_containers")
    public List<CriteriaContainerEntry> criteriaContainers = new ArrayList<>();

    public DirectoryDocument() {
    }

    public DirectoryDocument(long version, double timestamp) {
        this.version = version;
        this.timestamp = timestamp;
    }
}
