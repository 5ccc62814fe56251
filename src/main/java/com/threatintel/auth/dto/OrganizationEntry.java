package com.threatintel.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An organization as stored in the directory.
 * <p>
 * Flags are kept as the raw directory strings ({@code TRUE}/{@code FALSE});
 * they are parsed when the snapshot is assembled. Channel and resource maps are
 * keyed by access zone name ({@code inside}, {@code threats}, {@code search}).
 */
public class OrganizationEntry {

    @JsonProperty("id")
    public String id;

    @JsonProperty("name")
    public String name;

    @JsonProperty("full_access")
    public String fullAccess;

    @JsonProperty("stream_api_enabled")
    public String streamApiEnabled;

    @JsonProperty("email_notifications_enabled")
    public String emailNotificationsEnabled;

    @JsonProperty("email_notifications_business_days_only")
    public String emailNotificationsBusinessDaysOnly;

    @JsonProperty("email_notifications_language")
    public String emailNotificationsLanguage;

    @JsonProperty("email_notifications_times")
    public List<String> emailNotificationsTimes = new ArrayList<>();

    @JsonProperty("email_notifications_addresses")
    public List<String> emailNotificationsAddresses = new ArrayList<>();

    @JsonProperty("users")
    public List<String> users = new ArrayList<>();

    @JsonProperty("groups")
    public List<String> groups = new ArrayList<>();

    @JsonProperty("channels")
    public Map<String, ChannelEntry> channels = new LinkedHashMap<>();

    @JsonProperty("excluded_channels")
    public Map<String, ChannelEntry> excludedChannels = new LinkedHashMap<>();

    @JsonProperty("resources")
    public Map<String, ResourceEntry> resources = new LinkedHashMap<>();

    @JsonProperty("inside_criteria")
    public InsideCriteriaEntry insideCriteria;

    public OrganizationEntry() {
    }

    public OrganizationEntry(String id) {
        this.id = id;
    }
}
