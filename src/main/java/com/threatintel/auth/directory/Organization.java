package com.threatintel.auth.directory;

import com.threatintel.auth.domain.AccessZone;
import com.threatintel.auth.dto.ResourceEntry;
import com.threatintel.auth.inside.InsideCriteria;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An organization (tenant) node of a directory snapshot.
 * <p>
 * Flags are already parsed (malformed values were reported and read as unset).
 * Resource entries stay raw: their validation belongs to resource-limit resolution.
 */
public final class Organization {

    private final String id;
    private final String name;
    private final boolean fullAccess;
    private final boolean streamApiEnabled;
    private final boolean streamApiFlagSet;
    private final boolean emailNotificationsEnabled;
    private final boolean emailNotificationsBusinessDaysOnly;
    private final String emailNotificationsLanguage;
    private final List<String> emailNotificationsTimes;
    private final List<String> emailNotificationsAddresses;
    private final List<String> userIds;
    private final List<String> groupIds;
    private final Map<AccessZone, Channel> channels;
    private final Map<AccessZone, Channel> excludedChannels;
    private final Map<AccessZone, ResourceEntry> resources;
    private final InsideCriteria insideCriteria;

    private Organization(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.fullAccess = builder.fullAccess;
        this.streamApiEnabled = builder.streamApiEnabled;
        this.streamApiFlagSet = builder.streamApiFlagSet;
        this.emailNotificationsEnabled = builder.emailNotificationsEnabled;
        this.emailNotificationsBusinessDaysOnly = builder.emailNotificationsBusinessDaysOnly;
        this.emailNotificationsLanguage = builder.emailNotificationsLanguage;
        this.emailNotificationsTimes = List.copyOf(builder.emailNotificationsTimes);
        this.emailNotificationsAddresses = List.copyOf(builder.emailNotificationsAddresses);
        this.userIds = List.copyOf(builder.userIds);
        this.groupIds = List.copyOf(builder.groupIds);
        this.channels = OrganizationGroup.copyOf(builder.channels);
        this.excludedChannels = OrganizationGroup.copyOf(builder.excludedChannels);
        Map<AccessZone, ResourceEntry> resourceCopy = new EnumMap<>(AccessZone.class);
        resourceCopy.putAll(builder.resources);
        this.resources = Collections.unmodifiableMap(resourceCopy);
        this.insideCriteria = builder.insideCriteria != null ? builder.insideCriteria : InsideCriteria.empty(id);
    }

    static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    /**
     * Actual (display) name; may be null.
     */
    public String getName() {
        return name;
    }

    public boolean isFullAccess() {
        return fullAccess;
    }

    public boolean isStreamApiEnabled() {
        return streamApiEnabled;
    }

    /**
     * Whether the stream API flag is present at all (with any value, legal or not).
     */
    public boolean isStreamApiFlagSet() {
        return streamApiFlagSet;
    }

    public boolean isEmailNotificationsEnabled() {
        return emailNotificationsEnabled;
    }

    public boolean isEmailNotificationsBusinessDaysOnly() {
        return emailNotificationsBusinessDaysOnly;
    }

    /**
     * Notification language; may be null (meaning the default).
     */
    public String getEmailNotificationsLanguage() {
        return emailNotificationsLanguage;
    }

    /**
     * Raw notification times as stored in the directory.
     */
    public List<String> getEmailNotificationsTimes() {
        return emailNotificationsTimes;
    }

    public List<String> getEmailNotificationsAddresses() {
        return emailNotificationsAddresses;
    }

    public List<String> getUserIds() {
        return userIds;
    }

    public List<String> getGroupIds() {
        return groupIds;
    }

    public Map<AccessZone, Channel> getChannels() {
        return channels;
    }

    public Map<AccessZone, Channel> getExcludedChannels() {
        return excludedChannels;
    }

    public Map<AccessZone, ResourceEntry> getResources() {
        return resources;
    }

    public InsideCriteria getInsideCriteria() {
        return insideCriteria;
    }

    static final class Builder {
        private final String id;
        private String name;
        private boolean fullAccess;
        private boolean streamApiEnabled;
        private boolean streamApiFlagSet;
        private boolean emailNotificationsEnabled;
        private boolean emailNotificationsBusinessDaysOnly;
        private String emailNotificationsLanguage;
        private List<String> emailNotificationsTimes = List.of();
        private List<String> emailNotificationsAddresses = List.of();
        private List<String> userIds = List.of();
        private List<String> groupIds = List.of();
        private Map<AccessZone, Channel> channels = Map.of();
        private Map<AccessZone, Channel> excludedChannels = Map.of();
        private Map<AccessZone, ResourceEntry> resources = Map.of();
        private InsideCriteria insideCriteria;

        private Builder(String id) {
            this.id = id;
        }

        Builder name(String name) {
            this.name = name;
            return this;
        }

        Builder fullAccess(boolean fullAccess) {
            this.fullAccess = fullAccess;
            return this;
        }

        Builder streamApiEnabled(boolean streamApiEnabled) {
            this.streamApiEnabled = streamApiEnabled;
            return this;
        }

        Builder streamApiFlagSet(boolean streamApiFlagSet) {
            this.streamApiFlagSet = streamApiFlagSet;
            return this;
        }

        Builder emailNotificationsEnabled(boolean emailNotificationsEnabled) {
            this.emailNotificationsEnabled = emailNotificationsEnabled;
            return this;
        }

        Builder emailNotificationsBusinessDaysOnly(boolean businessDaysOnly) {
            this.emailNotificationsBusinessDaysOnly = businessDaysOnly;
            return this;
        }

        Builder emailNotificationsLanguage(String language) {
            this.emailNotificationsLanguage = language;
            return this;
        }

        Builder emailNotificationsTimes(List<String> times) {
            this.emailNotificationsTimes = times;
            return this;
        }

        Builder emailNotificationsAddresses(List<String> addresses) {
            this.emailNotificationsAddresses = addresses;
            return this;
        }

        Builder userIds(List<String> userIds) {
            this.userIds = userIds;
            return this;
        }

        Builder groupIds(List<String> groupIds) {
            this.groupIds = groupIds;
            return this;
        }

        Builder channels(Map<AccessZone, Channel> channels) {
            this.channels = channels;
            return this;
        }

        Builder excludedChannels(Map<AccessZone, Channel> excludedChannels) {
            this.excludedChannels = excludedChannels;
            return this;
        }

        Builder resources(Map<AccessZone, ResourceEntry> resources) {
            this.resources = resources;
            return this;
        }

        Builder insideCriteria(InsideCriteria insideCriteria) {
            this.insideCriteria = insideCriteria;
            return this;
        }

        Organization build() {
            return new Organization(this);
        }
    }
}
