package com.threatintel.auth.directory;

import com.threatintel.auth.domain.AccessZone;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A group of organizations sharing channels.
 */
public record OrganizationGroup(String id, Map<AccessZone, Channel> channels, Map<AccessZone, Channel> excludedChannels) {

    public OrganizationGroup {
        channels = copyOf(channels);
        excludedChannels = copyOf(excludedChannels);
    }

    static Map<AccessZone, Channel> copyOf(Map<AccessZone, Channel> channels) {
        Map<AccessZone, Channel> copy = new EnumMap<>(AccessZone.class);
        copy.putAll(channels);
        return Collections.unmodifiableMap(copy);
    }
}
