package com.threatintel.auth.directory;

import java.util.List;

/**
 * One edge set of an organization or group channel in one access zone.
 */
public record Channel(List<String> subsourceIds, List<String> subsourceGroupIds) {

    public static final Channel EMPTY = new Channel(List.of(), List.of());

    public Channel {
        subsourceIds = List.copyOf(subsourceIds);
        subsourceGroupIds = List.copyOf(subsourceGroupIds);
    }
}
