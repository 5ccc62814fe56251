package com.threatintel.auth.domain;

/**
 * Consumption mode of event data. Each zone maps 1:1 to a report/search resource.
 */
public enum AccessZone {
    INSIDE("inside", "/report/inside"),
    SEARCH("search", "/search/events"),
    THREATS("threats", "/report/threats");

    private final String zoneName;
    private final String resourceId;

    AccessZone(String zoneName, String resourceId) {
        this.zoneName = zoneName;
        this.resourceId = resourceId;
    }

    /**
     * Name used in the directory and in access facts ({@code inside}, {@code search}, {@code threats}).
     */
    public String getZoneName() {
        return zoneName;
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * @return the zone, or null for an unknown name
     */
    public static AccessZone fromZoneName(String name) {
        for (AccessZone zone : values()) {
            if (zone.zoneName.equals(name)) {
                return zone;
            }
        }
        return null;
    }

    /**
     * @return the zone, or null for a resource not bound to any zone
     */
    public static AccessZone fromResourceId(String resourceId) {
        for (AccessZone zone : values()) {
            if (zone.resourceId.equals(resourceId)) {
                return zone;
            }
        }
        return null;
    }
}
