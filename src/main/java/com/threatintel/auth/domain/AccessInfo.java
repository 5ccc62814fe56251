package com.threatintel.auth.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything the report/search gateway needs to authorize one organization's queries.
 * <p>
 * {@code accessZoneConditions} maps each zone the organization can access to a
 * one-element list holding the final compiled condition. {@code resourceLimits}
 * is keyed by resource id and contains only resources enabled for the organization.
 */
public final class AccessInfo {

    private final Map<AccessZone, List<CompiledAccessCondition>> accessZoneConditions;
    private final Map<String, ResourceLimits> resourceLimits;
    private final boolean fullAccess;

    public AccessInfo(Map<AccessZone, List<CompiledAccessCondition>> accessZoneConditions,
                      Map<String, ResourceLimits> resourceLimits,
                      boolean fullAccess) {
        EnumMap<AccessZone, List<CompiledAccessCondition>> conditions = new EnumMap<>(AccessZone.class);
        accessZoneConditions.forEach((zone, list) -> conditions.put(zone, List.copyOf(list)));
        this.accessZoneConditions = Collections.unmodifiableMap(conditions);
        this.resourceLimits = Collections.unmodifiableMap(new TreeMap<>(resourceLimits));
        this.fullAccess = fullAccess;
    }

    public Map<AccessZone, List<CompiledAccessCondition>> getAccessZoneConditions() {
        return accessZoneConditions;
    }

    /**
     * The single compiled condition of a zone, or null if the zone is not accessible.
     */
    public CompiledAccessCondition getCondition(AccessZone zone) {
        List<CompiledAccessCondition> conditions = accessZoneConditions.get(zone);
        return conditions == null || conditions.isEmpty() ? null : conditions.get(0);
    }

    public Map<String, ResourceLimits> getResourceLimits() {
        return resourceLimits;
    }

    public boolean isFullAccess() {
        return fullAccess;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof AccessInfo that)) return false;
        return fullAccess == that.fullAccess
                && accessZoneConditions.equals(that.accessZoneConditions)
                && resourceLimits.equals(that.resourceLimits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessZoneConditions, resourceLimits, fullAccess);
    }

    @Override
    public String toString() {
        return "AccessInfo{conditions=" + accessZoneConditions
                + ", resourceLimits=" + resourceLimits
                + ", fullAccess=" + fullAccess + "}";
    }
}
