package com.threatintel.auth.domain;

import java.util.Map;
import java.util.Set;

/**
 * What the push stream needs for one subsource and one access variant (full access or not).
 *
 * @param condition  compiled per-record predicate of the subsource
 * @param zoneOrgIds access zone to ids of stream-enabled organizations that may receive matching events
 */
public record StreamAccessInfo(CompiledAccessCondition condition, Map<AccessZone, Set<String>> zoneOrgIds) {
}
