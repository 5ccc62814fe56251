package com.threatintel.auth.directory;

import java.util.List;

/**
 * The finest-grained unit of access control: a slice of one source's data,
 * narrowed by inclusion and exclusion criteria containers.
 */
public record Subsource(String id, String sourceId, List<String> inclusionCriteriaIds, List<String> exclusionCriteriaIds) {

    public Subsource {
        inclusionCriteriaIds = List.copyOf(inclusionCriteriaIds);
        exclusionCriteriaIds = List.copyOf(exclusionCriteriaIds);
    }
}
