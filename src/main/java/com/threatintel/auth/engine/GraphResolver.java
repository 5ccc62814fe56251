package com.threatintel.auth.engine;

import com.threatintel.auth.directory.Channel;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.Organization;
import com.threatintel.auth.directory.OrganizationGroup;
import com.threatintel.auth.domain.AccessFact;
import com.threatintel.auth.domain.AccessZone;
import com.threatintel.auth.domain.ResourceLimits;
import com.threatintel.auth.dto.ResourceEntry;
import com.threatintel.auth.error.DirectoryDataException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves the directory graph into access facts and per-resource limits.
 * <p>
 * An organization reaches a subsource in a zone through its own channels and
 * through the channels of each group it belongs to; a channel lists subsources
 * directly and through subsource groups (one level only). Every edge found in an
 * excluded channel removes the access fact, however many inclusion paths reach it.
 * <p>
 * Both operations are pure functions of the snapshot.
 */
@ApplicationScoped
public class GraphResolver {

    private static final Logger LOG = Logger.getLogger(GraphResolver.class);

    /**
     * Computes all access facts of the snapshot.
     *
     * @return a sorted, unmodifiable set
     */
    public SortedSet<AccessFact> resolveAccessFacts(DirectorySnapshot snapshot) {
        SortedSet<AccessFact> result = new TreeSet<>();
        for (Organization organization : snapshot.getOrganizations().values()) {
            result.addAll(resolveAccessFacts(snapshot, organization));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Computes the access facts of one organization.
     */
    public Set<AccessFact> resolveAccessFacts(DirectorySnapshot snapshot, Organization organization) {
        Set<AccessFact> included = new LinkedHashSet<>();
        Set<AccessFact> excluded = new LinkedHashSet<>();
        String orgId = organization.getId();

        collect(snapshot, orgId, organization.getChannels(), included);
        collect(snapshot, orgId, organization.getExcludedChannels(), excluded);
        for (String groupId : organization.getGroupIds()) {
            OrganizationGroup group = snapshot.getOrganizationGroups().get(groupId);
            collect(snapshot, orgId, group.channels(), included);
            collect(snapshot, orgId, group.excludedChannels(), excluded);
        }

        included.removeAll(excluded);
        return included;
    }

    private static void collect(DirectorySnapshot snapshot, String orgId,
                                Map<AccessZone, Channel> channels, Set<AccessFact> sink) {
        for (Map.Entry<AccessZone, Channel> entry : channels.entrySet()) {
            AccessZone zone = entry.getKey();
            Channel channel = entry.getValue();
            for (String subsourceId : channel.subsourceIds()) {
                sink.add(new AccessFact(orgId, subsourceId, zone));
            }
            for (String groupId : channel.subsourceGroupIds()) {
                for (String subsourceId : snapshot.getSubsourceGroups().get(groupId).subsourceIds()) {
                    sink.add(new AccessFact(orgId, subsourceId, zone));
                }
            }
        }
    }

    /**
     * Computes the limits of every resource enabled for the organization, keyed by resource id.
     * <p>
     * A resource is enabled when the organization has an entry for it. A malformed
     * entry is logged and the resource treated as disabled.
     */
    public Map<String, ResourceLimits> resolveResourceLimits(Organization organization) {
        Map<String, ResourceLimits> result = new TreeMap<>();
        for (AccessZone zone : AccessZone.values()) {
            ResourceLimits limits = resolveResourceLimits(organization, zone);
            if (limits != null) {
                result.put(zone.getResourceId(), limits);
            }
        }
        return result;
    }

    /**
     * @return the limits, or null if the zone's resource is disabled for the organization
     */
    public ResourceLimits resolveResourceLimits(Organization organization, AccessZone zone) {
        ResourceEntry entry = organization.getResources().get(zone);
        if (entry == null) {
            return null;
        }
        try {
            return toResourceLimits(entry);
        } catch (DirectoryDataException e) {
            LOG.errorf("Problem with directory data for the organization '%s' (resource %s): %s",
                    organization.getId(), zone.getResourceId(), e.getMessage());
            return null;
        }
    }

    static ResourceLimits toResourceLimits(ResourceEntry entry) {
        int window = parseInt(entry.window, "window", ResourceLimits.DEFAULT_WINDOW);
        Integer queriesLimit = parseOptionalInt(entry.queriesLimit, "queries_limit");
        Integer resultsLimit = parseOptionalInt(entry.resultsLimit, "results_limit");
        int maxDaysOld = parseInt(entry.maxDaysOld, "max_days_old", ResourceLimits.DEFAULT_MAX_DAYS_OLD);
        return new ResourceLimits(window, queriesLimit, resultsLimit, maxDaysOld, toRequestParameters(entry));
    }

    private static Map<String, Boolean> toRequestParameters(ResourceEntry entry) {
        List<String> allowed = entry.requestParameters == null ? List.of() : entry.requestParameters;
        Set<String> required = entry.requiredRequestParameters == null
                ? Set.of()
                : new TreeSet<>(entry.requiredRequestParameters);
        if (allowed.isEmpty()) {
            if (!required.isEmpty()) {
                throw new DirectoryDataException(
                        "required request parameters " + required + " are illegal when no request parameter"
                                + " whitelist is specified");
            }
            return null;
        }
        if (!allowed.containsAll(required)) {
            throw new DirectoryDataException("required request parameters " + required
                    + " are not a subset of the allowed ones " + new TreeSet<>(allowed));
        }
        Map<String, Boolean> parameters = new LinkedHashMap<>();
        for (String parameter : new TreeSet<>(allowed)) {
            parameters.put(parameter, required.contains(parameter));
        }
        return parameters;
    }

    private static int parseInt(String raw, String name, int defaultValue) {
        Integer value = parseOptionalInt(raw, name);
        return value != null ? value : defaultValue;
    }

    private static Integer parseOptionalInt(String raw, String name) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new DirectoryDataException("negative value of " + name + ": '" + raw + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new DirectoryDataException("illegal value of " + name + ": '" + raw + "'", e);
        }
    }
}
