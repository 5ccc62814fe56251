package com.threatintel.auth.directory;

import com.threatintel.auth.domain.AccessZone;
import com.threatintel.auth.domain.EventCategory;
import com.threatintel.auth.dto.ChannelEntry;
import com.threatintel.auth.dto.CriteriaContainerEntry;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.dto.InsideCriteriaEntry;
import com.threatintel.auth.dto.OrganizationEntry;
import com.threatintel.auth.dto.OrganizationGroupEntry;
import com.threatintel.auth.dto.ResourceEntry;
import com.threatintel.auth.dto.SourceEntry;
import com.threatintel.auth.dto.SubsourceEntry;
import com.threatintel.auth.dto.SubsourceGroupEntry;
import com.threatintel.auth.error.DirectoryDataException;
import com.threatintel.auth.error.DirectoryStructureException;
import com.threatintel.auth.inside.InsideCriteria;
import com.threatintel.auth.util.IpAddresses;
import com.threatintel.auth.util.IpAddresses.IpRange;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds a {@link DirectorySnapshot} from a {@link DirectoryDocument}.
 * <p>
 * Structural problems (missing or duplicate ids, references to nodes that do not
 * exist) make the whole document unusable and raise
 * {@link DirectoryStructureException}. Problems with individual attribute values
 * (flags, networks, categories, zone names) are logged and the value is dropped,
 * so that one bad entry never prevents a snapshot from being built.
 */
@ApplicationScoped
public class SnapshotAssembler {

    private static final Logger LOG = Logger.getLogger(SnapshotAssembler.class);

    /**
     * Longer organization ids are accepted but reported.
     */
    public static final int ORG_ID_MAX_LENGTH = 32;

    public DirectorySnapshot assemble(DirectoryDocument document) {
        if (document == null) {
            throw new DirectoryStructureException("Directory document is missing");
        }

        Map<String, Source> sources = index("source", document.sources, entry -> entry.id, this::toSource);
        Map<String, CriteriaContainer> containers = index("criteria container", document.criteriaContainers,
                entry -> entry.id, this::toCriteriaContainer);
        Map<String, Subsource> subsources = index("subsource", document.subsources,
                entry -> entry.id, this::toSubsource);
        Map<String, SubsourceGroup> subsourceGroups = index("subsource group", document.subsourceGroups,
                entry -> entry.id, entry -> new SubsourceGroup(entry.id, nonNull(entry.subsources)));
        Map<String, OrganizationGroup> organizationGroups = index("organization group", document.organizationGroups,
                entry -> entry.id, this::toOrganizationGroup);
        Map<String, Organization> organizations = index("organization", document.organizations,
                entry -> entry.id, this::toOrganization);

        for (Subsource subsource : subsources.values()) {
            requireReference(sources, subsource.sourceId(), "subsource", subsource.id());
            requireReferences(containers, subsource.inclusionCriteriaIds(), "subsource", subsource.id());
            requireReferences(containers, subsource.exclusionCriteriaIds(), "subsource", subsource.id());
        }
        for (SubsourceGroup group : subsourceGroups.values()) {
            requireReferences(subsources, group.subsourceIds(), "subsource group", group.id());
        }
        for (OrganizationGroup group : organizationGroups.values()) {
            checkChannels(group.channels(), subsources, subsourceGroups, "organization group", group.id());
            checkChannels(group.excludedChannels(), subsources, subsourceGroups, "organization group", group.id());
        }
        for (Organization organization : organizations.values()) {
            requireReferences(organizationGroups, organization.getGroupIds(), "organization", organization.getId());
            checkChannels(organization.getChannels(), subsources, subsourceGroups, "organization", organization.getId());
            checkChannels(organization.getExcludedChannels(), subsources, subsourceGroups,
                    "organization", organization.getId());
        }

        List<String> ignoredNetworks = new ArrayList<>();
        List<IpRange> ignoredRanges = new ArrayList<>();
        for (String network : nonNull(document.ignoredIpNetworks)) {
            try {
                ignoredRanges.add(IpAddresses.parseNetwork(network));
                ignoredNetworks.add(network.trim());
            } catch (IllegalArgumentException e) {
                LOG.errorf("Skipping malformed ignored IP network '%s': %s", network, e.getMessage());
            }
        }

        DirectorySnapshot snapshot = new DirectorySnapshot(
                document.version,
                document.timestamp,
                ignoredNetworks,
                ignoredRanges,
                organizations,
                organizationGroups,
                sources,
                subsources,
                subsourceGroups,
                containers,
                document);
        LOG.debugf("Assembled %s", snapshot);
        return snapshot;
    }

    // ========== Flags ==========

    /**
     * Parses a directory flag ({@code TRUE}/{@code FALSE}, any case).
     *
     * @param onMissing value when the flag is not set
     * @param onIllegal value when the flag is malformed (the problem is logged)
     */
    public static boolean parseFlag(String raw, String flagName, String ownerId, boolean onMissing, boolean onIllegal) {
        if (raw == null) {
            return onMissing;
        }
        try {
            return parseFlagStrict(raw, flagName);
        } catch (DirectoryDataException e) {
            LOG.errorf("Problem with directory data for '%s': %s", ownerId, e.getMessage());
            return onIllegal;
        }
    }

    static boolean parseFlagStrict(String raw, String flagName) {
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if ("TRUE".equals(value)) {
            return true;
        }
        if ("FALSE".equals(value)) {
            return false;
        }
        throw new DirectoryDataException("illegal value of flag " + flagName + ": '" + raw + "'");
    }

    // ========== Node conversion ==========

    private Source toSource(SourceEntry entry) {
        boolean dipAnonymization = parseFlag(entry.dipAnonymizationEnabled, "dip_anonymization_enabled",
                entry.id, false, true);
        String anonymizedId = entry.anonymizedId == null || entry.anonymizedId.isBlank() ? null : entry.anonymizedId;
        return new Source(entry.id, anonymizedId, dipAnonymization);
    }

    private Subsource toSubsource(SubsourceEntry entry) {
        if (entry.source == null) {
            throw new DirectoryStructureException("Subsource '" + entry.id + "' does not name its source");
        }
        return new Subsource(entry.id, entry.source, nonNull(entry.inclusionCriteria), nonNull(entry.exclusionCriteria));
    }

    private CriteriaContainer toCriteriaContainer(CriteriaContainerEntry entry) {
        List<Long> asns = new ArrayList<>();
        for (Long asn : nonNull(entry.asn)) {
            if (asn == null || asn < 0 || asn > 0xFFFFFFFFL) {
                LOG.errorf("Problem with directory data for '%s': illegal ASN %s (skipped)", entry.id, asn);
            } else {
                asns.add(asn);
            }
        }
        List<String> categories = new ArrayList<>();
        for (String category : nonNull(entry.category)) {
            try {
                categories.add(EventCategory.fromValue(category).getValue());
            } catch (IllegalArgumentException e) {
                LOG.errorf("Problem with directory data for '%s': %s (skipped)", entry.id, e.getMessage());
            }
        }
        return new CriteriaContainer(
                entry.id,
                asns,
                nonNullValues(entry.cc),
                parseRanges(entry.ipNetwork, entry.id),
                categories,
                nonNullValues(entry.name));
    }

    private OrganizationGroup toOrganizationGroup(OrganizationGroupEntry entry) {
        return new OrganizationGroup(entry.id,
                toChannels(entry.channels, entry.id),
                toChannels(entry.excludedChannels, entry.id));
    }

    private Organization toOrganization(OrganizationEntry entry) {
        if (entry.id.length() > ORG_ID_MAX_LENGTH) {
            LOG.warnf("The length of the organization id '%s' is %d, which exceeds the limit of %d",
                    entry.id, entry.id.length(), ORG_ID_MAX_LENGTH);
        }
        Map<AccessZone, ResourceEntry> resources = new EnumMap<>(AccessZone.class);
        if (entry.resources != null) {
            entry.resources.forEach((zoneName, resource) -> {
                AccessZone zone = zoneOf(zoneName, entry.id);
                if (zone != null && resource != null) {
                    resources.put(zone, resource);
                }
            });
        }
        return Organization.builder(entry.id)
                .name(entry.name == null || entry.name.isBlank() ? null : entry.name)
                .fullAccess(parseFlag(entry.fullAccess, "full_access", entry.id, false, false))
                .streamApiEnabled(parseFlag(entry.streamApiEnabled, "stream_api_enabled", entry.id, false, false))
                .streamApiFlagSet(entry.streamApiEnabled != null)
                .emailNotificationsEnabled(parseFlag(entry.emailNotificationsEnabled,
                        "email_notifications_enabled", entry.id, false, false))
                .emailNotificationsBusinessDaysOnly(parseFlag(entry.emailNotificationsBusinessDaysOnly,
                        "email_notifications_business_days_only", entry.id, false, false))
                .emailNotificationsLanguage(entry.emailNotificationsLanguage)
                .emailNotificationsTimes(nonNullValues(entry.emailNotificationsTimes))
                .emailNotificationsAddresses(nonNullValues(entry.emailNotificationsAddresses))
                .userIds(nonNullValues(entry.users))
                .groupIds(nonNull(entry.groups))
                .channels(toChannels(entry.channels, entry.id))
                .excludedChannels(toChannels(entry.excludedChannels, entry.id))
                .resources(resources)
                .insideCriteria(toInsideCriteria(entry.id, entry.insideCriteria))
                .build();
    }

    private InsideCriteria toInsideCriteria(String orgId, InsideCriteriaEntry entry) {
        if (entry == null) {
            return InsideCriteria.empty(orgId);
        }
        List<Long> asns = new ArrayList<>();
        for (Long asn : nonNull(entry.asn)) {
            if (asn != null) {
                asns.add(asn);
            }
        }
        return new InsideCriteria(orgId,
                nonNullValues(entry.fqdn),
                asns,
                nonNullValues(entry.cc),
                parseRanges(entry.ipNetwork, orgId),
                nonNullValues(entry.url));
    }

    private Map<AccessZone, Channel> toChannels(Map<String, ChannelEntry> entries, String ownerId) {
        Map<AccessZone, Channel> channels = new EnumMap<>(AccessZone.class);
        if (entries == null) {
            return channels;
        }
        entries.forEach((zoneName, entry) -> {
            AccessZone zone = zoneOf(zoneName, ownerId);
            if (zone != null && entry != null) {
                channels.put(zone, new Channel(nonNull(entry.subsources), nonNull(entry.subsourceGroups)));
            }
        });
        return channels;
    }

    private static AccessZone zoneOf(String zoneName, String ownerId) {
        AccessZone zone = AccessZone.fromZoneName(zoneName);
        if (zone == null) {
            LOG.errorf("Problem with directory data for '%s': unknown access zone '%s' (skipped)", ownerId, zoneName);
        }
        return zone;
    }

    /**
     * Parses CIDR networks into ranges. The reserved address 0 means "no IP" and is
     * cut off the lower end; a range consisting of 0 only is dropped.
     */
    private static List<IpRange> parseRanges(List<String> networks, String ownerId) {
        List<IpRange> ranges = new ArrayList<>();
        for (String network : nonNull(networks)) {
            IpRange range;
            try {
                range = IpAddresses.parseNetwork(network);
            } catch (IllegalArgumentException e) {
                LOG.errorf("Problem with directory data for '%s': %s (skipped)", ownerId, e.getMessage());
                continue;
            }
            if (range.max() == 0) {
                continue;
            }
            ranges.add(range.min() == 0 ? new IpRange(1, range.max()) : range);
        }
        return ranges;
    }

    // ========== Structure checks ==========

    private static <E, N> Map<String, N> index(String kind, Collection<E> entries,
                                               Function<E, String> idOf, Function<E, N> convert) {
        Map<String, N> nodes = new LinkedHashMap<>();
        for (E entry : nonNull(entries)) {
            if (entry == null) {
                throw new DirectoryStructureException("Null " + kind + " entry in directory document");
            }
            String id = idOf.apply(entry);
            if (id == null || id.isBlank()) {
                throw new DirectoryStructureException("A " + kind + " entry has no id");
            }
            if (nodes.containsKey(id)) {
                throw new DirectoryStructureException("Duplicate " + kind + " id '" + id + "'");
            }
            nodes.put(id, convert.apply(entry));
        }
        return nodes;
    }

    private static void checkChannels(Map<AccessZone, Channel> channels,
                                      Map<String, Subsource> subsources,
                                      Map<String, SubsourceGroup> subsourceGroups,
                                      String ownerKind, String ownerId) {
        for (Channel channel : channels.values()) {
            requireReferences(subsources, channel.subsourceIds(), ownerKind, ownerId);
            requireReferences(subsourceGroups, channel.subsourceGroupIds(), ownerKind, ownerId);
        }
    }

    private static void requireReferences(Map<String, ?> targets, List<String> ids, String ownerKind, String ownerId) {
        for (String id : ids) {
            requireReference(targets, id, ownerKind, ownerId);
        }
    }

    private static void requireReference(Map<String, ?> targets, String id, String ownerKind, String ownerId) {
        if (id == null || !targets.containsKey(id)) {
            throw new DirectoryStructureException(
                    "The " + ownerKind + " '" + ownerId + "' refers to a missing node '" + id + "'");
        }
    }

    private static <T> List<T> nonNull(Collection<T> values) {
        return values == null ? List.of() : new ArrayList<>(values);
    }

    private static List<String> nonNullValues(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : nonNull(values)) {
            if (value != null && !value.isBlank()) {
                result.add(value);
            }
        }
        return result;
    }
}
