package com.threatintel.auth.engine;

import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.condition.CondBuilder;
import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.config.ConditionPipelineSettings;
import com.threatintel.auth.config.ConditionPipelineSettings.CompileTarget;
import com.threatintel.auth.directory.CriteriaContainer;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.Organization;
import com.threatintel.auth.directory.Subsource;
import com.threatintel.auth.domain.AccessFact;
import com.threatintel.auth.domain.AccessInfo;
import com.threatintel.auth.domain.AccessZone;
import com.threatintel.auth.domain.CompiledAccessCondition;
import com.threatintel.auth.domain.NotificationAccessInfo;
import com.threatintel.auth.domain.StreamAccessInfo;
import com.threatintel.auth.domain.SubsourceAccessKey;
import com.threatintel.auth.util.IpAddresses.IpRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the access conditions of organizations from their access facts.
 * <p>
 * Condition of one subsource:
 * <pre>
 *   source = S AND (each inclusion container) AND NOT (each exclusion container)
 * </pre>
 * where a container is the OR of its non-empty criteria ({@code asn IN},
 * {@code category IN}, {@code cc IN}, one {@code ip BETWEEN} per network,
 * {@code name IN}). The condition of an organization in a zone is the OR of the
 * conditions of the subsources it may see there; organizations without full
 * access additionally get {@code restriction != 'internal' AND NOT ignored IS TRUE}.
 * Every result goes through the {@link ConditionPipeline}.
 * <p>
 * Facts are processed in their natural (sorted) order, so the output is
 * deterministic for a given snapshot.
 */
@ApplicationScoped
public class AccessInfoCompiler {

    private static final Logger LOG = Logger.getLogger(AccessInfoCompiler.class);

    public static final String FIELD_SOURCE = "source";
    public static final String FIELD_RESTRICTION = "restriction";
    public static final String FIELD_IGNORED = "ignored";
    public static final String RESTRICTION_INTERNAL = "internal";

    private final GraphResolver graphResolver;
    private final ConditionPipeline pipeline;
    private final ConditionPipeline predicatePipeline;

    @Inject
    public AccessInfoCompiler(GraphResolver graphResolver, AuthCoreConfig config) {
        this(graphResolver, config.pipelineSettings());
    }

    public AccessInfoCompiler(GraphResolver graphResolver, ConditionPipelineSettings settings) {
        this.graphResolver = graphResolver;
        this.pipeline = new ConditionPipeline(settings);
        this.predicatePipeline = new ConditionPipeline(settings.withCompileTarget(CompileTarget.PREDICATE));
    }

    public ConditionPipelineSettings getSettings() {
        return pipeline.getSettings();
    }

    /**
     * Builds the access info of every organization that has at least one access fact.
     */
    public SortedMap<String, AccessInfo> compileAccessInfos(DirectorySnapshot snapshot, SortedSet<AccessFact> facts) {
        long start = System.nanoTime();
        Map<String, Cond> subsourceConds = new HashMap<>();
        Map<String, Map<AccessZone, List<Cond>>> orgZoneConds = new LinkedHashMap<>();

        for (AccessFact fact : facts) {
            Cond subsourceCond = subsourceConds.computeIfAbsent(fact.subsourceId(),
                    id -> subsourceCondition(snapshot, snapshot.getSubsource(id)));
            orgZoneConds
                    .computeIfAbsent(fact.orgId(), id -> new EnumMap<>(AccessZone.class))
                    .computeIfAbsent(fact.zone(), zone -> new ArrayList<>())
                    .add(subsourceCond);
        }

        SortedMap<String, AccessInfo> result = new TreeMap<>();
        for (Map.Entry<String, Map<AccessZone, List<Cond>>> orgEntry : orgZoneConds.entrySet()) {
            Organization organization = snapshot.getOrganization(orgEntry.getKey());
            Map<AccessZone, List<CompiledAccessCondition>> zoneConditions = new EnumMap<>(AccessZone.class);
            for (Map.Entry<AccessZone, List<Cond>> zoneEntry : orgEntry.getValue().entrySet()) {
                Cond cond = CondBuilder.or(zoneEntry.getValue());
                if (!organization.isFullAccess()) {
                    cond = CondBuilder.and(cond, restrictionClause());
                }
                zoneConditions.put(zoneEntry.getKey(), List.of(pipeline.process(cond)));
            }
            result.put(organization.getId(), new AccessInfo(
                    zoneConditions,
                    graphResolver.resolveResourceLimits(organization),
                    organization.isFullAccess()));
        }
        LOG.infof("Compiled access infos of %d organizations (snapshot v%d) in %dms",
                result.size(), snapshot.getVersion(), (System.nanoTime() - start) / 1_000_000);
        return Collections.unmodifiableSortedMap(result);
    }

    /**
     * Builds the push-stream mapping: source id, then subsource id, to the
     * subsource's predicate and, per zone, the stream-enabled organizations that
     * may see it. Every zone key is present. Predicates always carry the
     * restriction clause. Subsources seen by no stream-enabled organization are omitted.
     */
    public SortedMap<String, SortedMap<String, StreamAccessInfo>> compileStreamAccessInfos(
            DirectorySnapshot snapshot, SortedSet<AccessFact> facts) {
        Map<String, Map<AccessZone, Set<String>>> subsourceZoneOrgs = new TreeMap<>();
        for (AccessFact fact : facts) {
            if (!snapshot.getOrganization(fact.orgId()).isStreamApiEnabled()) {
                continue;
            }
            subsourceZoneOrgs
                    .computeIfAbsent(fact.subsourceId(), id -> emptyZoneMap())
                    .get(fact.zone())
                    .add(fact.orgId());
        }

        SortedMap<String, SortedMap<String, StreamAccessInfo>> result = new TreeMap<>();
        subsourceZoneOrgs.forEach((subsourceId, zoneOrgs) -> {
            Subsource subsource = snapshot.getSubsource(subsourceId);
            Cond cond = CondBuilder.and(subsourceCondition(snapshot, subsource), restrictionClause());
            Map<AccessZone, Set<String>> frozen = new EnumMap<>(AccessZone.class);
            zoneOrgs.forEach((zone, orgIds) -> frozen.put(zone, Collections.unmodifiableSet(orgIds)));
            result.computeIfAbsent(subsource.sourceId(), id -> new TreeMap<>())
                    .put(subsourceId, new StreamAccessInfo(predicatePipeline.process(cond),
                            Collections.unmodifiableMap(frozen)));
        });
        return result;
    }

    /**
     * Builds the notification mapping: source id, then (subsource id, full access),
     * to the predicate and the email-enabled organizations with {@code inside}
     * access to the subsource. Predicates for non-full-access organizations carry
     * the restriction clause.
     */
    public SortedMap<String, Map<SubsourceAccessKey, NotificationAccessInfo>> compileNotificationAccessInfos(
            DirectorySnapshot snapshot, SortedSet<AccessFact> facts) {
        Map<SubsourceAccessKey, Set<String>> keyOrgs = new LinkedHashMap<>();
        for (AccessFact fact : facts) {
            Organization organization = snapshot.getOrganization(fact.orgId());
            if (fact.zone() != AccessZone.INSIDE || !organization.isEmailNotificationsEnabled()) {
                continue;
            }
            keyOrgs.computeIfAbsent(new SubsourceAccessKey(fact.subsourceId(), organization.isFullAccess()),
                    key -> new TreeSet<>()).add(fact.orgId());
        }

        SortedMap<String, Map<SubsourceAccessKey, NotificationAccessInfo>> result = new TreeMap<>();
        keyOrgs.forEach((key, orgIds) -> {
            Subsource subsource = snapshot.getSubsource(key.subsourceId());
            Cond cond = subsourceCondition(snapshot, subsource);
            if (!key.fullAccess()) {
                cond = CondBuilder.and(cond, restrictionClause());
            }
            result.computeIfAbsent(subsource.sourceId(), id -> new LinkedHashMap<>())
                    .put(key, new NotificationAccessInfo(predicatePipeline.process(cond),
                            Collections.unmodifiableSet(orgIds)));
        });
        return result;
    }

    /**
     * The raw (not yet optimized nor hardened) condition of one subsource.
     */
    public Cond subsourceCondition(DirectorySnapshot snapshot, Subsource subsource) {
        List<Cond> parts = new ArrayList<>();
        parts.add(CondBuilder.eq(FIELD_SOURCE, subsource.sourceId()));
        for (String containerId : subsource.inclusionCriteriaIds()) {
            Cond containerCond = containerCondition(snapshot.getCriteriaContainers().get(containerId));
            if (containerCond != null) {
                parts.add(containerCond);
            }
        }
        for (String containerId : subsource.exclusionCriteriaIds()) {
            Cond containerCond = containerCondition(snapshot.getCriteriaContainers().get(containerId));
            if (containerCond != null) {
                parts.add(CondBuilder.not(containerCond));
            }
        }
        return CondBuilder.and(parts);
    }

    /**
     * @return the OR of the container's criteria, or null if it has none
     */
    static Cond containerCondition(CriteriaContainer container) {
        if (container.isEmpty()) {
            return null;
        }
        List<Cond> criteria = new ArrayList<>();
        if (!container.asns().isEmpty()) {
            criteria.add(CondBuilder.in("asn", container.asns()));
        }
        if (!container.categories().isEmpty()) {
            criteria.add(CondBuilder.in("category", container.categories()));
        }
        if (!container.ccs().isEmpty()) {
            criteria.add(CondBuilder.in("cc", container.ccs()));
        }
        for (IpRange range : container.ipRanges()) {
            criteria.add(CondBuilder.between("ip", range.min(), range.max()));
        }
        if (!container.names().isEmpty()) {
            criteria.add(CondBuilder.in("name", container.names()));
        }
        return CondBuilder.or(criteria);
    }

    static Cond restrictionClause() {
        return CondBuilder.and(
                CondBuilder.not(CondBuilder.eq(FIELD_RESTRICTION, RESTRICTION_INTERNAL)),
                CondBuilder.not(CondBuilder.isTrue(FIELD_IGNORED)));
    }

    private static Map<AccessZone, Set<String>> emptyZoneMap() {
        Map<AccessZone, Set<String>> zoneOrgs = new EnumMap<>(AccessZone.class);
        for (AccessZone zone : AccessZone.values()) {
            zoneOrgs.put(zone, new TreeSet<>());
        }
        return zoneOrgs;
    }
}
