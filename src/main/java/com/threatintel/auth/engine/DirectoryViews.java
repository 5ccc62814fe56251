package com.threatintel.auth.engine;

import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.Organization;
import com.threatintel.auth.directory.Source;
import com.threatintel.auth.domain.AccessFact;
import com.threatintel.auth.domain.AccessInfo;
import com.threatintel.auth.domain.AnonymizedSourceMapping;
import com.threatintel.auth.domain.CombinedConfig;
import com.threatintel.auth.domain.NotificationAccessInfo;
import com.threatintel.auth.domain.NotificationConfig;
import com.threatintel.auth.domain.StreamAccessInfo;
import com.threatintel.auth.domain.SubsourceAccessKey;
import com.threatintel.auth.inside.InsideCriteria;
import com.threatintel.auth.inside.InsideCriteriaIndex;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Views derived from a directory snapshot, each computed at most once per
 * snapshot and memoized on it.
 * <p>
 * Returned collections are unmodifiable and may be shared between callers.
 */
@ApplicationScoped
public class DirectoryViews {

    private static final Logger LOG = Logger.getLogger(DirectoryViews.class);

    static final String USER_IDS_TO_ORG_IDS = "userIdsToOrgIds";
    static final String ORG_IDS = "orgIds";
    static final String ACCESS_FACTS = "accessFacts";
    static final String ACCESS_INFOS = "orgIdsToAccessInfos";
    static final String NOTIFICATION_CONFIGS = "orgIdsToNotificationConfigs";
    static final String COMBINED_CONFIGS = "orgIdsToCombinedConfigs";
    static final String ACTUAL_NAMES = "orgIdsToActualNames";
    static final String INSIDE_CRITERIA_INDEX = "insideCriteriaIndex";
    static final String ANONYMIZED_SOURCE_MAPPING = "anonymizedSourceMapping";
    static final String DIP_ANONYMIZATION_DISABLED = "dipAnonymizationDisabledSourceIds";
    static final String STREAM_API_ENABLED = "streamApiEnabledOrgIds";
    static final String STREAM_API_DISABLED = "streamApiDisabledOrgIds";
    static final String STREAM_ACCESS_INFOS = "sourceIdsToSubsourcesToStreamAccessInfos";
    static final String NOTIFICATION_ACCESS_INFOS = "sourceIdsToNotificationAccessInfos";

    private final GraphResolver graphResolver;
    private final AccessInfoCompiler accessInfoCompiler;
    private final NotificationConfigResolver notificationConfigResolver;

    @Inject
    public DirectoryViews(GraphResolver graphResolver,
                          AccessInfoCompiler accessInfoCompiler,
                          NotificationConfigResolver notificationConfigResolver) {
        this.graphResolver = graphResolver;
        this.accessInfoCompiler = accessInfoCompiler;
        this.notificationConfigResolver = notificationConfigResolver;
    }

    /**
     * Computes the two most expensive views so that they are ready before the
     * snapshot is published.
     */
    public void warmUp(DirectorySnapshot snapshot) {
        long start = System.nanoTime();
        orgIdsToAccessInfos(snapshot);
        orgIdsToCombinedConfigs(snapshot);
        LOG.infof("Warmed up views of snapshot v%d in %dms",
                snapshot.getVersion(), (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * User login to organization id. A login listed under more than one
     * organization is reported and kept for the first of them (in id order).
     */
    public SortedMap<String, String> userIdsToOrgIds(DirectorySnapshot snapshot) {
        return snapshot.memoize(USER_IDS_TO_ORG_IDS, () -> {
            SortedMap<String, String> result = new TreeMap<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                for (String userId : organization.getUserIds()) {
                    String stored = result.putIfAbsent(userId, organization.getId());
                    if (stored != null && !stored.equals(organization.getId())) {
                        LOG.errorf("Problem with directory data: user '%s' belongs to more than one organization"
                                        + " ('%s' and '%s'; only the former is kept)",
                                userId, stored, organization.getId());
                    }
                }
            }
            return Collections.unmodifiableSortedMap(result);
        });
    }

    public SortedSet<String> orgIds(DirectorySnapshot snapshot) {
        return snapshot.memoize(ORG_IDS,
                () -> Collections.unmodifiableSortedSet(new TreeSet<>(snapshot.getOrganizations().keySet())));
    }

    public SortedSet<AccessFact> accessFacts(DirectorySnapshot snapshot) {
        return snapshot.memoize(ACCESS_FACTS, () -> graphResolver.resolveAccessFacts(snapshot));
    }

    /**
     * Organization id to access info, for organizations with at least one access fact.
     */
    public SortedMap<String, AccessInfo> orgIdsToAccessInfos(DirectorySnapshot snapshot) {
        return snapshot.memoize(ACCESS_INFOS,
                () -> accessInfoCompiler.compileAccessInfos(snapshot, accessFacts(snapshot)));
    }

    /**
     * Organization id to notification settings, for email-enabled organizations.
     */
    public SortedMap<String, NotificationConfig> orgIdsToNotificationConfigs(DirectorySnapshot snapshot) {
        return snapshot.memoize(NOTIFICATION_CONFIGS, () -> {
            SortedMap<String, NotificationConfig> result = new TreeMap<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                NotificationConfig config = notificationConfigResolver.resolve(organization);
                if (config != null) {
                    result.put(organization.getId(), config);
                }
            }
            return Collections.unmodifiableSortedMap(result);
        });
    }

    public SortedMap<String, CombinedConfig> orgIdsToCombinedConfigs(DirectorySnapshot snapshot) {
        return snapshot.memoize(COMBINED_CONFIGS, () -> {
            Map<String, NotificationConfig> notificationConfigs = orgIdsToNotificationConfigs(snapshot);
            SortedMap<String, CombinedConfig> result = new TreeMap<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                result.put(organization.getId(), new CombinedConfig(
                        organization.getName(),
                        notificationConfigs.get(organization.getId()),
                        organization.getInsideCriteria()));
            }
            return Collections.unmodifiableSortedMap(result);
        });
    }

    /**
     * Organization id to actual name, for organizations that have a name.
     */
    public SortedMap<String, String> orgIdsToActualNames(DirectorySnapshot snapshot) {
        return snapshot.memoize(ACTUAL_NAMES, () -> {
            SortedMap<String, String> result = new TreeMap<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                if (organization.getName() != null) {
                    result.put(organization.getId(), organization.getName());
                }
            }
            return Collections.unmodifiableSortedMap(result);
        });
    }

    public InsideCriteriaIndex insideCriteriaIndex(DirectorySnapshot snapshot) {
        return snapshot.memoize(INSIDE_CRITERIA_INDEX, () -> {
            List<InsideCriteria> criteria = new ArrayList<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                if (!organization.getInsideCriteria().isEmpty()) {
                    criteria.add(organization.getInsideCriteria());
                }
            }
            return InsideCriteriaIndex.build(criteria);
        });
    }

    public AnonymizedSourceMapping anonymizedSourceMapping(DirectorySnapshot snapshot) {
        return snapshot.memoize(ANONYMIZED_SOURCE_MAPPING, () -> {
            Map<String, String> forward = new TreeMap<>();
            Map<String, String> reverse = new TreeMap<>();
            for (Source source : snapshot.getSources().values()) {
                if (source.anonymizedId() == null) {
                    LOG.errorf("Problem with directory data for the source '%s': no anonymized id", source.id());
                    continue;
                }
                forward.put(source.id(), source.anonymizedId());
                reverse.put(source.anonymizedId(), source.id());
            }
            return new AnonymizedSourceMapping(forward, reverse);
        });
    }

    /**
     * Sources for which anonymization of the destination IP is not enabled.
     */
    public SortedSet<String> dipAnonymizationDisabledSourceIds(DirectorySnapshot snapshot) {
        return snapshot.memoize(DIP_ANONYMIZATION_DISABLED, () -> {
            SortedSet<String> result = new TreeSet<>();
            for (Source source : snapshot.getSources().values()) {
                if (!source.dipAnonymizationEnabled()) {
                    result.add(source.id());
                }
            }
            return Collections.unmodifiableSortedSet(result);
        });
    }

    public SortedSet<String> streamApiEnabledOrgIds(DirectorySnapshot snapshot) {
        return snapshot.memoize(STREAM_API_ENABLED, () -> {
            SortedSet<String> result = new TreeSet<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                if (organization.isStreamApiEnabled()) {
                    result.add(organization.getId());
                }
            }
            return Collections.unmodifiableSortedSet(result);
        });
    }

    /**
     * Organizations whose stream API flag is present but not enabled (false or malformed).
     * Organizations without the flag are in neither set.
     */
    public SortedSet<String> streamApiDisabledOrgIds(DirectorySnapshot snapshot) {
        return snapshot.memoize(STREAM_API_DISABLED, () -> {
            SortedSet<String> result = new TreeSet<>();
            for (Organization organization : snapshot.getOrganizations().values()) {
                if (organization.isStreamApiFlagSet() && !organization.isStreamApiEnabled()) {
                    result.add(organization.getId());
                }
            }
            return Collections.unmodifiableSortedSet(result);
        });
    }

    public SortedMap<String, SortedMap<String, StreamAccessInfo>> sourceIdsToSubsourcesToStreamAccessInfos(
            DirectorySnapshot snapshot) {
        return snapshot.memoize(STREAM_ACCESS_INFOS, () -> Collections.unmodifiableSortedMap(
                accessInfoCompiler.compileStreamAccessInfos(snapshot, accessFacts(snapshot))));
    }

    public SortedMap<String, Map<SubsourceAccessKey, NotificationAccessInfo>> sourceIdsToNotificationAccessInfos(
            DirectorySnapshot snapshot) {
        return snapshot.memoize(NOTIFICATION_ACCESS_INFOS, () -> Collections.unmodifiableSortedMap(
                accessInfoCompiler.compileNotificationAccessInfos(snapshot, accessFacts(snapshot))));
    }
}
