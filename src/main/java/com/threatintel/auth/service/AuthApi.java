package com.threatintel.auth.service;

import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.Organization;
import com.threatintel.auth.domain.AccessInfo;
import com.threatintel.auth.domain.AnonymizedSourceMapping;
import com.threatintel.auth.domain.AuthData;
import com.threatintel.auth.domain.CombinedConfig;
import com.threatintel.auth.domain.Credential;
import com.threatintel.auth.domain.NotificationAccessInfo;
import com.threatintel.auth.domain.NotificationConfig;
import com.threatintel.auth.domain.StreamAccessInfo;
import com.threatintel.auth.domain.SubsourceAccessKey;
import com.threatintel.auth.engine.DirectoryViews;
import com.threatintel.auth.error.AuthenticationException;
import com.threatintel.auth.inside.InsideCriteriaIndex;
import com.threatintel.auth.snapshot.SnapshotHolder;
import com.threatintel.auth.util.AuthCoreMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Entry point for consumers of authorization data.
 * <p>
 * Every lookup reads the published snapshot, or the snapshot pinned by an open
 * {@link AuthSession} on the calling thread. Before the first snapshot is
 * available, lookups wait for it and fail with
 * {@link com.threatintel.auth.error.CommunicationException} on timeout, which
 * callers must not mistake for a denial.
 * <p>
 * Returned collections are unmodifiable.
 */
@ApplicationScoped
public class AuthApi {

    private static final Logger LOG = Logger.getLogger(AuthApi.class);

    private final SnapshotHolder holder;
    private final DirectoryViews views;
    private final AuthCoreMetrics metrics;

    @Inject
    public AuthApi(SnapshotHolder holder, DirectoryViews views, AuthCoreMetrics metrics) {
        this.holder = holder;
        this.views = views;
        this.metrics = metrics;
    }

    public AuthSession openSession() {
        return AuthSession.open(holder::current);
    }

    DirectorySnapshot snapshot() {
        DirectorySnapshot pinned = AuthSession.pinnedSnapshot();
        return pinned != null ? pinned : holder.current();
    }

    /**
     * Checks that the user belongs to the organization.
     *
     * @throws AuthenticationException if it does not (or either id is missing)
     */
    public AuthData authenticate(Credential credential) {
        if (credential == null || credential.orgId() == null || credential.userId() == null) {
            metrics.incrementAuthenticationFailure();
            throw new AuthenticationException("Incomplete credential");
        }
        DirectorySnapshot snapshot = snapshot();
        String storedOrgId = views.userIdsToOrgIds(snapshot).get(credential.userId());
        if (storedOrgId == null || !storedOrgId.equals(credential.orgId())) {
            metrics.incrementAuthenticationFailure();
            LOG.debugf("Authentication failed for organization '%s'", credential.orgId());
            throw new AuthenticationException("Authentication failed");
        }
        Organization organization = snapshot.getOrganization(storedOrgId);
        return new AuthData(storedOrgId, credential.userId(), organization.isFullAccess());
    }

    /**
     * @return the organization's access info, or null if the organization is
     *         unknown or has no access to anything
     */
    public AccessInfo getAccessInfo(String orgId) {
        return views.orgIdsToAccessInfos(snapshot()).get(orgId);
    }

    public InsideCriteriaIndex getInsideCriteriaResolver() {
        return views.insideCriteriaIndex(snapshot());
    }

    public SortedMap<String, AccessInfo> getOrgIdsToAccessInfos() {
        return views.orgIdsToAccessInfos(snapshot());
    }

    public SortedMap<String, NotificationConfig> getOrgIdsToNotificationConfigs() {
        return views.orgIdsToNotificationConfigs(snapshot());
    }

    public SortedMap<String, CombinedConfig> getOrgIdsToCombinedConfigs() {
        return views.orgIdsToCombinedConfigs(snapshot());
    }

    public SortedMap<String, String> getOrgIdsToActualNames() {
        return views.orgIdsToActualNames(snapshot());
    }

    public AnonymizedSourceMapping getAnonymizedSourceMapping() {
        return views.anonymizedSourceMapping(snapshot());
    }

    public SortedMap<String, String> getUserIdsToOrgIds() {
        return views.userIdsToOrgIds(snapshot());
    }

    public SortedSet<String> getOrgIds() {
        return views.orgIds(snapshot());
    }

    public SortedSet<String> getDipAnonymizationDisabledSourceIds() {
        return views.dipAnonymizationDisabledSourceIds(snapshot());
    }

    public SortedSet<String> getStreamApiEnabledOrgIds() {
        return views.streamApiEnabledOrgIds(snapshot());
    }

    public SortedSet<String> getStreamApiDisabledOrgIds() {
        return views.streamApiDisabledOrgIds(snapshot());
    }

    public SortedMap<String, SortedMap<String, StreamAccessInfo>> getSourceIdsToSubsourcesToStreamAccessInfos() {
        return views.sourceIdsToSubsourcesToStreamAccessInfos(snapshot());
    }

    public SortedMap<String, Map<SubsourceAccessKey, NotificationAccessInfo>> getSourceIdsToNotificationAccessInfos() {
        return views.sourceIdsToNotificationAccessInfos(snapshot());
    }

    public List<String> getIgnoredIpNetworks() {
        return snapshot().getIgnoredIpNetworks();
    }

    public long getSnapshotVersion() {
        return snapshot().getVersion();
    }
}
