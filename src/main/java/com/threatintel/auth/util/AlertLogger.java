package com.threatintel.auth.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Provides consistent alert logging with structured metadata that can be
 * detected by log aggregators.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void backendVersionMovedBackward(long observedVersion, long previousVersion) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "DIRECTORY_VERSION_BACKWARD");
        alertData.put("severity", "CRITICAL");
        alertData.put("observed_version", observedVersion);
        alertData.put("previous_version", previousVersion);

        LOG.errorf("ALERT: Directory backend version moved backward: v%d (previously v%d). "
                + "Discarding comparison data and rebuilding.", observedVersion, previousVersion);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void snapshotRefreshFailed(long publishedVersion, long staleSeconds, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "SNAPSHOT_REFRESH_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("published_version", publishedVersion);
        alertData.put("stale_seconds", staleSeconds);
        alertData.put("error", error);

        LOG.warnf("ALERT: Directory snapshot refresh failed. Still serving v%d (not refreshed for %ds). Error: %s",
                publishedVersion, staleSeconds, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void stalenessUnrecoverable(long staleSeconds, long toleranceSeconds, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "SNAPSHOT_STALENESS_UNRECOVERABLE");
        alertData.put("severity", "CRITICAL");
        alertData.put("stale_seconds", staleSeconds);
        alertData.put("tolerance_seconds", toleranceSeconds);
        alertData.put("error", error);

        LOG.errorf("ALERT: No fresh directory snapshot for %ds (tolerance %ds). Terminating. Error: %s",
                staleSeconds, toleranceSeconds, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void cacheIntegrityFailed(String path, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CACHE_INTEGRITY_FAILURE");
        alertData.put("severity", "CRITICAL");
        alertData.put("path", path);
        alertData.put("error", error);

        LOG.errorf("ALERT: Snapshot cache at %s failed verification. Payload may be tampered. Error: %s",
                path, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void orphanedLockReleased(String lockPath, long ownerPid) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "ORPHANED_LOCK");
        alertData.put("severity", "WARNING");
        alertData.put("lock_path", lockPath);
        alertData.put("owner_pid", ownerPid);

        LOG.warnf("ALERT: Lock %s was left behind by process %d which is gone. Force-releasing.",
                lockPath, ownerPid);
        LOG.debugf("Alert details: %s", alertData);
    }
}
