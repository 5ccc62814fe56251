package com.threatintel.auth.config;

import com.threatintel.auth.config.ConditionPipelineSettings.CompileTarget;
import com.threatintel.auth.config.ConditionPipelineSettings.NegationMode;
import com.threatintel.auth.error.ConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Configuration of the authorization core.
 * <p>
 * Fields are public so that tests can set them directly without a CDI container.
 * Call {@link #validate()} before use; it is invoked at application startup.
 */
@ApplicationScoped
public class AuthCoreConfig {

    /**
     * Path of the directory dump read by the file backend (JSON or YAML).
     */
    @ConfigProperty(name = "authcore.directory.path", defaultValue = "directory.json")
    public String directoryPath;

    /**
     * Whether the background snapshot prefetcher runs. When disabled, the first
     * snapshot is loaded synchronously at startup and never refreshed.
     */
    @ConfigProperty(name = "authcore.prefetch.enabled", defaultValue = "true")
    public boolean prefetchEnabled;

    @ConfigProperty(name = "authcore.prefetch.max-sleep-seconds", defaultValue = "12")
    public long maxSleepSeconds;

    /**
     * How long a snapshot may lag behind the directory before it must be replaced.
     */
    @ConfigProperty(name = "authcore.prefetch.acceptable-staleness-seconds", defaultValue = "300")
    public long acceptableStalenessSeconds;

    /**
     * How long refresh errors are tolerated (the last snapshot keeps being served)
     * before the process gives up.
     */
    @ConfigProperty(name = "authcore.prefetch.error-tolerance-seconds", defaultValue = "3600")
    public long errorToleranceSeconds;

    @ConfigProperty(name = "authcore.prefetch.first-snapshot-timeout-seconds", defaultValue = "60")
    public long firstSnapshotTimeoutSeconds;

    /**
     * Directory holding the signed snapshot cache. No cache when unset.
     */
    @ConfigProperty(name = "authcore.cache.dir")
    public Optional<String> cacheDir;

    /**
     * Whether several processes share the cache directory (enables cross-process locking).
     */
    @ConfigProperty(name = "authcore.cache.shared", defaultValue = "false")
    public boolean cacheShared;

    @ConfigProperty(name = "authcore.cache.signing-key")
    public Optional<String> cacheSigningKey;

    @ConfigProperty(name = "authcore.condition.optimize", defaultValue = "true")
    public boolean conditionOptimize;

    @ConfigProperty(name = "authcore.condition.negation-mode", defaultValue = "NULL_SAFE")
    public String negationMode;

    @ConfigProperty(name = "authcore.condition.compile-target", defaultValue = "QUERY_EXPRESSION")
    public String compileTarget;

    /**
     * Minimum length of a cache signing key, in characters.
     */
    public static final int MIN_SIGNING_KEY_LENGTH = 32;

    public Duration maxSleep() {
        return Duration.ofSeconds(maxSleepSeconds);
    }

    public Duration acceptableStaleness() {
        return Duration.ofSeconds(acceptableStalenessSeconds);
    }

    public Duration errorTolerance() {
        return Duration.ofSeconds(errorToleranceSeconds);
    }

    public Duration firstSnapshotTimeout() {
        return Duration.ofSeconds(firstSnapshotTimeoutSeconds);
    }

    public boolean isCacheEnabled() {
        return cacheDir != null && cacheDir.filter(dir -> !dir.isBlank()).isPresent();
    }

    public ConditionPipelineSettings pipelineSettings() {
        return new ConditionPipelineSettings(conditionOptimize, parseNegationMode(), parseCompileTarget());
    }

    /**
     * Checks option values and their combinations.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate() {
        if (directoryPath == null || directoryPath.isBlank()) {
            throw new ConfigurationException("authcore.directory.path must be set");
        }
        if (maxSleepSeconds <= 0) {
            throw new ConfigurationException("authcore.prefetch.max-sleep-seconds must be positive, got " + maxSleepSeconds);
        }
        if (acceptableStalenessSeconds < 0) {
            throw new ConfigurationException(
                    "authcore.prefetch.acceptable-staleness-seconds must not be negative, got " + acceptableStalenessSeconds);
        }
        if (errorToleranceSeconds < acceptableStalenessSeconds) {
            throw new ConfigurationException(
                    "authcore.prefetch.error-tolerance-seconds (" + errorToleranceSeconds
                            + ") must not be smaller than authcore.prefetch.acceptable-staleness-seconds ("
                            + acceptableStalenessSeconds + ")");
        }
        if (firstSnapshotTimeoutSeconds <= 0) {
            throw new ConfigurationException("authcore.prefetch.first-snapshot-timeout-seconds must be positive");
        }
        if (isCacheEnabled()) {
            String key = cacheSigningKey == null ? null : cacheSigningKey.orElse(null);
            if (key == null || key.length() < MIN_SIGNING_KEY_LENGTH) {
                throw new ConfigurationException(
                        "authcore.cache.signing-key must be set (at least " + MIN_SIGNING_KEY_LENGTH
                                + " characters) when authcore.cache.dir is set");
            }
        } else if (cacheShared) {
            throw new ConfigurationException("authcore.cache.shared requires authcore.cache.dir");
        }
        parseNegationMode();
        parseCompileTarget();
    }

    private NegationMode parseNegationMode() {
        return parseEnum(NegationMode.class, negationMode, "authcore.condition.negation-mode");
    }

    private CompileTarget parseCompileTarget() {
        return parseEnum(CompileTarget.class, compileTarget, "authcore.condition.compile-target");
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        if (value == null) {
            throw new ConfigurationException(key + " must be set");
        }
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Illegal value of " + key + ": '" + value + "'");
        }
    }
}
