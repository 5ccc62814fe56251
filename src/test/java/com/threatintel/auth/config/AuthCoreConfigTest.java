package com.threatintel.auth.config;

import com.threatintel.auth.config.ConditionPipelineSettings.CompileTarget;
import com.threatintel.auth.config.ConditionPipelineSettings.NegationMode;
import com.threatintel.auth.error.ConfigurationException;
import com.threatintel.auth.testing.DirectoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class AuthCoreConfigTest {

    private AuthCoreConfig config;

    @BeforeEach
    void setUp() {
        config = DirectoryFixtures.config();
    }

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(config::validate);
        assertThat(config.isCacheEnabled()).isFalse();
        assertThat(config.maxSleep()).isEqualTo(Duration.ofSeconds(12));
        assertThat(config.acceptableStaleness()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.errorTolerance()).isEqualTo(Duration.ofHours(1));
        assertThat(config.firstSnapshotTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.pipelineSettings()).isEqualTo(ConditionPipelineSettings.defaults());
    }

    @Test
    void rejectsMissingDirectoryPath() {
        config.directoryPath = " ";

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("authcore.directory.path");
    }

    @Test
    void rejectsNonPositiveSleep() {
        config.maxSleepSeconds = 0;

        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsNegativeStaleness() {
        config.acceptableStalenessSeconds = -1;

        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void errorToleranceMustCoverStaleness() {
        config.errorToleranceSeconds = 299;

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("error-tolerance-seconds");

        config.errorToleranceSeconds = 300;
        assertDoesNotThrow(config::validate);
    }

    @Test
    void rejectsNonPositiveFirstSnapshotTimeout() {
        config.firstSnapshotTimeoutSeconds = 0;

        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void cacheNeedsLongEnoughSigningKey() {
        config.cacheDir = Optional.of("/var/cache/authcore");

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("signing-key");

        config.cacheSigningKey = Optional.of("too short");
        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);

        config.cacheSigningKey = Optional.of("x".repeat(AuthCoreConfig.MIN_SIGNING_KEY_LENGTH));
        assertDoesNotThrow(config::validate);
        assertThat(config.isCacheEnabled()).isTrue();
    }

    @Test
    void blankCacheDirMeansNoCache() {
        config.cacheDir = Optional.of("  ");

        assertThat(config.isCacheEnabled()).isFalse();
        assertDoesNotThrow(config::validate);
    }

    @Test
    void sharedCacheNeedsCacheDir() {
        config.cacheShared = true;

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("authcore.cache.shared");
    }

    @Test
    void parsesPipelineOptionsLeniently() {
        config.conditionOptimize = false;
        config.negationMode = "legacy";
        config.compileTarget = " predicate ";

        assertThat(config.pipelineSettings())
                .isEqualTo(new ConditionPipelineSettings(false, NegationMode.LEGACY, CompileTarget.PREDICATE));

        config.compileTarget = "query-expression";
        assertThat(config.pipelineSettings().compileTarget()).isEqualTo(CompileTarget.QUERY_EXPRESSION);
    }

    @Test
    void rejectsUnknownPipelineOptions() {
        config.negationMode = "LOOSE";

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("LOOSE");

        config.negationMode = null;
        assertThatThrownBy(config::pipelineSettings).isInstanceOf(ConfigurationException.class);
    }
}
