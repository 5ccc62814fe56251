package com.threatintel.auth;

import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.snapshot.SnapshotPrefetcher;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Main application class.
 */
@QuarkusMain
public class AuthCoreApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(AuthCoreApplication.class);

    public static void main(String[] args) {
        Quarkus.run(AuthCoreApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Threat-intel authorization core running");
        Quarkus.waitForExit();
        return 0;
    }
}

/**
 * Validates configuration and starts snapshot prefetching at startup; stops it at shutdown.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    @Inject
    AuthCoreConfig config;

    @Inject
    SnapshotPrefetcher prefetcher;

    /**
     * A configuration problem propagates and aborts startup.
     */
    void onStart(@Observes StartupEvent event) {
        LOG.info("Threat-intel authorization core starting...");
        config.validate();
        prefetcher.start();
        LOG.infof("Threat-intel authorization core started (directory: %s, cache: %s)",
                config.directoryPath, config.isCacheEnabled() ? config.cacheDir.get() : "disabled");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutdown signal received, stopping snapshot prefetching...");
        prefetcher.stop();
        LOG.info("Graceful shutdown complete");
    }
}
