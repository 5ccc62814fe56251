package com.threatintel.auth.snapshot;

import io.quarkus.runtime.Quarkus;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Stops the application with exit code 1.
 */
@ApplicationScoped
public class QuarkusFatalErrorHandler implements FatalErrorHandler {

    private static final Logger LOG = Logger.getLogger(QuarkusFatalErrorHandler.class);

    @Override
    public void terminate(Throwable error) {
        LOG.fatalf(error, "Fatal error, shutting down: %s", error.getMessage());
        Quarkus.asyncExit(1);
    }
}
