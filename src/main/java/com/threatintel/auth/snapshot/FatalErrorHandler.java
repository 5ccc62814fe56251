package com.threatintel.auth.snapshot;

/**
 * Receives errors after which the process must not go on serving.
 */
public interface FatalErrorHandler {

    void terminate(Throwable error);
}
