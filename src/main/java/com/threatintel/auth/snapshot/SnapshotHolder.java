package com.threatintel.auth.snapshot;

import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.error.CommunicationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the currently published snapshot.
 * <p>
 * Publishing replaces a reference; readers never block each other. Until the
 * first snapshot has been published, {@link #current()} waits for it (bounded
 * by the first-snapshot timeout).
 */
@ApplicationScoped
public class SnapshotHolder {

    private static final Logger LOG = Logger.getLogger(SnapshotHolder.class);

    private final Duration firstSnapshotTimeout;
    private final CompletableFuture<DirectorySnapshot> first = new CompletableFuture<>();
    private volatile DirectorySnapshot current;

    @Inject
    public SnapshotHolder(AuthCoreConfig config) {
        this(config.firstSnapshotTimeout());
    }

    public SnapshotHolder(Duration firstSnapshotTimeout) {
        this.firstSnapshotTimeout = firstSnapshotTimeout;
    }

    public void publish(DirectorySnapshot snapshot) {
        DirectorySnapshot previous = current;
        current = snapshot;
        first.complete(snapshot);
        LOG.infof("Published directory snapshot v%d (previous: %s)",
                snapshot.getVersion(), previous != null ? "v" + previous.getVersion() : "none");
    }

    /**
     * @return the published snapshot, or null if there is none yet; never waits
     */
    public DirectorySnapshot peek() {
        return current;
    }

    /**
     * @throws CommunicationException if no snapshot becomes available in time
     */
    public DirectorySnapshot current() {
        DirectorySnapshot snapshot = current;
        if (snapshot != null) {
            return snapshot;
        }
        try {
            first.get(firstSnapshotTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CommunicationException(
                    "No directory snapshot available after " + firstSnapshotTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            throw new CommunicationException("No directory snapshot available", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommunicationException("Interrupted while waiting for the first directory snapshot", e);
        }
        return current;
    }

    /**
     * Makes threads waiting for the first snapshot fail with the given cause.
     * Has no effect once a snapshot has been published.
     */
    public void failFirst(Throwable cause) {
        first.completeExceptionally(cause);
    }
}
