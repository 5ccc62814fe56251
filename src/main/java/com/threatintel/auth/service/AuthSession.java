package com.threatintel.auth.service;

import com.threatintel.auth.directory.DirectorySnapshot;

import java.util.function.Supplier;

/**
 * Pins one directory snapshot to the current thread, so that every lookup made
 * through {@link AuthApi} until the session is closed sees the same snapshot,
 * even if a newer one is published meanwhile.
 * <p>
 * Sessions nest: opening a session inside an open one reuses the outer
 * snapshot, and the pin is dropped when the outermost session closes.
 * <pre>
 * try (AuthSession session = authApi.openSession()) {
 *     ...
 * }
 * </pre>
 */
public final class AuthSession implements AutoCloseable {

    private static final ThreadLocal<Pin> PIN = new ThreadLocal<>();

    private static final class Pin {
        final DirectorySnapshot snapshot;
        int depth;

        Pin(DirectorySnapshot snapshot) {
            this.snapshot = snapshot;
        }
    }

    private final Pin pin;
    private boolean closed;

    private AuthSession(Pin pin) {
        this.pin = pin;
    }

    static AuthSession open(Supplier<DirectorySnapshot> snapshotSource) {
        Pin pin = PIN.get();
        if (pin == null) {
            pin = new Pin(snapshotSource.get());
            PIN.set(pin);
        }
        pin.depth++;
        return new AuthSession(pin);
    }

    /**
     * @return the snapshot pinned to this thread, or null outside any session
     */
    static DirectorySnapshot pinnedSnapshot() {
        Pin pin = PIN.get();
        return pin != null ? pin.snapshot : null;
    }

    public DirectorySnapshot getSnapshot() {
        return pin.snapshot;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (PIN.get() != pin) {
            throw new IllegalStateException("Session closed on a thread that did not open it");
        }
        closed = true;
        if (--pin.depth == 0) {
            PIN.remove();
        }
    }
}
