package com.threatintel.auth.cache;

import com.threatintel.auth.util.AlertLogger;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;

/**
 * An advisory lock on a file, usable in shared or exclusive mode.
 * <p>
 * Across processes the lock is an OS file lock. Within one JVM, where OS locks
 * cannot be stacked on the same file, all {@code CacheLock} handles for one path
 * share a single state object that arbitrates between them and holds the OS
 * lock for as long as any of them does. So two handles for the same path behave
 * like two processes, whichever JVM they live in.
 * <p>
 * The exclusive holder records its pid in a sidecar file. An acquirer that finds
 * the sidecar of a process that no longer exists reports the orphaned lock and
 * removes the sidecar before locking.
 * <p>
 * A handle is not reentrant and is meant to be used by one thread at a time.
 */
public class CacheLock {

    private static final Logger LOG = Logger.getLogger(CacheLock.class);

    private static final Map<Path, PathState> STATES = new HashMap<>();

    enum Mode { NONE, SHARED, EXCLUSIVE }

    private final Path path;
    private final Path ownerPath;
    private final PathState state;
    private Mode mode = Mode.NONE;

    public CacheLock(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        this.path = absolute;
        this.ownerPath = absolute.resolveSibling(absolute.getFileName() + ".owner");
        synchronized (STATES) {
            this.state = STATES.computeIfAbsent(absolute, PathState::new);
        }
    }

    public Path getPath() {
        return path;
    }

    public void lockShared() {
        acquire(false, true);
    }

    public void lockExclusive() {
        acquire(true, true);
    }

    /**
     * @return whether the lock was acquired; never waits
     */
    public boolean tryLockExclusive() {
        return acquire(true, false);
    }

    public boolean isHeld() {
        return mode != Mode.NONE;
    }

    Mode getMode() {
        return mode;
    }

    public void unlock() {
        if (mode == Mode.NONE) {
            throw new IllegalStateException("Lock " + path + " is not held");
        }
        boolean exclusive = mode == Mode.EXCLUSIVE;
        mode = Mode.NONE;
        state.release(exclusive, ownerPath);
    }

    private boolean acquire(boolean exclusive, boolean wait) {
        if (mode != Mode.NONE) {
            throw new IllegalStateException("Lock " + path + " is already held (" + mode + ")");
        }
        boolean acquired = state.acquire(exclusive, wait, ownerPath);
        if (acquired) {
            mode = exclusive ? Mode.EXCLUSIVE : Mode.SHARED;
        }
        return acquired;
    }

    /**
     * Lock bookkeeping for one path, shared by all handles in this JVM.
     */
    private static final class PathState {

        private final Path path;
        private int sharedHolders;
        private boolean exclusiveHeld;
        private FileChannel channel;
        private FileLock osLock;

        PathState(Path path) {
            this.path = path;
        }

        synchronized boolean acquire(boolean exclusive, boolean wait, Path ownerPath) {
            while (!compatible(exclusive)) {
                if (!wait) {
                    return false;
                }
                try {
                    wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for lock " + path, e);
                }
            }
            if (sharedHolders == 0 && !exclusiveHeld) {
                releaseOrphan(ownerPath);
                if (!lockOs(exclusive, wait)) {
                    return false;
                }
            }
            if (exclusive) {
                exclusiveHeld = true;
                writeOwner(ownerPath);
            } else {
                sharedHolders++;
            }
            return true;
        }

        synchronized void release(boolean exclusive, Path ownerPath) {
            if (exclusive) {
                exclusiveHeld = false;
                deleteOwner(ownerPath);
            } else {
                sharedHolders--;
            }
            if (sharedHolders == 0 && !exclusiveHeld) {
                unlockOs();
            }
            notifyAll();
        }

        private boolean compatible(boolean exclusive) {
            if (exclusiveHeld) {
                return false;
            }
            return !exclusive || sharedHolders == 0;
        }

        private boolean lockOs(boolean exclusive, boolean wait) {
            try {
                if (channel == null) {
                    Files.createDirectories(path.getParent());
                    channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
                            StandardOpenOption.WRITE);
                }
                osLock = wait
                        ? channel.lock(0, Long.MAX_VALUE, !exclusive)
                        : channel.tryLock(0, Long.MAX_VALUE, !exclusive);
                return osLock != null;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot lock " + path, e);
            }
        }

        private void unlockOs() {
            if (osLock == null) {
                return;
            }
            try {
                osLock.release();
            } catch (IOException e) {
                LOG.warnf("Cannot release lock %s: %s", path, e.getMessage());
            } finally {
                osLock = null;
            }
        }

        /**
         * Called with no holder in this JVM, so a sidecar naming our own pid is stale too.
         */
        private void releaseOrphan(Path ownerPath) {
            String content;
            try {
                content = Files.readString(ownerPath, StandardCharsets.US_ASCII).trim();
            } catch (NoSuchFileException e) {
                return;
            } catch (IOException e) {
                LOG.warnf("Cannot read lock owner file %s: %s", ownerPath, e.getMessage());
                return;
            }
            long pid;
            try {
                pid = Long.parseLong(content);
            } catch (NumberFormatException e) {
                LOG.warnf("Malformed lock owner file %s ('%s'), removing it", ownerPath, content);
                deleteOwner(ownerPath);
                return;
            }
            boolean alive = pid != ProcessHandle.current().pid()
                    && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
            if (!alive) {
                AlertLogger.orphanedLockReleased(path.toString(), pid);
                deleteOwner(ownerPath);
            }
        }

        private static void writeOwner(Path ownerPath) {
            try {
                Files.writeString(ownerPath, Long.toString(ProcessHandle.current().pid()), StandardCharsets.US_ASCII);
            } catch (IOException e) {
                LOG.warnf("Cannot write lock owner file %s: %s", ownerPath, e.getMessage());
            }
        }

        private static void deleteOwner(Path ownerPath) {
            try {
                Files.deleteIfExists(ownerPath);
            } catch (IOException e) {
                LOG.warnf("Cannot remove lock owner file %s: %s", ownerPath, e.getMessage());
            }
        }
    }
}
