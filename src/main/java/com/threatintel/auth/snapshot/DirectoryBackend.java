package com.threatintel.auth.snapshot;

import com.threatintel.auth.dto.DirectoryDocument;

/**
 * Source of directory data.
 * <p>
 * Implementations throw {@link com.threatintel.auth.error.CommunicationException}
 * when the backend cannot be reached or read, and
 * {@link com.threatintel.auth.error.DirectoryStructureException} when what it
 * delivers does not have the shape of a directory.
 */
public interface DirectoryBackend {

    /**
     * Reads the current version stamp only. Expected to be cheap.
     */
    DirectoryVersion peekVersion();

    /**
     * Fetches the whole directory.
     *
     * @param token checked between sections; a cancelled fetch throws
     *              {@link java.util.concurrent.CancellationException}
     */
    DirectoryDocument fetch(CancellationToken token);
}
