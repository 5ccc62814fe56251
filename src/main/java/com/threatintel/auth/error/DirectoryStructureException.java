package com.threatintel.auth.error;

/**
 * The directory graph itself is broken (dangling reference, duplicate id,
 * unreadable document). A snapshot is not built from such data.
 */
public class DirectoryStructureException extends AuthCoreException {
    public DirectoryStructureException(String message) {
        super(message);
    }

    public DirectoryStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
