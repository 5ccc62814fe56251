package com.threatintel.auth.error;

/**
 * A malformed attribute value in the directory (bad flag, bad resource limit,
 * bad network, bad notification time).
 * <p>
 * Usually caught near the source, logged, and treated as "attribute unset".
 */
public class DirectoryDataException extends AuthCoreException {
    public DirectoryDataException(String message) {
        super(message);
    }

    public DirectoryDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
