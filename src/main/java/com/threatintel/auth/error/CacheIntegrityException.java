package com.threatintel.auth.error;

/**
 * The cached snapshot payload failed verification (bad signature, malformed
 * header, too old). Treated as a cache miss.
 */
public class CacheIntegrityException extends AuthCoreException {
    public CacheIntegrityException(String message) {
        super(message);
    }

    public CacheIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
