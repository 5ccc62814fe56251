package com.threatintel.auth.error;

/**
 * Base of all errors raised by the authorization core.
 */
public class AuthCoreException extends RuntimeException {
    public AuthCoreException(String message) {
        super(message);
    }

    public AuthCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
