package com.threatintel.auth.error;

/**
 * The presented credential does not identify a known user of the claimed organization.
 */
public class AuthenticationException extends AuthCoreException {
    public AuthenticationException(String message) {
        super(message);
    }
}
