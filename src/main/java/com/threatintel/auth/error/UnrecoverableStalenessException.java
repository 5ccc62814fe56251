package com.threatintel.auth.error;

/**
 * The snapshot being served has been stale for longer than the error tolerance
 * allows. Terminates the process.
 */
public class UnrecoverableStalenessException extends AuthCoreException {
    public UnrecoverableStalenessException(String message, Throwable cause) {
        super(message, cause);
    }
}
