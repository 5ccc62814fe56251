package com.threatintel.auth.error;

/**
 * The directory backend could not be reached or read, or no snapshot is available yet.
 */
public class CommunicationException extends AuthCoreException {
    public CommunicationException(String message) {
        super(message);
    }

    public CommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
