package com.threatintel.auth.error;

/**
 * Invalid or missing configuration. Raised at startup; never recovered from.
 */
public class ConfigurationException extends AuthCoreException {
    public ConfigurationException(String message) {
        super(message);
    }
}
