package com.threatintel.auth.domain;

/**
 * Result of a successful authentication.
 */
public record AuthData(String orgId, String userId, boolean fullAccess) {
}
