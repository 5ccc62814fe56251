package com.threatintel.auth.domain;

/**
 * Identity claimed by a client: organization and user login.
 */
public record Credential(String orgId, String userId) {

    @Override
    public String toString() {
        return "Credential{orgId=" + orgId + "}";
    }
}
