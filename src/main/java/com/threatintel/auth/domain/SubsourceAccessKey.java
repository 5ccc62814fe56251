package com.threatintel.auth.domain;

/**
 * A subsource seen with or without full access; the compiled condition differs between the two.
 */
public record SubsourceAccessKey(String subsourceId, boolean fullAccess) {
}
