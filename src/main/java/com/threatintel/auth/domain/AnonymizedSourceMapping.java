package com.threatintel.auth.domain;

import java.util.Map;

/**
 * Source id to anonymized source id, and back. Sources without an anonymized id are absent.
 */
public record AnonymizedSourceMapping(Map<String, String> forward, Map<String, String> reverse) {

    public AnonymizedSourceMapping {
        forward = Map.copyOf(forward);
        reverse = Map.copyOf(reverse);
    }
}
