package com.threatintel.auth.domain;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Event categories known to the platform.
 */
public enum EventCategory {
    AMPLIFIER("amplifier"),
    BACKDOOR("backdoor"),
    BOTS("bots"),
    CNC("cnc"),
    DEFACE("deface"),
    DNS_QUERY("dns-query"),
    DOS_ATTACKER("dos-attacker"),
    DOS_VICTIM("dos-victim"),
    EXPOSED("exposed"),
    FLOW("flow"),
    FLOW_ANOMALY("flow-anomaly"),
    FRAUD("fraud"),
    LEAK("leak"),
    MALURL("malurl"),
    MALWARE_ACTION("malware-action"),
    OTHER("other"),
    PHISH("phish"),
    PROXY("proxy"),
    SANDBOX_URL("sandbox-url"),
    SCAM("scam"),
    SCANNING("scanning"),
    SERVER_EXPLOIT("server-exploit"),
    SPAM("spam"),
    SPAM_URL("spam-url"),
    TOR("tor"),
    VULNERABLE("vulnerable"),
    WEBINJECT("webinject");

    private static final Map<String, EventCategory> BY_VALUE = new HashMap<>();

    static {
        for (EventCategory category : values()) {
            BY_VALUE.put(category.value, category);
        }
    }

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    /**
     * The wire/database value, e.g. {@code dns-query}.
     */
    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown category
     */
    public static EventCategory fromValue(String value) {
        EventCategory category = value == null ? null : BY_VALUE.get(value.trim().toLowerCase(Locale.ROOT));
        if (category == null) {
            throw new IllegalArgumentException("Unknown event category: '" + value + "'");
        }
        return category;
    }
}
