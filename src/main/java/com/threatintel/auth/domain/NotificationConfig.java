package com.threatintel.auth.domain;

import java.time.LocalTime;
import java.util.List;

/**
 * Email notification settings of an organization.
 *
 * @param name              organization's actual name (may be null)
 * @param streamApiEnabled  whether the organization also receives the push stream
 * @param businessDaysOnly  whether notifications are sent on business days only
 * @param language          notification language code
 * @param times             sorted notification times
 * @param addresses         sorted recipient addresses
 */
public record NotificationConfig(
        String name,
        boolean streamApiEnabled,
        boolean businessDaysOnly,
        String language,
        List<LocalTime> times,
        List<String> addresses) {

    public static final String DEFAULT_LANGUAGE = "pl";

    public NotificationConfig {
        times = List.copyOf(times);
        addresses = List.copyOf(addresses);
    }
}
