package com.threatintel.auth.domain;

import com.threatintel.auth.inside.InsideCriteria;

/**
 * Per-organization bundle consumed by the notification generator.
 *
 * @param name               actual name (may be null)
 * @param notificationConfig null when email notifications are disabled
 * @param insideCriteria     never null (possibly empty)
 */
public record CombinedConfig(String name, NotificationConfig notificationConfig, InsideCriteria insideCriteria) {
}
