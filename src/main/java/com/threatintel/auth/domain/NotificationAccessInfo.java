package com.threatintel.auth.domain;

import java.util.Set;

/**
 * What the notification generator needs for one subsource and one access variant.
 *
 * @param condition compiled per-record predicate
 * @param orgIds    email-enabled organizations with {@code inside} access to the subsource
 */
public record NotificationAccessInfo(CompiledAccessCondition condition, Set<String> orgIds) {
}
