package com.threatintel.auth.engine;

import com.threatintel.auth.directory.Organization;
import com.threatintel.auth.domain.NotificationConfig;
import com.threatintel.auth.error.DirectoryDataException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives email notification settings from organization nodes.
 */
@ApplicationScoped
public class NotificationConfigResolver {

    private static final Logger LOG = Logger.getLogger(NotificationConfigResolver.class);

    /**
     * @return the settings, or null if email notifications are not enabled for the organization
     */
    public NotificationConfig resolve(Organization organization) {
        if (!organization.isEmailNotificationsEnabled()) {
            return null;
        }
        String orgId = organization.getId();

        List<LocalTime> times = new ArrayList<>();
        for (String raw : organization.getEmailNotificationsTimes()) {
            try {
                times.add(parseNotificationTime(raw));
            } catch (DirectoryDataException e) {
                LOG.errorf("Incorrect format of notification time '%s' for the organization '%s' (%s)",
                        raw, orgId, e.getMessage());
            }
        }
        if (times.isEmpty()) {
            LOG.warnf("No notification times for the organization '%s'", orgId);
        }
        Collections.sort(times);

        List<String> addresses = new ArrayList<>(organization.getEmailNotificationsAddresses());
        if (addresses.isEmpty()) {
            LOG.warnf("No notification email addresses for the organization '%s'", orgId);
        }
        Collections.sort(addresses);

        if (organization.getName() == null) {
            LOG.infof("No name for the organization '%s'", orgId);
        }
        String language = organization.getEmailNotificationsLanguage();
        return new NotificationConfig(
                organization.getName(),
                organization.isStreamApiEnabled(),
                organization.isEmailNotificationsBusinessDaysOnly(),
                language == null || language.isBlank() ? NotificationConfig.DEFAULT_LANGUAGE : language,
                times,
                addresses);
    }

    /**
     * Parses {@code H}, {@code H:M} or {@code H.M} (spaces ignored).
     *
     * @throws DirectoryDataException if the text is not such a time
     */
    static LocalTime parseNotificationTime(String raw) {
        String text = raw.strip().replace(" ", "").replace('.', ':');
        String[] parts = text.split(":", -1);
        if (parts.length > 2) {
            throw new DirectoryDataException("not a time: '" + raw + "'");
        }
        int hour = parseTimePart(parts[0], 23, raw);
        int minute = parts.length == 2 ? parseTimePart(parts[1], 59, raw) : 0;
        return LocalTime.of(hour, minute);
    }

    private static int parseTimePart(String part, int max, String raw) {
        if (part.isEmpty() || part.length() > 2 || !part.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new DirectoryDataException("not a time: '" + raw + "'");
        }
        int value = Integer.parseInt(part);
        if (value > max) {
            throw new DirectoryDataException("time out of range: '" + raw + "'");
        }
        return value;
    }
}
