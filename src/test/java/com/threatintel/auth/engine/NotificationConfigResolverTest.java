package com.threatintel.auth.engine;

import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.domain.NotificationConfig;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.dto.OrganizationEntry;
import com.threatintel.auth.error.DirectoryDataException;
import com.threatintel.auth.testing.DirectoryFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationConfigResolverTest {

    private final NotificationConfigResolver resolver = new NotificationConfigResolver();

    @Test
    void parsesSupportedTimeFormats() {
        assertThat(NotificationConfigResolver.parseNotificationTime("9:30")).isEqualTo(LocalTime.of(9, 30));
        assertThat(NotificationConfigResolver.parseNotificationTime(" 8 ")).isEqualTo(LocalTime.of(8, 0));
        assertThat(NotificationConfigResolver.parseNotificationTime("7.05")).isEqualTo(LocalTime.of(7, 5));
        assertThat(NotificationConfigResolver.parseNotificationTime("12 : 15")).isEqualTo(LocalTime.of(12, 15));
        assertThat(NotificationConfigResolver.parseNotificationTime("23:59")).isEqualTo(LocalTime.of(23, 59));
    }

    @Test
    void rejectsMalformedTimes() {
        for (String raw : List.of("24", "9:60", "abc", "1:2:3", "", ":30", "9:", "100")) {
            assertThatThrownBy(() -> NotificationConfigResolver.parseNotificationTime(raw))
                    .as("'%s'", raw)
                    .isInstanceOf(DirectoryDataException.class);
        }
    }

    @Test
    void resolvesSettingsOfEmailEnabledOrganization() {
        DirectorySnapshot snapshot = DirectoryFixtures.standardSnapshot();

        NotificationConfig config = resolver.resolve(snapshot.getOrganization("o5"));

        assertThat(config.name()).isNull();
        assertThat(config.streamApiEnabled()).isTrue();
        assertThat(config.businessDaysOnly()).isFalse();
        assertThat(config.language()).isEqualTo(NotificationConfig.DEFAULT_LANGUAGE);
        assertThat(config.times()).containsExactly(LocalTime.of(8, 0), LocalTime.of(9, 30));
        assertThat(config.addresses()).containsExactly("abuse@o5.example", "soc@o5.example");
    }

    @Test
    void noSettingsWhenEmailNotificationsAreDisabled() {
        DirectorySnapshot snapshot = DirectoryFixtures.standardSnapshot();

        assertThat(resolver.resolve(snapshot.getOrganization("o1"))).isNull();
    }

    @Test
    void skipsMalformedTimesAndKeepsExplicitLanguage() {
        DirectoryDocument document = DirectoryFixtures.standardDocument();
        OrganizationEntry o9 = new OrganizationEntry("o9");
        o9.name = "Org Nine";
        o9.emailNotificationsEnabled = "true";
        o9.emailNotificationsBusinessDaysOnly = "TRUE";
        o9.emailNotificationsLanguage = "en";
        o9.emailNotificationsTimes.addAll(List.of("25:00", "14.00", "noon"));
        document.organizations.add(o9);
        DirectorySnapshot snapshot = new SnapshotAssembler().assemble(document);

        NotificationConfig config = resolver.resolve(snapshot.getOrganization("o9"));

        assertThat(config.name()).isEqualTo("Org Nine");
        assertThat(config.businessDaysOnly()).isTrue();
        assertThat(config.language()).isEqualTo("en");
        assertThat(config.times()).containsExactly(LocalTime.of(14, 0));
        assertThat(config.addresses()).isEmpty();
    }
}
