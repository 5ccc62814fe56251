package com.threatintel.auth.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventRecordTest {

    @Test
    void networkFieldsComeFromAddresses() {
        EventRecord event = EventRecord.builder()
                .address("10.0.0.1", 64500L, "PL")
                .address(null, 64501L, null)
                .ip("0.0.0.7")
                .build();

        assertThat(event.getValues(EventRecord.IP)).containsExactly(0x0A000001L, 7L);
        assertThat(event.getValues(EventRecord.ASN)).containsExactly(64500L, 64501L);
        assertThat(event.getValues(EventRecord.CC)).containsExactly("PL");
        assertThat(event.getAddresses()).hasSize(3);
    }

    @Test
    void scalarFieldsAreSingleValued() {
        EventRecord event = EventRecord.builder()
                .field("source", "x")
                .field("count", 3)
                .field("name", List.of("foo", "bar"))
                .build();

        assertThat(event.getValues("source")).containsExactly("x");
        assertThat(event.get("count")).isEqualTo(3L);
        assertThat(event.getValues("name")).containsExactly("foo", "bar");
        assertThat(event.getValues("missing")).isEmpty();
        assertThat(event.getString("missing")).isNull();
        assertThat(event.getValues(EventRecord.IP)).isEmpty();
    }

    @Test
    void equalBuildsAreEqual() {
        EventRecord first = EventRecord.builder().field("source", "x").ip("1.2.3.4").build();
        EventRecord second = EventRecord.builder().field("source", "x").ip("1.2.3.4").build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(EventRecord.builder().field("source", "y").ip("1.2.3.4").build());
    }
}
