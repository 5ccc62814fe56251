package com.threatintel.auth.cache;

import com.threatintel.auth.error.CacheIntegrityException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class CachePayloadCodecTest {

    private static final String KEY = "0123456789abcdef0123456789abcdef";
    private static final String STAMPER = "0123456789abcdef0123456789abcdef01234567";
    private static final Instant WRITTEN_AT = Instant.ofEpochMilli(1_700_000_000_123L);
    private static final byte[] BODY = "{\"version\":5}".getBytes(StandardCharsets.UTF_8);

    private final Clock clock = Clock.fixed(WRITTEN_AT, ZoneOffset.UTC);
    private final CachePayloadCodec codec = new CachePayloadCodec(KEY, STAMPER, clock);

    @Test
    void decodesWhatItEncoded() {
        byte[] payload = codec.encode(BODY);

        CachePayloadCodec.Decoded decoded = codec.decode(payload);

        assertThat(decoded.body()).isEqualTo(BODY);
        assertThat(decoded.stamperId()).isEqualTo(STAMPER);
        assertThat(decoded.timestamp()).isCloseTo(1_700_000_000.123, offset(1e-6));
    }

    @Test
    void headerHasFixedLayout() {
        String payload = new String(codec.encode(BODY), StandardCharsets.US_ASCII);
        String[] lines = payload.split("\n", 4);

        assertThat(lines[0]).hasSize(CachePayloadCodec.SIGNATURE_LENGTH).matches("[0-9a-f]+");
        assertThat(lines[1]).isEqualTo("00001700000000.123000");
        assertThat(lines[2]).isEqualTo(STAMPER);
        assertThat(lines[3]).isEqualTo("{\"version\":5}");
    }

    @Test
    void formatsTimestampWithFixedWidth() {
        assertThat(CachePayloadCodec.formatTimestamp(0)).isEqualTo("00000000000000.000000");
        assertThat(CachePayloadCodec.formatTimestamp(1_700_000_000_000_001L)).isEqualTo("00001700000000.000001");
        assertThat(CachePayloadCodec.formatTimestamp(1_700_000_000_000_001L))
                .hasSize(CachePayloadCodec.TIMESTAMP_LENGTH);
    }

    @Test
    void detectsTamperedBody() {
        byte[] payload = codec.encode(BODY);
        payload[payload.length - 2] ^= 1;

        assertThatThrownBy(() -> codec.decode(payload))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("signature mismatch");
    }

    @Test
    void detectsTamperedHeader() {
        byte[] payload = codec.encode(BODY);
        payload[CachePayloadCodec.SIGNATURE_LENGTH + 3] = '9';

        assertThatThrownBy(() -> codec.decode(payload))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("signature mismatch");
    }

    @Test
    void rejectsPayloadSignedWithOtherKey() {
        CachePayloadCodec other = new CachePayloadCodec("another key, also long enough!!!", STAMPER, clock);

        assertThatThrownBy(() -> codec.decode(other.encode(BODY)))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("signature mismatch");
    }

    @Test
    void rejectsTruncatedPayload() {
        byte[] payload = codec.encode(BODY);

        assertThatThrownBy(() -> codec.decode(Arrays.copyOf(payload, 100)))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("truncated");
    }

    @Test
    void rejectsPayloadWithoutSignatureSeparator() {
        byte[] payload = codec.encode(BODY);
        payload[CachePayloadCodec.SIGNATURE_LENGTH] = ' ';

        assertThatThrownBy(() -> codec.decode(payload))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("malformed signature field");
    }

    @Test
    void rejectsPayloadOlderThanMaximumAge() {
        byte[] payload = codec.encode(BODY);
        Clock later = Clock.offset(clock, CachePayloadCodec.MAX_AGE.plus(Duration.ofSeconds(1)));
        Clock almost = Clock.offset(clock, CachePayloadCodec.MAX_AGE.minus(Duration.ofSeconds(1)));

        assertThat(new CachePayloadCodec(KEY, STAMPER, almost).decode(payload).body()).isEqualTo(BODY);
        assertThatThrownBy(() -> new CachePayloadCodec(KEY, STAMPER, later).decode(payload))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("too old");
    }

    @Test
    void acceptsPayloadsFromOtherStampers() {
        CachePayloadCodec reader = new CachePayloadCodec(KEY, clock);

        assertThat(reader.getStamperId()).hasSize(CachePayloadCodec.STAMPER_ID_LENGTH).isNotEqualTo(STAMPER);
        assertThat(reader.decode(codec.encode(BODY)).stamperId()).isEqualTo(STAMPER);
    }

    @Test
    void validatesConstructorArguments() {
        assertThatThrownBy(() -> new CachePayloadCodec("", clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CachePayloadCodec(KEY, "ABC", clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CachePayloadCodec(KEY, STAMPER.toUpperCase(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
