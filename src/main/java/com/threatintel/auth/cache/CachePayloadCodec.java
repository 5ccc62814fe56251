package com.threatintel.auth.cache;

import com.threatintel.auth.error.CacheIntegrityException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Signs and verifies snapshot cache payloads.
 * <p>
 * Layout (ASCII header, one field per line, then the body):
 * <pre>
 *   signature   128 hex digits, HMAC-SHA512 of everything after the signature line
 *   timestamp   21 chars: 14 integer digits, '.', 6 fractional digits (seconds since the epoch)
 *   stamper id  40 hex digits identifying the writing process
 *   body
 * </pre>
 * The signature is verified before anything else is looked at. Payloads older
 * than {@link #MAX_AGE} are rejected even when correctly signed.
 */
public class CachePayloadCodec {

    public static final Duration MAX_AGE = Duration.ofDays(1);

    static final String HMAC_ALGORITHM = "HmacSHA512";
    static final int SIGNATURE_LENGTH = 128;
    static final int TIMESTAMP_LENGTH = 21;
    static final int STAMPER_ID_LENGTH = 40;
    static final int HEADER_LENGTH = SIGNATURE_LENGTH + 1 + TIMESTAMP_LENGTH + 1 + STAMPER_ID_LENGTH + 1;
    private static final byte SEPARATOR = '\n';

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("[0-9]{14}\\.[0-9]{6}");
    private static final Pattern HEX_PATTERN = Pattern.compile("[0-9a-f]+");
    private static final HexFormat HEX = HexFormat.of();

    /**
     * A verified payload.
     */
    public record Decoded(double timestamp, String stamperId, byte[] body) {}

    private final SecretKeySpec key;
    private final String stamperId;
    private final Clock clock;

    public CachePayloadCodec(String signingKey, Clock clock) {
        this(signingKey, newStamperId(), clock);
    }

    public CachePayloadCodec(String signingKey, String stamperId, Clock clock) {
        if (signingKey == null || signingKey.isEmpty()) {
            throw new IllegalArgumentException("Signing key must not be empty");
        }
        if (stamperId.length() != STAMPER_ID_LENGTH || !HEX_PATTERN.matcher(stamperId).matches()) {
            throw new IllegalArgumentException("Stamper id must be " + STAMPER_ID_LENGTH + " lowercase hex digits");
        }
        this.key = new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.stamperId = stamperId;
        this.clock = clock;
    }

    public String getStamperId() {
        return stamperId;
    }

    public byte[] encode(byte[] body) {
        String header = formatTimestamp(clock.millis() * 1000L) + "\n" + stamperId + "\n";
        byte[] signed = new byte[header.length() + body.length];
        byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(headerBytes, 0, signed, 0, headerBytes.length);
        System.arraycopy(body, 0, signed, headerBytes.length, body.length);

        byte[] signature = HEX.formatHex(sign(signed)).getBytes(StandardCharsets.US_ASCII);
        byte[] payload = new byte[signature.length + 1 + signed.length];
        System.arraycopy(signature, 0, payload, 0, signature.length);
        payload[signature.length] = SEPARATOR;
        System.arraycopy(signed, 0, payload, signature.length + 1, signed.length);
        return payload;
    }

    /**
     * @throws CacheIntegrityException if the payload is truncated, badly signed, malformed or too old
     */
    public Decoded decode(byte[] payload) {
        if (payload.length < HEADER_LENGTH) {
            throw new CacheIntegrityException("Cache payload truncated (" + payload.length + " bytes)");
        }
        if (payload[SIGNATURE_LENGTH] != SEPARATOR) {
            throw new CacheIntegrityException("Cache payload has a malformed signature field");
        }
        byte[] expected = HEX.formatHex(sign(Arrays.copyOfRange(payload, SIGNATURE_LENGTH + 1, payload.length)))
                .getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, Arrays.copyOfRange(payload, 0, SIGNATURE_LENGTH))) {
            throw new CacheIntegrityException("Cache payload signature mismatch");
        }

        int timestampStart = SIGNATURE_LENGTH + 1;
        int stamperStart = timestampStart + TIMESTAMP_LENGTH + 1;
        int bodyStart = stamperStart + STAMPER_ID_LENGTH + 1;
        if (payload[stamperStart - 1] != SEPARATOR || payload[bodyStart - 1] != SEPARATOR) {
            throw new CacheIntegrityException("Cache payload header is malformed");
        }
        String timestampText = new String(payload, timestampStart, TIMESTAMP_LENGTH, StandardCharsets.US_ASCII);
        String stamper = new String(payload, stamperStart, STAMPER_ID_LENGTH, StandardCharsets.US_ASCII);
        if (!TIMESTAMP_PATTERN.matcher(timestampText).matches() || !HEX_PATTERN.matcher(stamper).matches()) {
            throw new CacheIntegrityException("Cache payload header is malformed");
        }

        double timestamp = Double.parseDouble(timestampText);
        double now = clock.millis() / 1000.0;
        if (now - timestamp > MAX_AGE.getSeconds()) {
            throw new CacheIntegrityException(String.format(
                    "Cache payload is too old (written at %s, maximum age %ds)", timestampText, MAX_AGE.getSeconds()));
        }
        return new Decoded(timestamp, stamper, Arrays.copyOfRange(payload, bodyStart, payload.length));
    }

    static String formatTimestamp(long epochMicros) {
        return String.format("%014d.%06d", epochMicros / 1_000_000L, epochMicros % 1_000_000L);
    }

    private byte[] sign(byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 not available", e);
        }
    }

    private static String newStamperId() {
        byte[] random = new byte[STAMPER_ID_LENGTH / 2];
        new SecureRandom().nextBytes(random);
        return HEX.formatHex(random);
    }
}
