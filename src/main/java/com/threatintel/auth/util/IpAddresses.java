package com.threatintel.auth.util;

/**
 * IPv4 helpers working on unsigned 32-bit values held in a {@code long}.
 */
public final class IpAddresses {

    /** One past the highest IPv4 address. */
    public static final long IPV4_LIMIT = 1L << 32;

    private IpAddresses() {}

    /**
     * Inclusive IPv4 range, with both ends as unsigned 32-bit values.
     */
    public record IpRange(long min, long max) {
        public IpRange {
            if (min < 0 || max >= IPV4_LIMIT || min > max) {
                throw new IllegalArgumentException("Invalid IPv4 range: " + min + ".." + max);
            }
        }

        public boolean contains(long ip) {
            return ip >= min && ip <= max;
        }
    }

    /**
     * Parses a dotted-quad IPv4 address.
     *
     * @throws IllegalArgumentException if the text is not a valid IPv4 address
     */
    public static long toLong(String address) {
        if (address == null) {
            throw new IllegalArgumentException("IPv4 address must not be null");
        }
        String[] parts = address.trim().split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + address);
        }
        long result = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + address);
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + address);
            }
            result = (result << 8) | octet;
        }
        return result;
    }

    public static String toDotted(long ip) {
        return ((ip >> 24) & 0xFF) + "." + ((ip >> 16) & 0xFF) + "." + ((ip >> 8) & 0xFF) + "." + (ip & 0xFF);
    }

    /**
     * Parses CIDR notation ({@code 10.0.0.0/8}; a bare address means {@code /32}).
     * Host bits set below the prefix are rejected.
     *
     * @throws IllegalArgumentException if the network is malformed
     */
    public static IpRange parseNetwork(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("IPv4 network must not be null");
        }
        String text = cidr.trim();
        int slash = text.indexOf('/');
        String addressPart = slash >= 0 ? text.substring(0, slash) : text;
        int prefix = 32;
        if (slash >= 0) {
            String prefixPart = text.substring(slash + 1);
            if (prefixPart.isEmpty() || prefixPart.length() > 2 || !prefixPart.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid IPv4 network: " + cidr);
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > 32) {
                throw new IllegalArgumentException("Invalid IPv4 network prefix: " + cidr);
            }
        }
        long address = toLong(addressPart);
        long hostMask = prefix == 0 ? IPV4_LIMIT - 1 : (1L << (32 - prefix)) - 1;
        if ((address & hostMask) != 0) {
            throw new IllegalArgumentException("IPv4 network has host bits set: " + cidr);
        }
        return new IpRange(address, address | hostMask);
    }
}
