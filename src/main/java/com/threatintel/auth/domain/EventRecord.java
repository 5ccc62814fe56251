package com.threatintel.auth.domain;

import com.threatintel.auth.util.IpAddresses;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A threat-intelligence event as seen by compiled conditions and the inside-criteria matcher.
 * <p>
 * Scalar attributes are held by name; network attributes come from the
 * {@linkplain Address address} list, so {@code ip}, {@code asn} and {@code cc}
 * are multi-valued. A field is "absent" (null) when it has no value at all.
 */
public final class EventRecord {

    public static final String IP = "ip";
    public static final String ASN = "asn";
    public static final String CC = "cc";

    /**
     * One entry of an event's address list. Any part may be null.
     */
    public record Address(String ip, Long asn, String cc) {}

    private final Map<String, Object> fields;
    private final List<Address> addresses;

    private EventRecord(Map<String, Object> fields, List<Address> addresses) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.addresses = List.copyOf(addresses);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public List<Address> getAddresses() {
        return addresses;
    }

    /**
     * All values of a field; empty when the field is absent.
     * IP addresses are returned as their unsigned 32-bit integer value.
     */
    public List<Object> getValues(String field) {
        switch (field) {
            case IP -> {
                List<Object> values = new ArrayList<>(addresses.size());
                for (Address address : addresses) {
                    if (address.ip() != null) {
                        values.add(IpAddresses.toLong(address.ip()));
                    }
                }
                return values;
            }
            case ASN -> {
                List<Object> values = new ArrayList<>(addresses.size());
                for (Address address : addresses) {
                    if (address.asn() != null) {
                        values.add(address.asn());
                    }
                }
                return values;
            }
            case CC -> {
                List<Object> values = new ArrayList<>(addresses.size());
                for (Address address : addresses) {
                    if (address.cc() != null) {
                        values.add(address.cc());
                    }
                }
                return values;
            }
            default -> {
                Object value = fields.get(field);
                if (value == null) {
                    return List.of();
                }
                if (value instanceof List<?> list) {
                    return Collections.unmodifiableList(new ArrayList<Object>(list));
                }
                return List.of(value);
            }
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof EventRecord that)) return false;
        return fields.equals(that.fields) && addresses.equals(that.addresses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, addresses);
    }

    @Override
    public String toString() {
        return "EventRecord{fields=" + fields + ", addresses=" + addresses + "}";
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final List<Address> addresses = new ArrayList<>();

        private Builder() {}

        public Builder field(String name, Object value) {
            if (value instanceof Integer i) {
                value = i.longValue();
            }
            fields.put(name, value);
            return this;
        }

        public Builder address(String ip, Long asn, String cc) {
            addresses.add(new Address(ip, asn, cc));
            return this;
        }

        public Builder ip(String ip) {
            return address(ip, null, null);
        }

        public EventRecord build() {
            return new EventRecord(fields, addresses);
        }
    }
}
