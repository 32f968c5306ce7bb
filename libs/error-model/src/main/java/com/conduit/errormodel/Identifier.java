package com.conduit.errormodel;

/**
 * The subject a sub-error refers to, e.g. {@code dns:example.com} or {@code ip:10.0.0.1}.
 *
 * @param type  identifier kind ("dns", "ip")
 * @param value identifier value
 */
public record Identifier(String type, String value) {

    public Identifier {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    /** Shorthand for a DNS identifier. */
    public static Identifier dns(String name) {
        return new Identifier("dns", name);
    }

    /** Shorthand for an IP address identifier. */
    public static Identifier ip(String address) {
        return new Identifier("ip", address);
    }
}
