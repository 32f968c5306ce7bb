package com.conduit.security;

/**
 * Security protocol advertised by a set of transport credentials.
 *
 * @param securityProtocol protocol name, e.g. {@code tls}
 * @param securityVersion  protocol version, e.g. {@code 1.2}
 */
public record ProtocolInfo(String securityProtocol, String securityVersion) {

    public static final ProtocolInfo TLS_1_2 = new ProtocolInfo("tls", "1.2");
}
