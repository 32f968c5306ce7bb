package com.conduit.security;

import io.grpc.netty.GrpcSslContexts;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;

/**
 * Credentials for dialing a server over TLS 1.2, optionally presenting a client certificate.
 * <p>
 * Only the configured roots are trusted. The name checked against the server certificate is the
 * host override when one is set, otherwise the host part of the dialed address; see
 * {@link #authority(String)}.
 */
public final class ClientTransportCredentials implements TransportCredentials {

    static final String TLS_1_2 = "TLSv1.2";

    private final List<X509Certificate> roots;
    private final KeyMaterial identity;
    private final String hostOverride;

    /**
     * @param roots        trusted root certificates (required, non-empty)
     * @param identity     client certificate and key for mutual TLS, or null for none
     * @param hostOverride name to verify instead of the dialed host, or null
     */
    public ClientTransportCredentials(List<X509Certificate> roots, KeyMaterial identity, String hostOverride) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("roots must not be null or empty");
        }
        this.roots = List.copyOf(roots);
        this.identity = identity;
        this.hostOverride = hostOverride == null || hostOverride.isBlank() ? null : hostOverride;
    }

    /** Client credentials presenting the process's own identity and trusting its configured roots. */
    public static ClientTransportCredentials forMaterial(TlsMaterial material, String hostOverride) {
        if (material == null) {
            throw new IllegalArgumentException("material must not be null");
        }
        return new ClientTransportCredentials(material.trustedRoots(), material.identity(), hostOverride);
    }

    @Override
    public SslContext clientContext() throws SSLException {
        SslContextBuilder builder = GrpcSslContexts.forClient()
                .trustManager(roots.toArray(new X509Certificate[0]))
                .protocols(TLS_1_2);
        if (identity != null) {
            builder.keyManager(identity.certChainFile().toFile(), identity.keyFile().toFile());
        }
        return builder.build();
    }

    @Override
    public SslContext serverContext() throws SSLException {
        throw new UnsupportedHandshakeException(UnsupportedHandshakeException.SERVER_HANDSHAKE_UNSUPPORTED);
    }

    /**
     * The name the server certificate must match when dialing {@code address}.
     *
     * @param address dial address in {@code host:port} or {@code [v6]:port} form, or a bare host
     * @return the host override if set, else the host part of the address
     */
    public String authority(String address) {
        if (hostOverride != null) {
            return hostOverride;
        }
        return hostOf(address);
    }

    static String hostOf(String address) {
        if (address.startsWith("[")) {
            int end = address.indexOf(']');
            return end > 0 ? address.substring(1, end) : address;
        }
        int colon = address.lastIndexOf(':');
        if (colon >= 0 && address.indexOf(':') == colon) {
            return address.substring(0, colon);
        }
        return address;
    }

    public List<X509Certificate> roots() {
        return roots;
    }

    public Optional<KeyMaterial> identity() {
        return Optional.ofNullable(identity);
    }

    public Optional<String> hostOverride() {
        return Optional.ofNullable(hostOverride);
    }

    @Override
    public ClientTransportCredentials copy() {
        return new ClientTransportCredentials(roots, identity, hostOverride);
    }
}
