package com.conduit.security;

import io.grpc.netty.GrpcSslContexts;
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.security.GeneralSecurityException;
import java.util.Set;

/**
 * Credentials for accepting TLS 1.2 connections from clients that present a certificate signed by
 * a trusted root and naming an accepted identity.
 * <p>
 * The accepted set is the union of every allow-list the server serves. An empty set accepts any
 * client holding a trusted certificate; per-service checks then happen in the authorization
 * interceptor.
 */
public final class ServerTransportCredentials implements TransportCredentials {

    public static final String NIL_SERVER_CONFIG = "server TLS material must not be nil";

    private final TlsMaterial material;
    private final Set<String> accepted;

    private ServerTransportCredentials(TlsMaterial material, Set<String> accepted) {
        this.material = material;
        this.accepted = accepted == null ? Set.of() : Set.copyOf(accepted);
    }

    /**
     * @param material server identity and the roots trusted for client certificates
     * @param accepted client identities (DNS or IP SANs) admitted at the handshake
     * @throws IllegalArgumentException with {@link #NIL_SERVER_CONFIG} if {@code material} is null
     */
    public static ServerTransportCredentials create(TlsMaterial material, Set<String> accepted) {
        if (material == null) {
            throw new IllegalArgumentException(NIL_SERVER_CONFIG);
        }
        return new ServerTransportCredentials(material, accepted);
    }

    @Override
    public SslContext clientContext() throws SSLException {
        throw new UnsupportedHandshakeException(UnsupportedHandshakeException.CLIENT_HANDSHAKE_UNSUPPORTED);
    }

    @Override
    public SslContext serverContext() throws SSLException {
        KeyMaterial identity = material.identity();
        return GrpcSslContexts.configure(
                        SslContextBuilder.forServer(identity.certChainFile().toFile(), identity.keyFile().toFile()))
                .trustManager(trustManager())
                .clientAuth(ClientAuth.REQUIRE)
                .protocols(ClientTransportCredentials.TLS_1_2)
                .build();
    }

    /** The trust manager installed in the server context. */
    public SanFilteringTrustManager trustManager() throws SSLException {
        try {
            return new SanFilteringTrustManager(TrustManagers.forRoots(material.trustedRoots()), accepted);
        } catch (GeneralSecurityException e) {
            throw new SSLException("failed to build client trust manager", e);
        }
    }

    public Set<String> accepted() {
        return accepted;
    }

    @Override
    public ServerTransportCredentials copy() {
        return new ServerTransportCredentials(material, accepted);
    }
}
