package com.conduit.security;

import io.netty.handler.ssl.SslContext;

import javax.net.ssl.SSLException;

/**
 * Transport security for one side of a connection.
 * <p>
 * Exactly two variants exist: {@link ClientTransportCredentials} builds only client contexts and
 * {@link ServerTransportCredentials} builds only server contexts. Asking either one for the other
 * side's context fails with {@link UnsupportedHandshakeException}.
 */
public interface TransportCredentials {

    /**
     * Builds the context used for the client side of the TLS handshake.
     *
     * @throws UnsupportedHandshakeException if these are server credentials
     * @throws SSLException                  if the key material cannot be loaded
     */
    SslContext clientContext() throws SSLException;

    /**
     * Builds the context used for the server side of the TLS handshake.
     *
     * @throws UnsupportedHandshakeException if these are client credentials
     * @throws SSLException                  if the key material cannot be loaded
     */
    SslContext serverContext() throws SSLException;

    /** Always {@code tls} 1.2. */
    default ProtocolInfo protocolInfo() {
        return ProtocolInfo.TLS_1_2;
    }

    /** Always true: these credentials never run over plaintext. */
    default boolean requireTransportSecurity() {
        return true;
    }

    /**
     * Not supported. The name to verify is fixed when the credentials are created.
     *
     * @throws UnsupportedHandshakeException always
     */
    default TransportCredentials overrideServerName(String serverName) throws UnsupportedHandshakeException {
        throw new UnsupportedHandshakeException(UnsupportedHandshakeException.OVERRIDE_SERVER_NAME_UNSUPPORTED);
    }

    /** Returns an independent copy sharing the same certificate data. */
    TransportCredentials copy();
}
