package com.conduit.security;

import javax.net.ssl.SSLException;

/**
 * Thrown when credentials are asked for a handshake they were not built for.
 */
public class UnsupportedHandshakeException extends SSLException {

    public static final String CLIENT_HANDSHAKE_UNSUPPORTED =
            "client handshake is not supported by server credentials";
    public static final String SERVER_HANDSHAKE_UNSUPPORTED =
            "server handshake is not supported by client credentials";
    public static final String OVERRIDE_SERVER_NAME_UNSUPPORTED =
            "overriding the server name is not supported";

    public UnsupportedHandshakeException(String message) {
        super(message);
    }
}
