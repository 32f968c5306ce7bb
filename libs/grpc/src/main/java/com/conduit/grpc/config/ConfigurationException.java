package com.conduit.grpc.config;

/**
 * Raised at setup time when server or client configuration cannot be turned into a working
 * server or channel. Never raised per call.
 */
public class ConfigurationException extends RuntimeException {

    public static final String NIL_SERVER_CONFIG = "nil gRPC server config provided";
    public static final String NIL_CLIENT_CONFIG = "nil gRPC client config provided";
    public static final String NIL_TLS_CONFIG = "nil TLS config provided";
    public static final String BOTH_ADDRESS_FORMS =
            "more than one of serverAddress, serverIPAddresses, srvLookup and srvLookups is set, exactly one is required";
    public static final String NO_ADDRESS_FORM =
            "none of serverAddress, serverIPAddresses, srvLookup and srvLookups is set, exactly one is required";

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
