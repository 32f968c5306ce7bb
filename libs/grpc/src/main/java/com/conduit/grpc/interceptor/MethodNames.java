package com.conduit.grpc.interceptor;

/**
 * Service and method parts of a full gRPC method name such as {@code /sa.StorageAuthority/GetOrder}.
 *
 * @param service fully-qualified service name
 * @param method  method name
 */
public record MethodNames(String service, String method) {

    public static final MethodNames UNKNOWN = new MethodNames("unknown", "unknown");

    /**
     * Splits on the first {@code /} after an optional leading one. Names without a separator
     * yield {@link #UNKNOWN}.
     */
    public static MethodNames split(String fullMethodName) {
        if (fullMethodName == null) {
            return UNKNOWN;
        }
        String name = fullMethodName.startsWith("/") ? fullMethodName.substring(1) : fullMethodName;
        int slash = name.indexOf('/');
        if (slash < 0) {
            return UNKNOWN;
        }
        return new MethodNames(name.substring(0, slash), name.substring(slash + 1));
    }
}
