package com.conduit.grpc.config;

import java.util.Set;

/**
 * Per-service settings of a gRPC server.
 *
 * @param clientNames DNS names of the clients allowed to call the service
 */
public record GrpcServiceConfig(Set<String> clientNames) {

    public GrpcServiceConfig {
        clientNames = clientNames == null ? Set.of() : Set.copyOf(clientNames);
    }
}
