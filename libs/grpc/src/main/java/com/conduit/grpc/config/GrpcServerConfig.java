package com.conduit.grpc.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Settings of a gRPC server.
 *
 * @param address          listen address: {@code host:port}, {@code [v6]:port} or {@code :port}
 * @param clientNames      client names accepted by every service at the TLS handshake
 * @param services         fully-qualified service name to its settings
 * @param maxConnectionAge connections older than this are gracefully closed; zero disables
 */
public record GrpcServerConfig(
        String address,
        Set<String> clientNames,
        Map<String, GrpcServiceConfig> services,
        Duration maxConnectionAge) {

    public GrpcServerConfig {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("gRPC server address must be configured");
        }
        clientNames = clientNames == null ? Set.of() : Set.copyOf(clientNames);
        services = services == null ? Map.of() : Map.copyOf(services);
        maxConnectionAge = maxConnectionAge == null ? Duration.ZERO : maxConnectionAge;
        if (maxConnectionAge.isNegative()) {
            throw new ConfigurationException("maxConnectionAge must not be negative");
        }
    }

    /** Server-wide client names plus the client names of every service. */
    public Set<String> acceptedClientNames() {
        Set<String> all = new LinkedHashSet<>(clientNames);
        services.values().forEach(s -> all.addAll(s.clientNames()));
        return all;
    }
}
