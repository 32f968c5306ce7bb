package com.conduit.servicetemplate.config;

import com.conduit.grpc.config.GrpcServerConfig;
import com.conduit.grpc.config.GrpcServiceConfig;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * gRPC server settings, bound from {@code conduit.grpc.server.*}.
 *
 * <p>Service names contain dots, so they are written in bracket notation:
 *
 * <pre>
 * conduit:
 *   grpc:
 *     server:
 *       address: ":9090"
 *       max-connection-age: 5m
 *       services:
 *         "[sa.StorageAuthority]":
 *           - ra.conduit
 *         "[grpc.health.v1.Health]":
 *           - health-checker.conduit
 * </pre>
 *
 * @param address listen address, {@code host:port} or {@code :port}. Required.
 * @param clientNames client names accepted by every service at the TLS handshake
 * @param services service name to the client names allowed to call it
 * @param maxConnectionAge connection lifetime before a graceful close, unlimited when unset
 */
@ConfigurationProperties(prefix = "conduit.grpc.server")
@Validated
public record GrpcServerProperties(
        @NotBlank String address,
        Set<String> clientNames,
        Map<String, Set<String>> services,
        Duration maxConnectionAge) {

    public GrpcServerProperties {
        clientNames = clientNames == null ? Set.of() : Set.copyOf(clientNames);
        services = services == null ? Map.of() : Map.copyOf(services);
        maxConnectionAge = maxConnectionAge == null ? Duration.ZERO : maxConnectionAge;
    }

    public GrpcServerConfig toConfig() {
        Map<String, GrpcServiceConfig> byService = new LinkedHashMap<>();
        services.forEach((name, names) -> byService.put(name, new GrpcServiceConfig(names)));
        return new GrpcServerConfig(address, clientNames, byService, maxConnectionAge);
    }
}
