package com.conduit.grpc.server;

import com.conduit.grpc.config.ConfigurationException;
import com.conduit.grpc.config.GrpcServerConfig;
import com.conduit.grpc.config.GrpcServiceConfig;
import com.conduit.grpc.interceptor.AuthorizationInterceptor;
import com.conduit.grpc.interceptor.InterceptorChains;
import com.conduit.grpc.interceptor.NoopServerInterceptor;
import com.conduit.grpc.interceptor.ServerMetadataInterceptor;
import com.conduit.grpc.interceptor.ServerMetrics;
import com.conduit.security.ServerTransportCredentials;
import com.conduit.security.ServiceAuthPolicy;
import com.conduit.security.TlsMaterial;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerInterceptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.ssl.SslContext;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Composes a mutual-TLS gRPC server from configuration and service implementations.
 * <p>
 * Every service, the health service included, is wrapped in the same interceptor chain. Each
 * service named in the configuration must be registered, and each registered service may only be
 * added once; both problems are reported by {@link #build()}.
 *
 * <pre>{@code
 * GrpcServer server = new GrpcServerBuilder(config, tls, registry)
 *         .add(new StorageAuthorityImpl())
 *         .build();
 * server.start();
 * }</pre>
 */
public class GrpcServerBuilder {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerBuilder.class);

    private final GrpcServerConfig config;
    private final TlsMaterial tls;
    private final MeterRegistry registry;
    private final Map<String, ServerServiceDefinition> services = new LinkedHashMap<>();
    private final List<String> duplicates = new ArrayList<>();
    private Clock clock = Clock.systemUTC();
    private OpenTelemetry openTelemetry;

    /**
     * @param config   listen address, allow-lists and connection limits
     * @param tls      server identity and roots trusted for client certificates
     * @param registry registry receiving the server's metrics
     */
    public GrpcServerBuilder(GrpcServerConfig config, TlsMaterial tls, MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.config = config;
        this.tls = tls;
        this.registry = registry;
    }

    /** Clock used to measure request lag. */
    public GrpcServerBuilder withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /** Enables tracing of every call. */
    public GrpcServerBuilder withTracing(OpenTelemetry openTelemetry) {
        this.openTelemetry = openTelemetry;
        return this;
    }

    public GrpcServerBuilder add(BindableService service) {
        return add(service.bindService());
    }

    public GrpcServerBuilder add(ServerServiceDefinition service) {
        String name = service.getServiceDescriptor().getName();
        if (services.putIfAbsent(name, service) != null) {
            duplicates.add(name);
        }
        return this;
    }

    /**
     * Validates the composition, binds the listen address and returns the server, already
     * accepting connections.
     *
     * @throws ConfigurationException if configuration is missing or does not match the registered
     *                                services
     * @throws IOException            if the TLS material cannot be loaded or the address cannot be
     *                                bound
     */
    public GrpcServer build() throws IOException {
        if (config == null) {
            throw new ConfigurationException(ConfigurationException.NIL_SERVER_CONFIG);
        }
        if (tls == null) {
            throw new ConfigurationException(ConfigurationException.NIL_TLS_CONFIG);
        }
        if (!duplicates.isEmpty()) {
            throw new ConfigurationException("gRPC services registered more than once: " + duplicates);
        }

        HealthStatusManager health = new HealthStatusManager();
        Map<String, ServerServiceDefinition> all = new LinkedHashMap<>(services);
        ServerServiceDefinition healthService = health.getHealthService().bindService();
        all.putIfAbsent(healthService.getServiceDescriptor().getName(), healthService);

        Set<String> unregistered = new TreeSet<>(config.services().keySet());
        unregistered.removeAll(all.keySet());
        if (!unregistered.isEmpty()) {
            throw new ConfigurationException(
                    "gRPC services configured but not registered: " + String.join(", ", unregistered));
        }

        InetSocketAddress listenAddress = ListenAddress.parse(config.address());
        SslContext sslContext = ServerTransportCredentials.create(tls, config.acceptedClientNames()).serverContext();
        ServerInterceptor authorization = config.services().isEmpty()
                ? new NoopServerInterceptor()
                : new AuthorizationInterceptor(policyOf(config));

        ScheduledExecutorService deadlineScheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("grpc-deadlines-%d").build());
        List<ServerInterceptor> chain = InterceptorChains.server(registry, authorization,
                new ServerMetadataInterceptor(new ServerMetrics(registry), clock, deadlineScheduler), openTelemetry);

        NettyServerBuilder builder = NettyServerBuilder.forAddress(listenAddress)
                .sslContext(sslContext);
        if (!config.maxConnectionAge().isZero()) {
            builder.maxConnectionAge(config.maxConnectionAge().toMillis(), TimeUnit.MILLISECONDS);
        }
        all.values().forEach(service -> builder.addService(InterceptorChains.intercept(service, chain)));

        Server server = builder.build();
        try {
            server.start();
        } catch (IOException | RuntimeException e) {
            deadlineScheduler.shutdownNow();
            throw e;
        }
        for (String name : all.keySet()) {
            health.setStatus(name, ServingStatus.SERVING);
        }
        log.info("gRPC server listening on port {} serving {}", server.getPort(), all.keySet());
        return new GrpcServer(server, health, deadlineScheduler);
    }

    private static ServiceAuthPolicy policyOf(GrpcServerConfig config) {
        Map<String, Set<String>> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, GrpcServiceConfig> e : config.services().entrySet()) {
            accepted.put(e.getKey(), e.getValue().clientNames());
        }
        return ServiceAuthPolicy.of(accepted);
    }
}
