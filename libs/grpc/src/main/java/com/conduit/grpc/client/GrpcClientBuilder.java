package com.conduit.grpc.client;

import com.conduit.grpc.config.ConfigurationException;
import com.conduit.grpc.config.GrpcClientConfig;
import com.conduit.grpc.interceptor.ClientMetadataInterceptor;
import com.conduit.grpc.interceptor.ClientMetrics;
import com.conduit.grpc.interceptor.InterceptorChains;
import com.conduit.security.ClientTransportCredentials;
import com.conduit.security.TlsMaterial;
import com.google.common.collect.Lists;
import io.grpc.ClientInterceptor;
import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.time.Clock;
import java.util.List;

/**
 * Builds a mutual-TLS channel to a DNS-resolved server, to the backends behind SRV records or to
 * a static list of endpoints.
 * <p>
 * Calls are balanced round-robin across resolved addresses and pass through the client
 * interceptor chain. The channel connects lazily; {@link #build()} never blocks on the network.
 */
public class GrpcClientBuilder {

    private static final Logger log = LoggerFactory.getLogger(GrpcClientBuilder.class);

    static final String LOAD_BALANCING_POLICY = "round_robin";

    private final GrpcClientConfig config;
    private final TlsMaterial tls;
    private final MeterRegistry registry;
    private Clock clock = Clock.systemUTC();
    private OpenTelemetry openTelemetry;

    /**
     * @param config   server address, timeout and host override
     * @param tls      client identity and the roots trusted for the server certificate
     * @param registry registry receiving the client's metrics
     */
    public GrpcClientBuilder(GrpcClientConfig config, TlsMaterial tls, MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.config = config;
        this.tls = tls;
        this.registry = registry;
    }

    /** Clock used for request stamps and timeout reports. */
    public GrpcClientBuilder withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /** Enables tracing of every call. */
    public GrpcClientBuilder withTracing(OpenTelemetry openTelemetry) {
        this.openTelemetry = openTelemetry;
        return this;
    }

    /**
     * @throws ConfigurationException if the configuration is missing or names no single address
     *                                form
     * @throws SSLException           if the TLS material cannot be loaded
     */
    public ManagedChannel build() throws SSLException {
        if (config == null) {
            throw new ConfigurationException(ConfigurationException.NIL_CLIENT_CONFIG);
        }
        if (tls == null) {
            throw new ConfigurationException(ConfigurationException.NIL_TLS_CONFIG);
        }
        GrpcClientConfig.Target target = config.targetAndHostOverride();
        ClientTransportCredentials credentials = ClientTransportCredentials.forMaterial(tls, target.hostOverride());

        List<ClientInterceptor> chain = InterceptorChains.client(
                new ClientMetadataInterceptor(config.timeout(), new ClientMetrics(registry), clock),
                registry, openTelemetry);

        NettyChannelBuilder builder = NettyChannelBuilder.forTarget(target.uri())
                .sslContext(credentials.clientContext())
                .defaultLoadBalancingPolicy(LOAD_BALANCING_POLICY)
                // intercept() runs the last interceptor first
                .intercept(Lists.reverse(chain));
        credentials.hostOverride().ifPresent(builder::overrideAuthority);

        log.debug("Building gRPC channel to {} verifying {}", target.uri(),
                credentials.hostOverride().orElse("each endpoint's address"));
        return builder.build();
    }
}
