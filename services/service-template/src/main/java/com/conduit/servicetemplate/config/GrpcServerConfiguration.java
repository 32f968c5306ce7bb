package com.conduit.servicetemplate.config;

import com.conduit.grpc.server.GrpcServerBuilder;
import com.conduit.servicetemplate.infrastructure.grpc.GrpcServerLifecycle;
import io.grpc.BindableService;
import io.grpc.ServerServiceDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires every {@link BindableService} and {@link ServerServiceDefinition} bean into one gRPC
 * server. Tracing is enabled when the context holds an {@link OpenTelemetry} bean.
 */
@Configuration(proxyBeanMethods = false)
public class GrpcServerConfiguration {

    @Bean
    public GrpcServerLifecycle grpcServerLifecycle(
            GrpcServerProperties server,
            TlsProperties tls,
            MeterRegistry registry,
            ObjectProvider<BindableService> bindableServices,
            ObjectProvider<ServerServiceDefinition> serviceDefinitions,
            ObjectProvider<OpenTelemetry> openTelemetry) {
        GrpcServerBuilder builder = new GrpcServerBuilder(server.toConfig(), tls.toConfig().load(), registry)
                .withTracing(openTelemetry.getIfAvailable());
        bindableServices.orderedStream().forEach(builder::add);
        serviceDefinitions.orderedStream().forEach(builder::add);
        return new GrpcServerLifecycle(builder);
    }
}
