package com.conduit.grpc.interceptor;

import io.grpc.ClientInterceptor;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.grpc.MetricCollectingClientInterceptor;
import io.micrometer.core.instrument.binder.grpc.MetricCollectingServerInterceptor;
import io.opentelemetry.api.OpenTelemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single place that fixes the order of interceptors, outermost first.
 * <p>
 * Server: metrics, authorization, metadata/deadline, tracing. Client: metadata/deadline/in-flight,
 * metrics, tracing. Tracing is present only when an {@link OpenTelemetry} instance is supplied.
 */
public final class InterceptorChains {

    private InterceptorChains() {
        // utility class
    }

    /**
     * @param registry      registry receiving call volume and latency
     * @param authorization authorization step, or {@link NoopServerInterceptor}
     * @param metadata      deadline budgeting and error encoding
     * @param openTelemetry tracing, or null to disable it
     * @return the server interceptors, outermost first
     */
    public static List<ServerInterceptor> server(MeterRegistry registry, ServerInterceptor authorization,
                                                 ServerMetadataInterceptor metadata, OpenTelemetry openTelemetry) {
        List<ServerInterceptor> chain = new ArrayList<>();
        chain.add(new MetricCollectingServerInterceptor(registry));
        chain.add(authorization);
        chain.add(metadata);
        if (openTelemetry != null) {
            chain.add(new TracingServerInterceptor(openTelemetry));
        }
        return Collections.unmodifiableList(chain);
    }

    /**
     * @param metadata      deadline bounding, in-flight tracking and error decoding
     * @param registry      registry receiving call volume and latency
     * @param openTelemetry tracing, or null to disable it
     * @return the client interceptors, outermost first
     */
    public static List<ClientInterceptor> client(ClientMetadataInterceptor metadata, MeterRegistry registry,
                                                 OpenTelemetry openTelemetry) {
        List<ClientInterceptor> chain = new ArrayList<>();
        chain.add(metadata);
        chain.add(new MetricCollectingClientInterceptor(registry));
        if (openTelemetry != null) {
            chain.add(new TracingClientInterceptor(openTelemetry));
        }
        return Collections.unmodifiableList(chain);
    }

    /** Wraps a service so that the first interceptor of {@code chain} sees each call first. */
    public static ServerServiceDefinition intercept(ServerServiceDefinition service, List<ServerInterceptor> chain) {
        return ServerInterceptors.interceptForward(service, chain);
    }
}
