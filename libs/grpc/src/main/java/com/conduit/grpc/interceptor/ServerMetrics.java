package com.conduit.grpc.interceptor;

import com.conduit.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Meters maintained by the server side of the pipeline.
 */
public final class ServerMetrics {

    public static final String LAG = "grpc.server.lag";

    private final Timer lag;

    public ServerMetrics(MeterRegistry registry) {
        this.lag = new MetricFactory(registry)
                .timer(LAG, "Delay between a client sending an RPC and the server starting to handle it");
    }

    public Timer lag() {
        return lag;
    }
}
