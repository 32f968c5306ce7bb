package com.conduit.grpc.interceptor;

import com.conduit.observability.MetricFactory;
import io.micrometer.core.instrument.LongTaskTimer;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Meters maintained by the client side of the pipeline.
 */
public final class ClientMetrics {

    public static final String IN_FLIGHT = "grpc.client.inflight";

    private final MetricFactory metrics;

    public ClientMetrics(MeterRegistry registry) {
        this.metrics = new MetricFactory(registry);
    }

    /** Calls started and not yet finished, per service and method. */
    public LongTaskTimer inFlight(MethodNames names) {
        return metrics.longTaskTimer(IN_FLIGHT, "RPCs started and not yet finished",
                "service", names.service(), "method", names.method());
    }
}
