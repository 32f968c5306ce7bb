package com.conduit.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import java.util.Map;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for spans whose lifetime is driven by
 * callbacks rather than by a lexical block, such as an RPC that starts in one listener method and
 * finishes in another.
 * <p>
 * This helper does NOT configure the SDK. Services configure the OpenTelemetry SDK (exporter,
 * sampler, resource attributes) at boot time and hand the resulting instance to the builders.
 */
public final class SpanHelper {

    /** Name of the instrumentation scope used for every span this helper starts. */
    public static final String INSTRUMENTATION_NAME = "com.conduit.grpc";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Starts a span that the caller must finish with {@link #end(Span, Throwable)} or
     * {@link #end(Span, boolean, String)}.
     *
     * @param spanName   name for the span
     * @param kind       span kind (SERVER for inbound calls, CLIENT for outbound)
     * @param parent     context holding the parent span, possibly extracted from a remote peer
     * @param attributes span attributes
     * @return the started span
     */
    public Span start(String spanName, SpanKind kind, Context parent, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(spanName)
                .setSpanKind(kind)
                .setParent(parent);
        attributes.forEach(builder::setAttribute);
        return builder.startSpan();
    }

    /**
     * Records the outcome of the work and ends the span.
     *
     * @param span        span to end
     * @param ok          whether the work succeeded
     * @param description error description, ignored when {@code ok}
     */
    public void end(Span span, boolean ok, String description) {
        if (ok) {
            span.setStatus(StatusCode.OK);
        } else {
            span.setStatus(StatusCode.ERROR, description == null ? "" : description);
        }
        span.end();
    }

    /**
     * Records a failure and ends the span.
     */
    public void end(Span span, Throwable error) {
        span.recordException(error);
        end(span, false, error.getMessage());
    }
}
