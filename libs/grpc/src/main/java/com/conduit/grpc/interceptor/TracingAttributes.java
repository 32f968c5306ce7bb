package com.conduit.grpc.interceptor;

import com.conduit.observability.SpanHelper;
import io.grpc.Status;
import io.opentelemetry.api.trace.Span;

import java.util.Map;

/** RPC semantic-convention attributes shared by both tracing interceptors. */
final class TracingAttributes {

    private TracingAttributes() {
        // utility class
    }

    static Map<String, String> of(MethodNames names) {
        return Map.of(
                "rpc.system", "grpc",
                "rpc.service", names.service(),
                "rpc.method", names.method());
    }

    static void end(SpanHelper spans, Span span, Status status) {
        span.setAttribute("rpc.grpc.status_code", status.getCode().value());
        spans.end(span, status.isOk(), status.getCode() + (status.getDescription() == null ? "" : ": " + status.getDescription()));
    }
}
