package com.conduit.grpc.interceptor;

import com.conduit.observability.SpanHelper;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opens a SERVER span per call, parented on the trace context the client sent, and makes it
 * current while the handler runs.
 */
public class TracingServerInterceptor implements ServerInterceptor {

    private final SpanHelper spans;
    private final TextMapPropagator propagator;

    public TracingServerInterceptor(OpenTelemetry openTelemetry) {
        this.spans = new SpanHelper(openTelemetry.getTracer(SpanHelper.INSTRUMENTATION_NAME));
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        MethodNames names = MethodNames.split(call.getMethodDescriptor().getFullMethodName());
        Context parent = propagator.extract(Context.root(), headers, MetadataPropagation.INSTANCE);
        Span span = spans.start(names.service() + "/" + names.method(), SpanKind.SERVER, parent,
                TracingAttributes.of(names));
        Context traced = parent.with(span);
        AtomicBoolean ended = new AtomicBoolean();

        ServerCall<ReqT, RespT> tracedCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                if (ended.compareAndSet(false, true)) {
                    TracingAttributes.end(spans, span, status);
                }
                super.close(status, trailers);
            }
        };

        ServerCall.Listener<ReqT> listener;
        try (Scope ignored = traced.makeCurrent()) {
            listener = next.startCall(tracedCall, headers);
        }
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onMessage(ReqT message) {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onMessage(message);
                }
            }

            @Override
            public void onHalfClose() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onHalfClose();
                }
            }

            @Override
            public void onReady() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onReady();
                }
            }

            @Override
            public void onCancel() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onCancel();
                } finally {
                    if (ended.compareAndSet(false, true)) {
                        TracingAttributes.end(spans, span, Status.CANCELLED);
                    }
                }
            }

            @Override
            public void onComplete() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onComplete();
                }
            }
        };
    }
}
