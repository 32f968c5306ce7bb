package com.conduit.grpc.interceptor;

import com.conduit.observability.SpanHelper;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;

/**
 * Opens a CLIENT span when a call starts and sends its context to the server in the request headers.
 * A call that is never started opens no span.
 */
public class TracingClientInterceptor implements ClientInterceptor {

    private final SpanHelper spans;
    private final TextMapPropagator propagator;

    public TracingClientInterceptor(OpenTelemetry openTelemetry) {
        this.spans = new SpanHelper(openTelemetry.getTracer(SpanHelper.INSTRUMENTATION_NAME));
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
        MethodNames names = MethodNames.split(method.getFullMethodName());
        Context parent = Context.current();

        return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                Span span = spans.start(names.service() + "/" + names.method(), SpanKind.CLIENT, parent,
                        TracingAttributes.of(names));
                propagator.inject(parent.with(span), headers, MetadataPropagation.INSTANCE);
                try {
                    super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(responseListener) {
                        @Override
                        public void onClose(Status status, Metadata trailers) {
                            TracingAttributes.end(spans, span, status);
                            super.onClose(status, trailers);
                        }
                    }, headers);
                } catch (RuntimeException e) {
                    spans.end(span, e);
                    throw e;
                }
            }
        };
    }
}
