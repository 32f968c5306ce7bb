package com.conduit.grpc.interceptor;

import io.grpc.Metadata;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes trace context headers ({@code traceparent}, {@code tracestate}, ...) in gRPC
 * metadata.
 */
enum MetadataPropagation implements TextMapGetter<Metadata>, TextMapSetter<Metadata> {
    INSTANCE;

    @Override
    public Iterable<String> keys(Metadata carrier) {
        List<String> keys = new ArrayList<>();
        for (String key : carrier.keys()) {
            if (!key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public String get(Metadata carrier, String key) {
        if (carrier == null) {
            return null;
        }
        return carrier.get(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
    }

    @Override
    public void set(Metadata carrier, String key, String value) {
        if (carrier == null) {
            return;
        }
        Metadata.Key<String> k = Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
        carrier.removeAll(k);
        carrier.put(k, value);
    }
}
