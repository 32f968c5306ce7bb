package com.conduit.grpc.interceptor;

import io.grpc.Metadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The {@code client-request-time} header: when the client sent the call, as base-10 Unix
 * nanoseconds.
 */
final class RequestTime {

    static final Metadata.Key<String> KEY = Metadata.Key.of("client-request-time", Metadata.ASCII_STRING_MARSHALLER);

    private RequestTime() {
        // utility class
    }

    static String stamp(Clock clock) {
        Instant now = clock.instant();
        return Long.toString(Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000_000L), now.getNano()));
    }

    /**
     * Time elapsed since a stamped value.
     *
     * @throws NumberFormatException if the value is not a base-10 integer
     */
    static Duration since(Clock clock, String stamp) {
        long nanos = Long.parseLong(stamp);
        return Duration.between(Instant.ofEpochSecond(0, nanos), clock.instant());
    }
}
