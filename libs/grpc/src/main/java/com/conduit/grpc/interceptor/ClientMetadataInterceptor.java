package com.conduit.grpc.interceptor;

import com.conduit.grpc.codec.ErrorCodec;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Deadline;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.micrometer.core.instrument.LongTaskTimer;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of the metadata pipeline.
 * <p>
 * Every call is bounded by the configured timeout, stamped with {@code client-request-time},
 * made wait-for-ready so it survives backends briefly being down, and counted as in flight until
 * it closes. Failures are decoded with {@link ErrorCodec}: a domain error becomes the cause of the
 * status the stub throws, and a deadline expiry is reported with the service, method and
 * elapsed time.
 */
public class ClientMetadataInterceptor implements ClientInterceptor {

    static final String NO_METRICS = "client metadata interceptor has no in-flight metrics";

    private final Duration timeout;
    private final ClientMetrics metrics;
    private final Clock clock;

    /**
     * @param timeout upper bound for every call
     * @param metrics in-flight meters; calls fail with INTERNAL if null
     * @param clock   source of request stamps and elapsed times
     */
    public ClientMetadataInterceptor(Duration timeout, ClientMetrics metrics, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.metrics = metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
        if (metrics == null) {
            return new FailingClientCall<>(Status.INTERNAL.withDescription(NO_METRICS));
        }
        MethodNames names = MethodNames.split(method.getFullMethodName());
        LongTaskTimer inFlight = metrics.inFlight(names);

        Deadline bound = Deadline.after(timeout.toNanos(), TimeUnit.NANOSECONDS);
        Deadline callerDeadline = callOptions.getDeadline();
        CallOptions options = callOptions
                .withDeadline(callerDeadline == null ? bound : callerDeadline.minimum(bound))
                .withWaitForReady();

        return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, options)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                headers.put(RequestTime.KEY, RequestTime.stamp(clock));
                long begin = clock.millis();
                Runnable finish = finishOnce(inFlight.start());
                try {
                    super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(responseListener) {
                        @Override
                        public void onClose(Status status, Metadata trailers) {
                            finish.run();
                            Status result = status.isOk() ? status : decode(status, trailers, names, begin);
                            super.onClose(result, trailers);
                        }
                    }, headers);
                } catch (RuntimeException e) {
                    finish.run();
                    throw e;
                }
            }
        };
    }

    private Status decode(Status status, Metadata trailers, MethodNames names, long begin) {
        StatusRuntimeException err = status.asRuntimeException(trailers);
        Throwable unwrapped = ErrorCodec.unwrapError(err, trailers);
        if (unwrapped != err) {
            return status.withCause(unwrapped);
        }
        if (status.getCode() == Status.Code.DEADLINE_EXCEEDED) {
            long elapsedMillis = clock.millis() - begin;
            return Status.DEADLINE_EXCEEDED
                    .withDescription("%s.%s timed out after %d ms".formatted(names.service(), names.method(), elapsedMillis))
                    .withCause(status.getCause());
        }
        return status;
    }

    private static Runnable finishOnce(LongTaskTimer.Sample sample) {
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) {
                sample.stop();
            }
        };
    }
}
