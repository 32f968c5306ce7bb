package com.conduit.grpc.interceptor;

import com.conduit.errormodel.ConduitException;
import com.conduit.grpc.codec.DurationFormat;
import com.conduit.grpc.codec.ErrorCodec;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server side of the metadata pipeline.
 * <p>
 * Records how long the call took to arrive, shortens the inbound deadline by
 * {@link #RETURN_OVERHEAD} so the handler's own sub-calls time out while there is still time to
 * report it, and rejects the call outright when less than {@link #MEANINGFUL_WORK} would be left.
 * Handler failures leave the server encoded by {@link ErrorCodec}.
 */
public class ServerMetadataInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ServerMetadataInterceptor.class);

    public static final Duration RETURN_OVERHEAD = Duration.ofMillis(20);
    public static final Duration MEANINGFUL_WORK = Duration.ofMillis(100);
    public static final Duration MISSING_DEADLINE = Duration.ofSeconds(100);

    private final ServerMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService deadlineScheduler;
    private final Deadline.Ticker ticker;

    /**
     * @param metrics           lag timer
     * @param clock             clock compared against {@code client-request-time}
     * @param deadlineScheduler executor that cancels handler contexts when their deadline passes
     */
    public ServerMetadataInterceptor(ServerMetrics metrics, Clock clock, ScheduledExecutorService deadlineScheduler) {
        this(metrics, clock, deadlineScheduler, Deadline.getSystemTicker());
    }

    ServerMetadataInterceptor(ServerMetrics metrics, Clock clock, ScheduledExecutorService deadlineScheduler,
                              Deadline.Ticker ticker) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (deadlineScheduler == null) {
            throw new IllegalArgumentException("deadlineScheduler must not be null");
        }
        this.metrics = metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.deadlineScheduler = deadlineScheduler;
        this.ticker = ticker;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        String requestTime = headers.get(RequestTime.KEY);
        if (requestTime != null) {
            try {
                Duration lag = RequestTime.since(clock, requestTime);
                // a client clock running ahead still counts as one observation
                metrics.lag().record(lag.isNegative() ? Duration.ZERO : lag);
            } catch (NumberFormatException | ArithmeticException e) {
                log.warn("Rejecting {}: illegal {} value {}",
                        call.getMethodDescriptor().getFullMethodName(), RequestTime.KEY.name(), requestTime);
                return reject(call, Status.INTERNAL.withDescription(
                        "grpc metadata had illegal %s value: \"%s\"".formatted(RequestTime.KEY.name(), requestTime)));
            }
        }

        Deadline inbound = Context.current().getDeadline();
        if (inbound == null) {
            inbound = Deadline.after(MISSING_DEADLINE.toNanos(), TimeUnit.NANOSECONDS, ticker);
        }
        Deadline local = inbound.offset(-RETURN_OVERHEAD.toNanos(), TimeUnit.NANOSECONDS);
        long remainingNanos = local.timeRemaining(TimeUnit.NANOSECONDS);
        if (remainingNanos < MEANINGFUL_WORK.toNanos()) {
            return reject(call, Status.DEADLINE_EXCEEDED.withDescription(
                    "not enough time left on clock: %s".formatted(DurationFormat.format(Duration.ofNanos(remainingNanos)))));
        }

        Context.CancellableContext handlerContext = Context.current().withDeadline(local, deadlineScheduler);
        EncodingServerCall<ReqT, RespT> encodingCall = new EncodingServerCall<>(call);
        ServerCall.Listener<ReqT> listener;
        try {
            listener = Contexts.interceptCall(handlerContext, encodingCall, headers, next);
        } catch (RuntimeException e) {
            handlerContext.cancel(e);
            encodingCall.fail(e);
            return new ServerCall.Listener<>() {};
        }
        return new HandlerListener<>(listener, handlerContext, encodingCall);
    }

    private static <ReqT, RespT> ServerCall.Listener<ReqT> reject(ServerCall<ReqT, RespT> call, Status status) {
        call.close(status, new Metadata());
        return new ServerCall.Listener<>() {};
    }

    /**
     * Status to send for a failed call. Domain errors and opaque exceptions go through the codec;
     * statuses raised on purpose by the handler keep their code.
     */
    static Status encode(Status status, Metadata trailers) {
        Throwable cause = status.getCause();
        Optional<ConduitException> domain = ConduitException.find(cause);
        if (domain.isPresent()) {
            return ErrorCodec.wrapError(domain.get(), trailers);
        }
        if (status.getCode() == Status.Code.UNKNOWN && cause != null
                && !(cause instanceof StatusRuntimeException) && !(cause instanceof StatusException)) {
            return ErrorCodec.wrapError(cause, trailers);
        }
        return status;
    }

    private static final class EncodingServerCall<ReqT, RespT>
            extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {

        private final AtomicBoolean closed = new AtomicBoolean();

        EncodingServerCall(ServerCall<ReqT, RespT> delegate) {
            super(delegate);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            closed.set(true);
            if (status.isOk()) {
                super.close(status, trailers);
                return;
            }
            Status encoded = encode(status, trailers);
            if (log.isDebugEnabled()) {
                log.debug("{} failed: {} encoded as {}",
                        getMethodDescriptor().getFullMethodName(), status, encoded.getCode());
            }
            super.close(encoded, trailers);
        }

        void fail(RuntimeException e) {
            if (!closed.get()) {
                Metadata trailers = Status.trailersFromThrowable(e);
                close(Status.fromThrowable(e), trailers == null ? new Metadata() : trailers);
            } else {
                log.debug("{} threw after closing", getMethodDescriptor().getFullMethodName(), e);
            }
        }
    }

    private static final class HandlerListener<ReqT>
            extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

        private final Context.CancellableContext context;
        private final EncodingServerCall<ReqT, ?> call;

        HandlerListener(ServerCall.Listener<ReqT> delegate, Context.CancellableContext context,
                        EncodingServerCall<ReqT, ?> call) {
            super(delegate);
            this.context = context;
            this.call = call;
        }

        @Override
        public void onMessage(ReqT message) {
            try {
                super.onMessage(message);
            } catch (RuntimeException e) {
                call.fail(e);
            }
        }

        @Override
        public void onHalfClose() {
            try {
                super.onHalfClose();
            } catch (RuntimeException e) {
                call.fail(e);
            }
        }

        @Override
        public void onReady() {
            try {
                super.onReady();
            } catch (RuntimeException e) {
                call.fail(e);
            }
        }

        @Override
        public void onCancel() {
            try {
                super.onCancel();
            } finally {
                context.cancel(null);
            }
        }

        @Override
        public void onComplete() {
            try {
                super.onComplete();
            } finally {
                context.cancel(null);
            }
        }
    }
}
