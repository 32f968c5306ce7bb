package com.conduit.grpc.codec;

import com.conduit.errormodel.ConduitException;
import com.conduit.errormodel.ErrorEnvelope;
import com.conduit.errormodel.ErrorType;
import com.conduit.errormodel.SubError;
import com.conduit.errormodel.SubErrorSerializer;
import com.conduit.errormodel.SubErrorSerializer.SubErrorSerializationException;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Carries {@link ConduitException}s across the RPC boundary.
 * <p>
 * The server side puts the error type, sub-errors and retry hint into trailing metadata and
 * returns an UNKNOWN status whose description is the error detail. The client side rebuilds an
 * equal ConduitException from the status and those trailers. Errors that are not
 * ConduitExceptions travel as plain UNKNOWN statuses.
 */
public final class ErrorCodec {

    public static final Metadata.Key<String> ERROR_TYPE_KEY =
            Metadata.Key.of("errortype", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> SUB_ERRORS_KEY =
            Metadata.Key.of("suberrors", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> RETRY_AFTER_KEY =
            Metadata.Key.of("retryafter", Metadata.ASCII_STRING_MARSHALLER);

    private ErrorCodec() {
        // utility class
    }

    /**
     * Encodes a handler failure for transmission.
     *
     * @param err      the failure, possibly null
     * @param trailers trailers of the call, receiving the error fields of a ConduitException
     * @return the status to close the call with, or null if {@code err} is null
     */
    public static Status wrapError(Throwable err, Metadata trailers) {
        if (err == null) {
            return null;
        }
        if (!(err instanceof ConduitException ce)) {
            return Status.UNKNOWN.withDescription(err.getMessage());
        }
        String subErrors = null;
        if (ce.envelope().hasSubErrors()) {
            try {
                subErrors = SubErrorSerializer.serialize(ce.subErrors());
            } catch (SubErrorSerializationException e) {
                return Status.INTERNAL
                        .withDescription("failed to marshal sub-errors of %s: %s".formatted(ce.type(), e.getMessage()))
                        .withCause(e);
            }
        }
        trailers.put(ERROR_TYPE_KEY, Integer.toString(ce.type().code()));
        if (subErrors != null) {
            trailers.put(SUB_ERRORS_KEY, subErrors);
        }
        if (ce.envelope().hasRetryAfter()) {
            trailers.put(RETRY_AFTER_KEY, DurationFormat.format(ce.retryAfter()));
        }
        return Status.UNKNOWN.withDescription(ce.detail());
    }

    /**
     * Decodes a call failure received from a peer.
     *
     * @param err      the failure, possibly null
     * @param trailers trailers received with the failure, possibly null
     * @return null if {@code err} is null; {@code err} itself if the trailers carry no error type;
     *         otherwise a ConduitException, which is of type INTERNAL_SERVER if the trailers are
     *         malformed
     */
    public static Throwable unwrapError(Throwable err, Metadata trailers) {
        if (err == null) {
            return null;
        }
        if (trailers == null || !trailers.containsKey(ERROR_TYPE_KEY)) {
            return err;
        }
        List<String> types = values(trailers, ERROR_TYPE_KEY);
        if (types.size() != 1) {
            return ConduitException.internal(
                    "multiple errortype metadata, wrapped error %s", describe(err));
        }
        int code;
        try {
            code = Integer.parseInt(types.get(0));
        } catch (NumberFormatException e) {
            return ConduitException.internal(
                    "failed to convert errortype metadata %s to int, wrapped error %s", types.get(0), describe(err));
        }
        Optional<ErrorType> type = ErrorType.fromCode(code);
        if (type.isEmpty()) {
            return ConduitException.internal(
                    "unknown errortype %d, wrapped error %s", code, describe(err));
        }

        List<SubError> subErrors = List.of();
        if (trailers.containsKey(SUB_ERRORS_KEY)) {
            List<String> raw = values(trailers, SUB_ERRORS_KEY);
            if (raw.size() != 1) {
                return ConduitException.internal(
                        "multiple suberrors metadata, wrapped error %s", describe(err));
            }
            try {
                subErrors = SubErrorSerializer.deserialize(raw.get(0));
            } catch (SubErrorSerializationException e) {
                return ConduitException.internal(
                        "failed to unmarshal suberrors %s, wrapped error %s", e.getMessage(), describe(err));
            }
        }

        Duration retryAfter = Duration.ZERO;
        if (trailers.containsKey(RETRY_AFTER_KEY)) {
            List<String> raw = values(trailers, RETRY_AFTER_KEY);
            if (raw.size() != 1) {
                return ConduitException.internal(
                        "multiple retryafter metadata, wrapped error %s", describe(err));
            }
            try {
                retryAfter = DurationFormat.parse(raw.get(0));
            } catch (IllegalArgumentException e) {
                return ConduitException.internal(
                        "failed to parse retryafter %s, wrapped error %s", raw.get(0), describe(err));
            }
        }

        String detail = Optional.ofNullable(Status.fromThrowable(err).getDescription()).orElse("");
        return new ConduitException(new ErrorEnvelope(type.get(), detail, subErrors, retryAfter), err);
    }

    /**
     * Finds the domain error in a failure returned by a stub, decoding the status trailers if
     * the interceptor pipeline has not already done so.
     */
    public static Optional<ConduitException> domainError(Throwable err) {
        Optional<ConduitException> direct = ConduitException.find(err);
        if (direct.isPresent()) {
            return direct;
        }
        Metadata trailers = Status.trailersFromThrowable(err);
        Throwable decoded = unwrapError(err, trailers);
        return decoded instanceof ConduitException ce ? Optional.of(ce) : Optional.empty();
    }

    private static List<String> values(Metadata trailers, Metadata.Key<String> key) {
        List<String> out = new ArrayList<>();
        Iterable<String> all = trailers.getAll(key);
        if (all != null) {
            all.forEach(out::add);
        }
        return out;
    }

    private static String describe(Throwable err) {
        if (err instanceof StatusRuntimeException || err instanceof StatusException) {
            Status status = Status.fromThrowable(err);
            return status.getCode() + ": " + status.getDescription();
        }
        return String.valueOf(err.getMessage());
    }
}
