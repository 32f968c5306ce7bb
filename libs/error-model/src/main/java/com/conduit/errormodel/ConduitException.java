package com.conduit.errormodel;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A recognized domain error.
 *
 * <p>Handlers throw (or pass to {@code onError}) a ConduitException when the failure should reach
 * the caller with its type, sub-errors and retry hint intact. Any other exception crosses the RPC
 * boundary as an opaque UNKNOWN status carrying only its message.
 */
public class ConduitException extends RuntimeException {

    private final ErrorEnvelope envelope;

    public ConduitException(ErrorEnvelope envelope) {
        super(requireEnvelope(envelope).detail());
        this.envelope = envelope;
    }

    public ConduitException(ErrorEnvelope envelope, Throwable cause) {
        super(requireEnvelope(envelope).detail(), cause);
        this.envelope = envelope;
    }

    private static ErrorEnvelope requireEnvelope(ErrorEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope must not be null");
        }
        return envelope;
    }

    public static ConduitException of(ErrorType type, String format, Object... args) {
        return new ConduitException(ErrorEnvelope.of(type, format.formatted(args)));
    }

    public static ConduitException internal(String format, Object... args) {
        return of(ErrorType.INTERNAL_SERVER, format, args);
    }

    public static ConduitException malformed(String format, Object... args) {
        return of(ErrorType.MALFORMED, format, args);
    }

    public static ConduitException notFound(String format, Object... args) {
        return of(ErrorType.NOT_FOUND, format, args);
    }

    public static ConduitException rateLimit(Duration retryAfter, String format, Object... args) {
        return new ConduitException(
                new ErrorEnvelope(ErrorType.RATE_LIMIT, format.formatted(args), List.of(), retryAfter));
    }

    public static ConduitException rejectedIdentifier(String format, Object... args) {
        return of(ErrorType.REJECTED_IDENTIFIER, format, args);
    }

    public static ConduitException duplicate(String format, Object... args) {
        return of(ErrorType.DUPLICATE, format, args);
    }

    /** Returns a copy of this error carrying the given sub-errors. */
    public ConduitException withSubErrors(List<SubError> subErrors) {
        return new ConduitException(
                new ErrorEnvelope(envelope.type(), envelope.detail(), subErrors, envelope.retryAfter()));
    }

    /** Returns a copy of this error carrying the given retry hint. */
    public ConduitException withRetryAfter(Duration retryAfter) {
        return new ConduitException(
                new ErrorEnvelope(envelope.type(), envelope.detail(), envelope.subErrors(), retryAfter));
    }

    public ErrorEnvelope envelope() {
        return envelope;
    }

    public ErrorType type() {
        return envelope.type();
    }

    public String detail() {
        return envelope.detail();
    }

    public List<SubError> subErrors() {
        return envelope.subErrors();
    }

    public Duration retryAfter() {
        return envelope.retryAfter();
    }

    /** True if {@code t} is a ConduitException of the given type. */
    public static boolean is(Throwable t, ErrorType type) {
        return t instanceof ConduitException ce && ce.type() == type;
    }

    /**
     * Walks the cause chain of {@code t} looking for a ConduitException.
     *
     * @param t any throwable, possibly null
     * @return the first ConduitException in the chain, or empty
     */
    public static Optional<ConduitException> find(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof ConduitException ce) {
                return Optional.of(ce);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ConduitException[" + envelope.type() + "]: " + envelope.detail();
    }
}
