package com.conduit.errormodel;

import java.time.Duration;
import java.util.List;

/**
 * Wire-independent description of a domain error.
 *
 * <p>This is what the error codec reconstructs on the calling side: a typed code, a human-readable
 * detail, optional per-identifier sub-errors and an optional retry hint. Equality is structural,
 * so an envelope received from a peer compares equal to the one the peer sent.
 *
 * @param type       the error kind
 * @param detail     human-readable description
 * @param subErrors  ordered per-identifier failures (never null, possibly empty)
 * @param retryAfter how long the caller should wait before retrying ({@link Duration#ZERO} if no hint)
 */
public record ErrorEnvelope(
        ErrorType type,
        String detail,
        List<SubError> subErrors,
        Duration retryAfter) {

    public ErrorEnvelope {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        detail = detail == null ? "" : detail;
        subErrors = subErrors == null ? List.of() : List.copyOf(subErrors);
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    /** Creates an envelope with no sub-errors and no retry hint. */
    public static ErrorEnvelope of(ErrorType type, String detail) {
        return new ErrorEnvelope(type, detail, List.of(), Duration.ZERO);
    }

    public boolean hasSubErrors() {
        return !subErrors.isEmpty();
    }

    public boolean hasRetryAfter() {
        return !retryAfter.isZero();
    }
}
