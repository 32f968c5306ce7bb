package com.conduit.errormodel;

import java.util.Optional;

/**
 * Closed set of domain error kinds that can cross an RPC boundary.
 *
 * <p>Each constant carries a stable integer code. The code is what travels on the wire (the
 * {@code errortype} trailer), so existing codes must never be renumbered. Codes 1 and 9 are
 * retired and stay unassigned.
 */
public enum ErrorType {

    INTERNAL_SERVER(0),
    MALFORMED(2),
    UNAUTHORIZED(3),
    NOT_FOUND(4),
    RATE_LIMIT(5),
    REJECTED_IDENTIFIER(6),
    INVALID_EMAIL(7),
    CONNECTION_FAILURE(8),
    CAA(10),
    MISSING_SCTS(11),
    DUPLICATE(12),
    ORDER_NOT_READY(13),
    DNS(14),
    BAD_PUBLIC_KEY(15),
    BAD_CSR(16),
    ALREADY_REVOKED(17),
    BAD_REVOCATION_REASON(18);

    private final int code;

    ErrorType(int code) {
        this.code = code;
    }

    /** The wire code for this error type. */
    public int code() {
        return code;
    }

    /**
     * Looks up an ErrorType by its wire code.
     *
     * @param code the integer code received from a peer
     * @return the matching ErrorType, or empty if the code is unknown
     */
    public static Optional<ErrorType> fromCode(int code) {
        for (ErrorType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
