package com.conduit.security;

import java.security.cert.CertificateException;
import java.util.Set;

/**
 * Thrown when none of the identities in a peer certificate is on the accepted list.
 */
public class UnauthorizedPeerException extends CertificateException {

    private final Set<String> received;
    private final Set<String> expected;

    public UnauthorizedPeerException(Set<String> received, Set<String> expected) {
        super("peer certificate names %s are not in the accepted set %s".formatted(received, expected));
        this.received = Set.copyOf(received);
        this.expected = Set.copyOf(expected);
    }

    /** Identities found in the peer's leaf certificate. */
    public Set<String> received() {
        return received;
    }

    /** Identities that would have been accepted. */
    public Set<String> expected() {
        return expected;
    }
}
