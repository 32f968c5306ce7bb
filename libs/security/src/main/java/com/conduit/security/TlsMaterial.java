package com.conduit.security;

import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Loaded TLS material for one process: its own identity and the roots it trusts for peers.
 *
 * @param identity     certificate chain and key presented to peers
 * @param trustedRoots CA certificates used to verify peers (never empty)
 */
public record TlsMaterial(KeyMaterial identity, List<X509Certificate> trustedRoots) {

    public TlsMaterial {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (trustedRoots == null || trustedRoots.isEmpty()) {
            throw new IllegalArgumentException("trustedRoots must not be null or empty");
        }
        trustedRoots = List.copyOf(trustedRoots);
    }
}
