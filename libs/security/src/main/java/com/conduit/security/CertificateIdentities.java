package com.conduit.security;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the identities a certificate asserts through its subjectAltName extension.
 */
public final class CertificateIdentities {

    private static final int SAN_DNS = 2;
    private static final int SAN_IP = 7;

    private CertificateIdentities() {
        // utility class
    }

    /** DNS names of the certificate, in certificate order. */
    public static Set<String> dnsNames(X509Certificate cert) throws CertificateParsingException {
        return sansOfType(cert, SAN_DNS);
    }

    /** IP addresses of the certificate in textual form, in certificate order. */
    public static Set<String> ipAddresses(X509Certificate cert) throws CertificateParsingException {
        return sansOfType(cert, SAN_IP);
    }

    /** DNS names followed by IP addresses. */
    public static Set<String> identities(X509Certificate cert) throws CertificateParsingException {
        Set<String> all = new LinkedHashSet<>(dnsNames(cert));
        all.addAll(ipAddresses(cert));
        return all;
    }

    private static Set<String> sansOfType(X509Certificate cert, int type) throws CertificateParsingException {
        Set<String> out = new LinkedHashSet<>();
        Collection<List<?>> sans = cert.getSubjectAlternativeNames();
        if (sans == null) {
            return out;
        }
        for (List<?> san : sans) {
            if (san.size() >= 2 && san.get(0) instanceof Integer t && t == type && san.get(1) instanceof String v) {
                out.add(v);
            }
        }
        return out;
    }
}
