package com.conduit.security;

import java.security.cert.CertificateException;

/**
 * Thrown when a peer completes certificate verification without presenting any certificate.
 */
public class EmptyPeerCertificatesException extends CertificateException {

    public EmptyPeerCertificatesException() {
        super("peer presented no certificates");
    }
}
