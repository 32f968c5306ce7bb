package com.conduit.security;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * File locations of a process's TLS material, as written in configuration.
 *
 * @param certFile   PEM certificate chain presented to peers
 * @param keyFile    PEM PKCS#8 private key
 * @param caCertFile PEM bundle of CA certificates trusted for peers
 */
public record TlsConfig(String certFile, String keyFile, String caCertFile) {

    /**
     * Checks that every file is configured and readable and parses the trusted roots.
     *
     * @throws TlsConfigurationException if a path is missing, a file is unreadable or the CA
     *                                   bundle holds no certificates
     */
    public TlsMaterial load() {
        Path cert = requireReadable("certFile", certFile);
        Path key = requireReadable("keyFile", keyFile);
        Path ca = requireReadable("caCertFile", caCertFile);
        return new TlsMaterial(new KeyMaterial(cert, key), readCertificates(ca));
    }

    /**
     * Parses every certificate in a PEM bundle.
     *
     * @throws TlsConfigurationException if the file cannot be read or holds no certificates
     */
    public static List<X509Certificate> readCertificates(Path pemFile) {
        try (InputStream in = Files.newInputStream(pemFile)) {
            Collection<? extends Certificate> parsed =
                    CertificateFactory.getInstance("X.509").generateCertificates(in);
            List<X509Certificate> certs = new ArrayList<>(parsed.size());
            for (Certificate c : parsed) {
                certs.add((X509Certificate) c);
            }
            if (certs.isEmpty()) {
                throw new TlsConfigurationException("no certificates found in " + pemFile);
            }
            return certs;
        } catch (IOException | CertificateException e) {
            throw new TlsConfigurationException("failed to read certificates from " + pemFile, e);
        }
    }

    private static Path requireReadable(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new TlsConfigurationException(field + " must be configured");
        }
        Path path = Path.of(value);
        if (!Files.isReadable(path)) {
            throw new TlsConfigurationException(field + " is not readable: " + value);
        }
        return path;
    }

    /**
     * Raised when TLS configuration is incomplete or its files cannot be used.
     */
    public static class TlsConfigurationException extends RuntimeException {

        public TlsConfigurationException(String message) {
            super(message);
        }

        public TlsConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
