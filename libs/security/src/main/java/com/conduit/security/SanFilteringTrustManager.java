package com.conduit.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.HashSet;
import java.util.Set;

/**
 * Server-side trust manager that, after normal chain verification, admits only clients whose
 * leaf certificate names one of the accepted identities.
 * <p>
 * Runs inside the TLS handshake, so a rejected client never gets a connection. An empty accepted
 * set admits every client the delegate trusts.
 */
public class SanFilteringTrustManager extends X509ExtendedTrustManager {

    private static final Logger log = LoggerFactory.getLogger(SanFilteringTrustManager.class);

    private final X509ExtendedTrustManager delegate;
    private final Set<String> accepted;

    public SanFilteringTrustManager(X509ExtendedTrustManager delegate, Set<String> accepted) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
        this.accepted = accepted == null ? Set.of() : Set.copyOf(accepted);
    }

    /**
     * Checks a verified client chain against the accepted identities.
     *
     * @throws EmptyPeerCertificatesException if the chain is empty and a filter is configured
     * @throws UnauthorizedPeerException      if no DNS or IP SAN of the leaf is accepted
     */
    public void validateClient(X509Certificate[] chain) throws CertificateException {
        if (accepted.isEmpty()) {
            return;
        }
        if (chain == null || chain.length == 0) {
            throw new EmptyPeerCertificatesException();
        }
        Set<String> received = CertificateIdentities.identities(chain[0]);
        Set<String> matched = new HashSet<>(received);
        matched.retainAll(accepted);
        if (matched.isEmpty()) {
            log.warn("Rejecting TLS client presenting {}, accepted identities are {}", received, accepted);
            throw new UnauthorizedPeerException(received, accepted);
        }
    }

    /** Identities this trust manager admits; empty means any trusted client. */
    public Set<String> accepted() {
        return accepted;
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        delegate.checkClientTrusted(chain, authType);
        validateClient(chain);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        delegate.checkClientTrusted(chain, authType, socket);
        validateClient(chain);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        delegate.checkClientTrusted(chain, authType, engine);
        validateClient(chain);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        delegate.checkServerTrusted(chain, authType);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
            throws CertificateException {
        delegate.checkServerTrusted(chain, authType, socket);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
            throws CertificateException {
        delegate.checkServerTrusted(chain, authType, engine);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return delegate.getAcceptedIssuers();
    }
}
