package com.conduit.security;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.security.cert.X509Certificate;

final class Fixtures {

    private Fixtures() {
    }

    static Path path(String name) {
        URL url = Fixtures.class.getResource("/certs/" + name);
        if (url == null) {
            throw new IllegalStateException("missing fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static X509Certificate certificate(String name) {
        return TlsConfig.readCertificates(path(name)).get(0);
    }

    static TlsMaterial clientMaterial() {
        return new TlsConfig(path("client.pem").toString(), path("client.key").toString(), path("ca.pem").toString())
                .load();
    }
}
