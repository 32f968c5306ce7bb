package com.conduit.grpc.testing;

import com.conduit.security.TlsConfig;
import com.conduit.security.TlsMaterial;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * PEM fixtures under {@code certs/}: a CA, a server certificate for {@code localhost},
 * {@code server.conduit} and {@code 127.0.0.1}, and two client certificates,
 * {@code client.conduit} and {@code intruder.conduit}, all issued by that CA.
 */
public final class TestTls {

    private TestTls() {
    }

    public static TlsMaterial server() {
        return material("server");
    }

    public static TlsMaterial client() {
        return material("client");
    }

    public static TlsMaterial intruder() {
        return material("intruder");
    }

    public static Path path(String file) {
        URL url = TestTls.class.getResource("/certs/" + file);
        if (url == null) {
            throw new IllegalStateException("missing fixture " + file);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static TlsMaterial material(String name) {
        return new TlsConfig(path(name + ".pem").toString(), path(name + ".key").toString(), path("ca.pem").toString())
                .load();
    }
}
