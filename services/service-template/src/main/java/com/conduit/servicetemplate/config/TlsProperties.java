package com.conduit.servicetemplate.config;

import com.conduit.security.TlsConfig;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * PEM files of the service's TLS identity, bound from {@code conduit.tls.*}.
 *
 * @param certFile certificate chain presented to peers
 * @param keyFile PKCS#8 private key of the certificate
 * @param caCertFile roots trusted for peer certificates
 */
@ConfigurationProperties(prefix = "conduit.tls")
@Validated
public record TlsProperties(@NotBlank String certFile, @NotBlank String keyFile, @NotBlank String caCertFile) {

    public TlsConfig toConfig() {
        return new TlsConfig(certFile, keyFile, caCertFile);
    }
}
