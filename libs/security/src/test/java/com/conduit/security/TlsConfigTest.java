package com.conduit.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.conduit.security.TlsConfig.TlsConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TlsConfig")
class TlsConfigTest {

    @Test
    @DisplayName("loads identity paths and trusted roots")
    void loads() {
        TlsMaterial material = Fixtures.clientMaterial();

        assertThat(material.identity().certChainFile()).isEqualTo(Fixtures.path("client.pem"));
        assertThat(material.identity().keyFile()).isEqualTo(Fixtures.path("client.key"));
        assertThat(material.trustedRoots()).hasSize(1);
        assertThat(material.trustedRoots().get(0).getSubjectX500Principal().getName())
                .contains("Conduit Test CA");
    }

    @Test
    @DisplayName("rejects a missing field")
    void rejectsMissingField() {
        var config = new TlsConfig(Fixtures.path("client.pem").toString(), null, Fixtures.path("ca.pem").toString());

        assertThatThrownBy(config::load)
                .isInstanceOf(TlsConfigurationException.class)
                .hasMessageContaining("keyFile");
    }

    @Test
    @DisplayName("rejects an unreadable file")
    void rejectsUnreadableFile(@TempDir Path dir) {
        var config = new TlsConfig(dir.resolve("nope.pem").toString(),
                Fixtures.path("client.key").toString(), Fixtures.path("ca.pem").toString());

        assertThatThrownBy(config::load)
                .isInstanceOf(TlsConfigurationException.class)
                .hasMessageContaining("certFile");
    }

    @Test
    @DisplayName("rejects a CA bundle without certificates")
    void rejectsEmptyBundle(@TempDir Path dir) throws Exception {
        Path empty = Files.writeString(dir.resolve("empty.pem"), "");
        var config = new TlsConfig(Fixtures.path("client.pem").toString(),
                Fixtures.path("client.key").toString(), empty.toString());

        assertThatThrownBy(config::load).isInstanceOf(TlsConfigurationException.class);
    }
}
