package com.conduit.grpc.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GrpcServerConfig")
class GrpcServerConfigTest {

    @Test
    @DisplayName("accepts the union of server-wide and per-service client names")
    void acceptedClientNames() {
        var config = new GrpcServerConfig(":9090", Set.of("admin.conduit"),
                Map.of("sa.StorageAuthority", new GrpcServiceConfig(Set.of("ra.conduit", "ca.conduit")),
                        "ca.CertificateAuthority", new GrpcServiceConfig(Set.of("ra.conduit"))),
                null);

        assertThat(config.acceptedClientNames())
                .containsExactlyInAnyOrder("admin.conduit", "ra.conduit", "ca.conduit");
    }

    @Test
    @DisplayName("defaults optional fields")
    void defaults() {
        var config = new GrpcServerConfig(":9090", null, null, null);

        assertThat(config.clientNames()).isEmpty();
        assertThat(config.services()).isEmpty();
        assertThat(config.maxConnectionAge()).isZero();
        assertThat(config.acceptedClientNames()).isEmpty();
    }

    @Test
    @DisplayName("requires an address")
    void requiresAddress() {
        assertThatThrownBy(() -> new GrpcServerConfig("", null, null, null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("rejects a negative connection age")
    void rejectsNegativeAge() {
        assertThatThrownBy(() -> new GrpcServerConfig(":1", null, null, Duration.ofSeconds(-1)))
                .isInstanceOf(ConfigurationException.class);
    }
}
