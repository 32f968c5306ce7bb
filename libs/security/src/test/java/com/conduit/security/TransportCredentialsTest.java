package com.conduit.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.netty.handler.ssl.SslContext;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TransportCredentials")
class TransportCredentialsTest {

    private final TlsMaterial material = Fixtures.clientMaterial();

    @Nested
    @DisplayName("ClientTransportCredentials")
    class Client {

        private final ClientTransportCredentials creds = ClientTransportCredentials.forMaterial(material, null);

        @Test
        @DisplayName("builds a client context presenting the identity")
        void buildsClientContext() throws Exception {
            SslContext ctx = creds.clientContext();

            assertThat(ctx.isClient()).isTrue();
            assertThat(creds.identity()).contains(material.identity());
        }

        @Test
        @DisplayName("refuses to build a server context")
        void refusesServerContext() {
            assertThatThrownBy(creds::serverContext)
                    .isInstanceOf(UnsupportedHandshakeException.class)
                    .hasMessage(UnsupportedHandshakeException.SERVER_HANDSHAKE_UNSUPPORTED);
        }

        @Test
        @DisplayName("verifies the dialed host unless overridden")
        void authority() {
            assertThat(creds.authority("sa.conduit:9095")).isEqualTo("sa.conduit");
            assertThat(creds.authority("[::1]:9095")).isEqualTo("::1");
            assertThat(creds.authority("sa.conduit")).isEqualTo("sa.conduit");

            var overridden = ClientTransportCredentials.forMaterial(material, "ca.conduit");
            assertThat(overridden.authority("10.0.0.1:9093")).isEqualTo("ca.conduit");
        }

        @Test
        @DisplayName("requires at least one root")
        void requiresRoots() {
            assertThatThrownBy(() -> new ClientTransportCredentials(java.util.List.of(), null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("roots");
        }

        @Test
        @DisplayName("copies share certificate data")
        void copyShares() {
            ClientTransportCredentials copy = creds.copy();

            assertThat(copy).isNotSameAs(creds);
            assertThat(copy.roots()).isEqualTo(creds.roots());
            assertThat(copy.identity()).isEqualTo(creds.identity());
        }
    }

    @Nested
    @DisplayName("ServerTransportCredentials")
    class Server {

        @Test
        @DisplayName("rejects missing TLS material with a fixed message")
        void rejectsNullMaterial() {
            assertThatThrownBy(() -> ServerTransportCredentials.create(null, Set.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(ServerTransportCredentials.NIL_SERVER_CONFIG);
        }

        @Test
        @DisplayName("builds a server context filtering on the accepted set")
        void buildsServerContext() throws Exception {
            var creds = ServerTransportCredentials.create(material, Set.of("client.conduit"));

            assertThat(creds.serverContext().isServer()).isTrue();
            assertThat(creds.trustManager().accepted()).containsExactly("client.conduit");
        }

        @Test
        @DisplayName("refuses to build a client context")
        void refusesClientContext() {
            var creds = ServerTransportCredentials.create(material, null);

            assertThat(creds.accepted()).isEmpty();
            assertThatThrownBy(creds::clientContext)
                    .isInstanceOf(UnsupportedHandshakeException.class)
                    .hasMessage(UnsupportedHandshakeException.CLIENT_HANDSHAKE_UNSUPPORTED);
        }
    }

    @Test
    @DisplayName("both variants advertise TLS 1.2, require security and refuse name overrides")
    void sharedBehaviour() {
        TransportCredentials[] all = {
                ClientTransportCredentials.forMaterial(material, null),
                ServerTransportCredentials.create(material, Set.of())
        };
        for (TransportCredentials creds : all) {
            assertThat(creds.protocolInfo()).isEqualTo(new ProtocolInfo("tls", "1.2"));
            assertThat(creds.requireTransportSecurity()).isTrue();
            assertThatThrownBy(() -> creds.overrideServerName("x"))
                    .isInstanceOf(UnsupportedHandshakeException.class)
                    .hasMessage(UnsupportedHandshakeException.OVERRIDE_SERVER_NAME_UNSUPPORTED);
        }
    }
}
