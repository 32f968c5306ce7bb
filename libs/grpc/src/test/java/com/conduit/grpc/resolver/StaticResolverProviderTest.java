package com.conduit.grpc.resolver;

import io.grpc.EquivalentAddressGroup;
import io.grpc.NameResolver;
import io.grpc.SynchronizationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("StaticResolverProvider")
class StaticResolverProviderTest {

    private StaticResolverProvider provider;
    private NameResolver.Args args;

    @BeforeEach
    void setUp() {
        provider = new StaticResolverProvider();
        args = NameResolver.Args.newBuilder()
                .setDefaultPort(443)
                .setProxyDetector(address -> null)
                .setSynchronizationContext(new SynchronizationContext((thread, error) -> {
                    throw new AssertionError("uncaught in resolver", error);
                }))
                .setServiceConfigParser(mock(NameResolver.ServiceConfigParser.class))
                .build();
    }

    private List<EquivalentAddressGroup> resolve(String target) {
        NameResolver resolver = provider.newNameResolver(URI.create(target), args);
        NameResolver.Listener2 listener = mock(NameResolver.Listener2.class);
        resolver.start(listener);
        ArgumentCaptor<NameResolver.ResolutionResult> result = ArgumentCaptor.forClass(NameResolver.ResolutionResult.class);
        verify(listener, times(1)).onResult(result.capture());
        return result.getValue().getAddresses();
    }

    private static String authority(EquivalentAddressGroup group) {
        return group.getAttributes().get(EquivalentAddressGroup.ATTR_AUTHORITY_OVERRIDE);
    }

    @Nested
    @DisplayName("resolving")
    class Resolving {

        @Test
        @DisplayName("resolves an IPv4 endpoint to itself")
        void ipv4() {
            List<EquivalentAddressGroup> groups = resolve("static:///127.0.0.1:1337");

            assertThat(groups).hasSize(1);
            assertThat(groups.get(0).getAddresses())
                    .containsExactly(new InetSocketAddress("127.0.0.1", 1337));
            assertThat(authority(groups.get(0))).isEqualTo("127.0.0.1:1337");
        }

        @Test
        @DisplayName("resolves a bracketed IPv6 endpoint")
        void ipv6() {
            List<EquivalentAddressGroup> groups = resolve("static:///%5B::1%5D:1337");

            assertThat(authority(groups.get(0))).isEqualTo("[::1]:1337");
            assertThat(((InetSocketAddress) groups.get(0).getAddresses().get(0)).getPort()).isEqualTo(1337);
        }

        @Test
        @DisplayName("defaults an empty host to the loopback address")
        void emptyHost() {
            assertThat(authority(resolve("static:///:1337").get(0))).isEqualTo("127.0.0.1:1337");
        }

        @Test
        @DisplayName("keeps endpoints in target order, one group each")
        void keepsOrder() {
            List<EquivalentAddressGroup> groups = resolve("static:///10.0.0.3:1,10.0.0.1:2,10.0.0.2:3");

            assertThat(groups).extracting(StaticResolverProviderTest::authority)
                    .containsExactly("10.0.0.3:1", "10.0.0.1:2", "10.0.0.2:3");
        }

        @Test
        @DisplayName("uses the first endpoint as the service authority")
        void serviceAuthority() {
            NameResolver resolver = provider.newNameResolver(URI.create("static:///10.0.0.3:1,10.0.0.1:2"), args);

            assertThat(resolver.getServiceAuthority()).isEqualTo("10.0.0.3:1");
        }
    }

    @Nested
    @DisplayName("rejecting")
    class Rejecting {

        @Test
        @DisplayName("rejects hostnames")
        void hostname() {
            assertThatThrownBy(() -> provider.newNameResolver(URI.create("static:///localhost:1337"), args))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not an IP address");
        }

        @Test
        @DisplayName("rejects an endpoint without a port")
        void missingPort() {
            assertThatThrownBy(() -> provider.newNameResolver(URI.create("static:///10.0.0.1"), args))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing a port");
        }

        @Test
        @DisplayName("rejects an empty target")
        void empty() {
            assertThatThrownBy(() -> provider.newNameResolver(URI.create("static:///"), args))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("declines other schemes")
        void otherScheme() {
            assertThat(provider.newNameResolver(URI.create("dns:///10.0.0.1:1"), args)).isNull();
        }
    }
}
