package com.conduit.grpc.resolver;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import io.grpc.Attributes;
import io.grpc.EquivalentAddressGroup;
import io.grpc.NameResolver;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a fixed, comma-separated list of {@code ip:port} endpoints.
 * <p>
 * The list is parsed once, when the resolver is created, and pushed to the channel once, when it
 * starts. Each endpoint is its own address group whose authority is the endpoint itself, so the
 * server certificate of each backend is verified against that backend's IP address.
 */
public final class StaticNameResolver extends NameResolver {

    static final String DEFAULT_HOST = "127.0.0.1";

    private final List<EquivalentAddressGroup> addresses;
    private final String serviceAuthority;

    /**
     * @param endpoints target path without its leading slash, e.g. {@code 10.0.0.1:443,[::1]:443}
     * @throws IllegalArgumentException if the list is empty or an endpoint is not {@code ip:port}
     */
    public StaticNameResolver(String endpoints) {
        if (endpoints == null || endpoints.isBlank()) {
            throw new IllegalArgumentException("static target has no addresses");
        }
        List<EquivalentAddressGroup> groups = new ArrayList<>();
        for (String endpoint : endpoints.split(",")) {
            groups.add(parse(endpoint.trim()));
        }
        this.addresses = List.copyOf(groups);
        this.serviceAuthority = addresses.get(0).getAttributes().get(EquivalentAddressGroup.ATTR_AUTHORITY_OVERRIDE);
    }

    static EquivalentAddressGroup parse(String endpoint) {
        HostAndPort hostAndPort;
        try {
            hostAndPort = HostAndPort.fromString(endpoint);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid static address \"%s\"".formatted(endpoint), e);
        }
        if (!hostAndPort.hasPort()) {
            throw new IllegalArgumentException("static address \"%s\" is missing a port".formatted(endpoint));
        }
        String host = hostAndPort.getHost().isEmpty() ? DEFAULT_HOST : hostAndPort.getHost();
        if (!InetAddresses.isInetAddress(host)) {
            throw new IllegalArgumentException(
                    "static address \"%s\" is not an IP address, hostnames are not resolved".formatted(endpoint));
        }
        InetAddress ip = InetAddresses.forString(host);
        String authority = HostAndPort.fromParts(InetAddresses.toAddrString(ip), hostAndPort.getPort()).toString();
        return new EquivalentAddressGroup(
                new InetSocketAddress(ip, hostAndPort.getPort()),
                Attributes.newBuilder().set(EquivalentAddressGroup.ATTR_AUTHORITY_OVERRIDE, authority).build());
    }

    @Override
    public String getServiceAuthority() {
        return serviceAuthority;
    }

    @Override
    public void start(Listener2 listener) {
        listener.onResult(ResolutionResult.newBuilder()
                .setAddresses(addresses)
                .setAttributes(Attributes.EMPTY)
                .build());
    }

    @Override
    public void refresh() {
        // the address list never changes
    }

    @Override
    public void shutdown() {
        // nothing to release
    }
}
