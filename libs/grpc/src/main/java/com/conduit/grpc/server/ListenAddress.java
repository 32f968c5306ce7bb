package com.conduit.grpc.server;

import com.conduit.grpc.config.ConfigurationException;
import com.google.common.net.HostAndPort;

import java.net.InetSocketAddress;

/**
 * Parses listen addresses: {@code host:port}, {@code [v6]:port}, or {@code :port} for every
 * interface.
 */
final class ListenAddress {

    private ListenAddress() {
        // utility class
    }

    static InetSocketAddress parse(String address) {
        HostAndPort hostAndPort;
        try {
            hostAndPort = HostAndPort.fromString(address.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid gRPC listen address \"%s\"".formatted(address), e);
        }
        if (!hostAndPort.hasPort()) {
            throw new ConfigurationException("gRPC listen address \"%s\" is missing a port".formatted(address));
        }
        if (hostAndPort.getHost().isEmpty()) {
            return new InetSocketAddress(hostAndPort.getPort());
        }
        return new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
    }
}
