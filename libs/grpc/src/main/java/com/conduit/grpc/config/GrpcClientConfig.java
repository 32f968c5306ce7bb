package com.conduit.grpc.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a gRPC client connection. Exactly one of {@code serverAddress},
 * {@code serverIpAddresses}, {@code srvLookup} and {@code srvLookups} must be set.
 *
 * @param serverAddress     {@code host:port} resolved through DNS A/AAAA records
 * @param serverIpAddresses literal {@code ip:port} endpoints, resolved statically
 * @param srvLookup         one service whose backends are found through DNS SRV records
 * @param srvLookups        several services whose backends are found through DNS SRV records
 * @param dnsAuthority      {@code host[:port]} of the DNS server for serverAddress and SRV
 *                          lookups, or null for the system resolver
 * @param hostOverride      name to verify in the server certificate instead of the dialed host
 * @param timeout           upper bound applied to every call
 */
public record GrpcClientConfig(
        String serverAddress,
        List<String> serverIpAddresses,
        ServiceDomain srvLookup,
        List<ServiceDomain> srvLookups,
        String dnsAuthority,
        String hostOverride,
        Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public GrpcClientConfig {
        serverAddress = blankToNull(serverAddress);
        serverIpAddresses = serverIpAddresses == null ? List.of() : List.copyOf(serverIpAddresses);
        srvLookups = srvLookups == null ? List.of() : List.copyOf(srvLookups);
        dnsAuthority = blankToNull(dnsAuthority);
        hostOverride = blankToNull(hostOverride);
        timeout = timeout == null || timeout.isZero() ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative()) {
            throw new ConfigurationException("timeout must not be negative");
        }
    }

    public GrpcClientConfig(String serverAddress, List<String> serverIpAddresses, String hostOverride,
                            Duration timeout) {
        this(serverAddress, serverIpAddresses, null, null, null, hostOverride, timeout);
    }

    /** Client of a DNS-resolved server. */
    public static GrpcClientConfig forAddress(String serverAddress, Duration timeout) {
        return new GrpcClientConfig(serverAddress, null, null, timeout);
    }

    /** Client of a fixed set of endpoints. */
    public static GrpcClientConfig forIpAddresses(List<String> serverIpAddresses, Duration timeout) {
        return new GrpcClientConfig(null, serverIpAddresses, null, timeout);
    }

    /** Client of the backends published under one SRV name. */
    public static GrpcClientConfig forSrvLookup(ServiceDomain srvLookup, Duration timeout) {
        return new GrpcClientConfig(null, null, srvLookup, null, null, null, timeout);
    }

    /** Client of the backends published under several SRV names. */
    public static GrpcClientConfig forSrvLookups(List<ServiceDomain> srvLookups, Duration timeout) {
        return new GrpcClientConfig(null, null, null, srvLookups, null, null, timeout);
    }

    /** Returns a copy verifying {@code hostOverride} in the server certificate. */
    public GrpcClientConfig withHostOverride(String hostOverride) {
        return new GrpcClientConfig(serverAddress, serverIpAddresses, srvLookup, srvLookups, dnsAuthority,
                hostOverride, timeout);
    }

    /** Returns a copy resolving names through the DNS server at {@code dnsAuthority}. */
    public GrpcClientConfig withDnsAuthority(String dnsAuthority) {
        return new GrpcClientConfig(serverAddress, serverIpAddresses, srvLookup, srvLookups, dnsAuthority,
                hostOverride, timeout);
    }

    /**
     * The channel target and the server name to verify.
     *
     * @throws ConfigurationException unless exactly one address form is set, or if
     *                                serverAddress has no port
     */
    public Target targetAndHostOverride() {
        int forms = (serverAddress != null ? 1 : 0)
                + (!serverIpAddresses.isEmpty() ? 1 : 0)
                + (srvLookup != null ? 1 : 0)
                + (!srvLookups.isEmpty() ? 1 : 0);
        if (forms > 1) {
            throw new ConfigurationException(ConfigurationException.BOTH_ADDRESS_FORMS);
        }
        if (forms == 0) {
            throw new ConfigurationException(ConfigurationException.NO_ADDRESS_FORM);
        }
        String authority = dnsAuthority == null ? "" : dnsAuthority;
        if (serverAddress != null) {
            String override = hostOverride != null ? hostOverride : hostPart(serverAddress);
            return new Target("dns://" + authority + "/" + escapeBrackets(serverAddress), override);
        }
        if (srvLookup != null) {
            String name = srvLookup.name();
            return new Target("srv://" + authority + "/" + name, hostOverride != null ? hostOverride : name);
        }
        if (!srvLookups.isEmpty()) {
            List<String> names = new ArrayList<>();
            for (ServiceDomain lookup : srvLookups) {
                names.add(lookup.name());
            }
            return new Target("srv://" + authority + "/" + String.join(",", names), hostOverride);
        }
        return new Target("static:///" + escapeBrackets(String.join(",", serverIpAddresses)), null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // java.net.URI only allows brackets in the authority; resolvers read the decoded path.
    private static String escapeBrackets(String path) {
        return path.replace("[", "%5B").replace("]", "%5D");
    }

    private static String hostPart(String address) {
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            throw new ConfigurationException("serverAddress %s is missing a port".formatted(address));
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return host;
    }

    /**
     * An SRV name, {@code _<service>._tcp.<domain>}.
     *
     * @param service first label of the name, without the leading underscore
     * @param domain  rest of the name
     */
    public record ServiceDomain(String service, String domain) {

        public ServiceDomain {
            if (service == null || service.isBlank() || service.contains(".")) {
                throw new ConfigurationException("srv lookup service \"%s\" must be a single label".formatted(service));
            }
            if (domain == null || domain.isBlank()) {
                throw new ConfigurationException("srv lookup for service %s is missing a domain".formatted(service));
            }
        }

        /** {@code service.domain}, the form carried in {@code srv} targets. */
        public String name() {
            return service + "." + domain;
        }
    }

    /**
     * Where a channel connects.
     *
     * @param uri          gRPC target URI, {@code dns:}, {@code srv:} or {@code static:}
     * @param hostOverride server name to verify, or null to verify each endpoint's own authority
     */
    public record Target(String uri, String hostOverride) {}
}
