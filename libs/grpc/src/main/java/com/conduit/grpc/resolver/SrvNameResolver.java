package com.conduit.grpc.resolver;

import com.google.common.base.Ticker;
import com.google.common.net.HostAndPort;
import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Attributes;
import io.grpc.EquivalentAddressGroup;
import io.grpc.NameResolver;
import io.grpc.Status;
import io.grpc.SynchronizationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.NameNotFoundException;
import javax.naming.NamingException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Resolves a comma-separated list of {@code service.domain} names through DNS SRV records, then
 * resolves each record's target host to its addresses.
 * <p>
 * Every address is its own group. Unless the channel overrides its authority, each group carries
 * its SRV target as authority, so a backend's certificate is verified against the name published
 * for it. Successful results are kept for {@link #MIN_RESOLUTION_INTERVAL}; refreshes inside that
 * window are ignored. Failures go to the channel, which retries with backoff.
 */
public final class SrvNameResolver extends NameResolver {

    private static final Logger log = LoggerFactory.getLogger(SrvNameResolver.class);

    static final Duration MIN_RESOLUTION_INTERVAL = Duration.ofSeconds(30);

    private final String target;
    private final List<Name> names;
    private final DnsLookup dns;
    private final boolean perAddressAuthority;
    private final SynchronizationContext syncContext;
    private final Executor executor;
    private final Ticker ticker;

    // guarded by syncContext
    private Listener2 listener;
    private boolean resolving;
    private boolean shutdown;
    private long lastResolvedNanos;
    private boolean resolved;

    /**
     * @param target names without the leading slash, e.g. {@code sa.service.consul,ra.service.consul}
     * @throws IllegalArgumentException if the list is empty or a name has fewer than two labels
     */
    SrvNameResolver(String target, DnsLookup dns, Args args, Ticker ticker) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("srv target has no names");
        }
        List<Name> parsed = new ArrayList<>();
        for (String name : target.split(",")) {
            parsed.add(Name.parse(name.trim()));
        }
        this.target = target;
        this.names = List.copyOf(parsed);
        this.dns = dns;
        this.perAddressAuthority = args.getOverrideAuthority() == null;
        this.syncContext = args.getSynchronizationContext();
        this.executor = args.getOffloadExecutor() != null ? args.getOffloadExecutor() : MoreExecutors.directExecutor();
        this.ticker = ticker;
    }

    @Override
    public String getServiceAuthority() {
        return names.get(0).service() + "." + names.get(0).domain();
    }

    @Override
    public void start(Listener2 listener) {
        if (this.listener != null) {
            throw new IllegalStateException("already started");
        }
        this.listener = listener;
        resolve();
    }

    @Override
    public void refresh() {
        if (listener == null) {
            throw new IllegalStateException("not started");
        }
        resolve();
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    private void resolve() {
        if (resolving || shutdown) {
            return;
        }
        if (resolved && ticker.read() - lastResolvedNanos < MIN_RESOLUTION_INTERVAL.toNanos()) {
            log.debug("Ignoring refresh of srv target {} inside the minimum resolution interval", target);
            return;
        }
        resolving = true;
        executor.execute(this::lookup);
    }

    private void lookup() {
        Status failure = null;
        List<EquivalentAddressGroup> groups = List.of();
        try {
            groups = lookupAddresses();
            if (groups.isEmpty()) {
                failure = Status.UNAVAILABLE.withDescription("srv: no addresses found for " + target);
            }
        } catch (NamingException e) {
            log.info("srv: record lookup for {} failed: {}", target, e.toString());
            failure = Status.UNAVAILABLE.withDescription("srv: record lookup error for " + target).withCause(e);
        }
        Status error = failure;
        List<EquivalentAddressGroup> addresses = groups;
        syncContext.execute(() -> {
            resolving = false;
            if (shutdown) {
                return;
            }
            if (error != null) {
                listener.onError(error);
                return;
            }
            resolved = true;
            lastResolvedNanos = ticker.read();
            listener.onResult(ResolutionResult.newBuilder()
                    .setAddresses(addresses)
                    .setAttributes(Attributes.EMPTY)
                    .build());
        });
    }

    private List<EquivalentAddressGroup> lookupAddresses() throws NamingException {
        List<EquivalentAddressGroup> groups = new ArrayList<>();
        for (Name name : names) {
            List<DnsLookup.SrvRecord> records;
            try {
                records = dns.srv(name.service(), name.domain());
            } catch (NameNotFoundException e) {
                log.debug("srv: no SRV records for _{}._tcp.{}", name.service(), name.domain());
                continue;
            }
            for (DnsLookup.SrvRecord record : records) {
                List<InetAddress> hosts;
                try {
                    hosts = dns.host(record.target());
                } catch (NameNotFoundException e) {
                    log.debug("srv: skipping record target {}, it has no addresses", record.target());
                    continue;
                }
                Attributes attributes = perAddressAuthority
                        ? Attributes.newBuilder()
                                .set(EquivalentAddressGroup.ATTR_AUTHORITY_OVERRIDE,
                                        HostAndPort.fromParts(record.target(), record.port()).toString())
                                .build()
                        : Attributes.EMPTY;
                for (InetAddress host : hosts) {
                    groups.add(new EquivalentAddressGroup(new InetSocketAddress(host, record.port()), attributes));
                }
            }
        }
        return groups;
    }

    /** An SRV name split into its service label and domain. */
    record Name(String service, String domain) {

        static Name parse(String name) {
            int dot = name.indexOf('.');
            if (dot <= 0 || dot == name.length() - 1) {
                throw new IllegalArgumentException("srv: hostname \"%s\" contains < 2 labels".formatted(name));
            }
            return new Name(name.substring(0, dot), name.substring(dot + 1));
        }
    }
}
