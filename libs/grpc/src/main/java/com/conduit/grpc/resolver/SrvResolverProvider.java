package com.conduit.grpc.resolver;

import com.google.common.base.Ticker;
import io.grpc.NameResolver;
import io.grpc.NameResolverProvider;

import java.net.URI;
import java.util.function.Function;

/**
 * Provides {@link SrvNameResolver}s for {@code srv://[dns-authority]/service.domain[,...]}
 * targets. Registered through {@code META-INF/services/io.grpc.NameResolverProvider}.
 */
public final class SrvResolverProvider extends NameResolverProvider {

    public static final String SCHEME = "srv";

    private final Function<String, DnsLookup> lookups;
    private final Ticker ticker;

    public SrvResolverProvider() {
        this(JndiDnsLookup::new, Ticker.systemTicker());
    }

    SrvResolverProvider(Function<String, DnsLookup> lookups, Ticker ticker) {
        this.lookups = lookups;
        this.ticker = ticker;
    }

    @Override
    public NameResolver newNameResolver(URI targetUri, NameResolver.Args args) {
        if (!SCHEME.equals(targetUri.getScheme())) {
            return null;
        }
        String path = targetUri.getPath();
        if (path != null && path.startsWith("/")) {
            path = path.substring(1);
        }
        String authority = targetUri.getAuthority();
        if (authority != null && authority.isEmpty()) {
            authority = null;
        }
        return new SrvNameResolver(path, lookups.apply(authority), args, ticker);
    }

    @Override
    public String getDefaultScheme() {
        return SCHEME;
    }

    @Override
    protected boolean isAvailable() {
        return true;
    }

    @Override
    protected int priority() {
        return 4;
    }
}
