package com.conduit.grpc.resolver;

import io.grpc.NameResolver;
import io.grpc.NameResolverProvider;

import java.net.URI;

/**
 * Provides {@link StaticNameResolver}s for {@code static:///ip:port,ip:port} targets. Registered
 * through {@code META-INF/services/io.grpc.NameResolverProvider}.
 */
public final class StaticResolverProvider extends NameResolverProvider {

    public static final String SCHEME = "static";

    @Override
    public NameResolver newNameResolver(URI targetUri, NameResolver.Args args) {
        if (!SCHEME.equals(targetUri.getScheme())) {
            return null;
        }
        String path = targetUri.getPath();
        if (path != null && path.startsWith("/")) {
            path = path.substring(1);
        }
        return new StaticNameResolver(path);
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
