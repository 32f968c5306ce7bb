package com.conduit.security;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which client identities may call which service. Immutable once built.
 */
public final class ServiceAuthPolicy {

    private final Map<String, Set<String>> acceptedByService;

    private ServiceAuthPolicy(Map<String, Set<String>> acceptedByService) {
        this.acceptedByService = acceptedByService;
    }

    /**
     * @param acceptedByService fully-qualified service name to the DNS names allowed to call it
     */
    public static ServiceAuthPolicy of(Map<String, Set<String>> acceptedByService) {
        Map<String, Set<String>> copy = new HashMap<>();
        acceptedByService.forEach((service, names) -> copy.put(service, names == null ? Set.of() : Set.copyOf(names)));
        return new ServiceAuthPolicy(Map.copyOf(copy));
    }

    /** Client names accepted for a service, or empty if the service has no policy. */
    public Optional<Set<String>> acceptedFor(String service) {
        return Optional.ofNullable(acceptedByService.get(service));
    }

    public boolean isEmpty() {
        return acceptedByService.isEmpty();
    }

    public Set<String> services() {
        return acceptedByService.keySet();
    }
}
