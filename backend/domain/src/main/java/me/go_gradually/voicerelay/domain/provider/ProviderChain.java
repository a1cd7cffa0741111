package me.go_gradually.voicerelay.domain.provider;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed priority order of interchangeable providers. Built once from configuration and never mutated.
 */
public record ProviderChain(List<String> providers, String primary) {
    public ProviderChain {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("Provider chain must not be empty");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String provider : providers) {
            if (provider == null || provider.isBlank()) {
                throw new IllegalArgumentException("Provider name is required");
            }
            if (!unique.add(provider)) {
                throw new IllegalArgumentException("Duplicate provider in chain: " + provider);
            }
        }
        providers = List.copyOf(providers);
        if (primary == null || primary.isBlank()) {
            primary = providers.get(0);
        }
    }

    public static ProviderChain of(String... providers) {
        return new ProviderChain(List.of(providers), null);
    }

    public boolean contains(String provider) {
        return providers.contains(provider);
    }

    /**
     * Providers from the primary onward. The whole chain when the primary is not a member.
     */
    public List<String> fromPrimary() {
        int start = providers.indexOf(primary);
        if (start < 0) {
            return providers;
        }
        return providers.subList(start, providers.size());
    }

    public ProviderChain appending(String provider) {
        if (contains(provider)) {
            return this;
        }
        List<String> extended = new ArrayList<>(providers);
        extended.add(provider);
        return new ProviderChain(extended, primary);
    }
}
