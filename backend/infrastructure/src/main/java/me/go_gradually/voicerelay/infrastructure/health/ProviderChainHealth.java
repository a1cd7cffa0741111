package me.go_gradually.voicerelay.infrastructure.health;

import me.go_gradually.voicerelay.domain.provider.ProviderChain;
import org.springframework.boot.actuate.health.Health;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Shared report for a provider chain.
 * <ul>
 *   <li>UP: the primary is ready</li>
 *   <li>DEGRADED: the primary is not ready but a later provider is</li>
 *   <li>DOWN: nothing in the chain is ready</li>
 * </ul>
 */
final class ProviderChainHealth {
    static final String DEGRADED = "DEGRADED";

    private ProviderChainHealth() {
    }

    static Health report(ProviderChain chain, Predicate<String> registered, Predicate<String> available) {
        Map<String, String> providers = new LinkedHashMap<>();
        int ready = 0;
        for (String name : chain.providers()) {
            String status = describe(name, registered, available);
            providers.put(name, status);
            if ("ready".equals(status)) {
                ready++;
            }
        }

        Health.Builder builder;
        if ("ready".equals(providers.get(chain.primary()))) {
            builder = Health.up().withDetail("status", "Primary provider operational");
        } else if (ready > 0) {
            builder = Health.status(DEGRADED).withDetail("status", "Serving from fallback providers");
        } else {
            builder = Health.down().withDetail("status", "No providers available");
        }
        return builder
                .withDetail("primary", chain.primary())
                .withDetail("order", chain.providers())
                .withDetail("providers", providers)
                .build();
    }

    private static String describe(String name, Predicate<String> registered, Predicate<String> available) {
        if (!registered.test(name)) {
            return "not_registered";
        }
        return available.test(name) ? "ready" : "unavailable";
    }
}
