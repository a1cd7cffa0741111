package me.go_gradually.voicerelay.infrastructure.health;

import me.go_gradually.voicerelay.application.synthesis.policy.SynthesisPolicy;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Exposed as {@code synthesisProviders} under /actuator/health.
 */
@Component
public class SynthesisProvidersHealthIndicator implements HealthIndicator {
    private final Map<String, SynthesisProvider> providers;
    private final SynthesisPolicy policy;

    public SynthesisProvidersHealthIndicator(List<SynthesisProvider> providers, SynthesisPolicy policy) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(SynthesisProvider::name, Function.identity(), (first, second) -> first));
        this.policy = policy;
    }

    @Override
    public Health health() {
        return ProviderChainHealth.report(
                policy.synthesisChain(),
                providers::containsKey,
                name -> providers.get(name).isAvailable()
        );
    }
}
