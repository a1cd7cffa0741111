package me.go_gradually.voicerelay.infrastructure.health;

import me.go_gradually.voicerelay.application.generation.policy.GenerationPolicy;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class GenerationProvidersHealthIndicator implements HealthIndicator {
    private final Map<String, GenerationProvider> providers;
    private final GenerationPolicy policy;

    public GenerationProvidersHealthIndicator(List<GenerationProvider> providers, GenerationPolicy policy) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(GenerationProvider::name, Function.identity(), (first, second) -> first));
        this.policy = policy;
    }

    @Override
    public Health health() {
        return ProviderChainHealth.report(
                policy.generationChain(),
                providers::containsKey,
                name -> providers.get(name).isAvailable()
        );
    }
}
