package me.go_gradually.voicerelay.application.generation.usecase;

import me.go_gradually.voicerelay.application.generation.model.GenerationChainExhaustedException;
import me.go_gradually.voicerelay.application.generation.model.GenerationFailure;
import me.go_gradually.voicerelay.application.generation.model.GenerationFailureKind;
import me.go_gradually.voicerelay.application.generation.model.GenerationOutcome;
import me.go_gradually.voicerelay.application.generation.model.GenerationProviderException;
import me.go_gradually.voicerelay.application.generation.policy.GenerationPolicy;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.application.shared.log.ProviderLogRedactor;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
import me.go_gradually.voicerelay.domain.provider.ProviderChain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class GenerationFallbackUseCase {
    private static final Logger log = Logger.getLogger(GenerationFallbackUseCase.class.getName());

    private final Map<String, GenerationProvider> providers;
    private final ProviderChain chain;
    private final MetricsPort metrics;

    public GenerationFallbackUseCase(List<GenerationProvider> providers, GenerationPolicy policy, MetricsPort metrics) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(GenerationProvider::name, Function.identity(), (first, second) -> first));
        this.chain = policy.generationChain();
        this.metrics = metrics;
    }

    public ProviderChain chain() {
        return chain;
    }

    public GenerationOutcome generate(GenerationPrompt prompt, String correlationId) {
        return generate(prompt, null, correlationId);
    }

    public GenerationOutcome generate(GenerationPrompt prompt, String forceProvider, String correlationId) {
        List<GenerationFailure> failures = new ArrayList<>();
        for (String name : candidateNames(forceProvider)) {
            GenerationProvider provider = providers.get(name);
            if (provider == null || !provider.isAvailable()) {
                log.fine(() -> "generation.provider skipped correlationId=" + correlationId + " provider=" + name);
                continue;
            }
            Instant start = Instant.now();
            try {
                GenerationResponse response = provider.generate(prompt);
                Duration elapsed = Duration.between(start, Instant.now());
                metrics.recordGenerationLatency(name, elapsed);
                if (!failures.isEmpty()) {
                    metrics.incrementGenerationFallback();
                }
                log.fine(() -> "generation.success correlationId=" + correlationId
                        + " provider=" + name
                        + " elapsedMs=" + elapsed.toMillis()
                        + " fallback=" + !failures.isEmpty());
                return new GenerationOutcome(response, failures, correlationId);
            } catch (GenerationProviderException e) {
                Duration elapsed = Duration.between(start, Instant.now());
                metrics.incrementGenerationError(name);
                String message = ProviderLogRedactor.describe(e);
                log.warning("generation.provider failure correlationId=" + correlationId
                        + " provider=" + name
                        + " kind=" + e.getKind()
                        + " elapsedMs=" + elapsed.toMillis()
                        + " reason=" + message);
                if (!e.isRetryable()) {
                    throw e;
                }
                failures.add(new GenerationFailure(name, e.getKind(), message, elapsed));
            } catch (RuntimeException e) {
                metrics.incrementGenerationError(name);
                log.warning("generation.provider unexpected failure correlationId=" + correlationId
                        + " provider=" + name
                        + " reason=" + ProviderLogRedactor.describe(e));
                throw new GenerationProviderException(name, GenerationFailureKind.MALFORMED_REQUEST, null,
                        ProviderLogRedactor.describe(e), e);
            }
        }
        log.warning("generation.exhausted correlationId=" + correlationId
                + " attempted=" + failures.stream().map(GenerationFailure::provider).collect(Collectors.toList()));
        throw new GenerationChainExhaustedException(correlationId, failures);
    }

    private List<String> candidateNames(String forceProvider) {
        if (forceProvider != null && !forceProvider.isBlank() && providers.containsKey(forceProvider)) {
            return List.of(forceProvider);
        }
        return chain.fromPrimary();
    }
}
