package me.go_gradually.voicerelay.application.synthesis.model;

import java.util.List;
import java.util.stream.Collectors;

public record FallbackOutcome(FallbackStatus status,
                              String servedBy,
                              List<ProviderFailure> failures,
                              List<String> skipped,
                              long totalFrames,
                              String codec,
                              int sampleRateHz,
                              int channels) {
    public FallbackOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean fallbackUsed() {
        return !failures.isEmpty();
    }

    public List<String> attemptedProviders() {
        List<String> attempted = failures.stream().map(ProviderFailure::provider).collect(Collectors.toList());
        if (servedBy != null && !attempted.contains(servedBy)) {
            attempted.add(servedBy);
        }
        return attempted;
    }
}
