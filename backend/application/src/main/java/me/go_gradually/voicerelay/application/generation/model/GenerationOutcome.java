package me.go_gradually.voicerelay.application.generation.model;

import me.go_gradually.voicerelay.domain.generation.GenerationResponse;

import java.util.List;

public record GenerationOutcome(GenerationResponse response, List<GenerationFailure> failures, String correlationId) {
    public GenerationOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean fallbackUsed() {
        return !failures.isEmpty();
    }
}
