package me.go_gradually.voicerelay.application.generation.model;

import java.util.List;

public class GenerationChainExhaustedException extends RuntimeException {
    private final String correlationId;
    private final List<GenerationFailure> failures;

    public GenerationChainExhaustedException(String correlationId, List<GenerationFailure> failures) {
        super("All generation providers failed");
        this.correlationId = correlationId;
        this.failures = List.copyOf(failures);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public List<GenerationFailure> getFailures() {
        return failures;
    }
}
