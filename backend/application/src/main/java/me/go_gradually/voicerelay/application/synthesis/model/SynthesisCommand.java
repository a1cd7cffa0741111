package me.go_gradually.voicerelay.application.synthesis.model;

public record SynthesisCommand(String text, String correlationId) {
    public SynthesisCommand {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
    }
}
