package me.go_gradually.voicerelay.domain.generation;

public record GenerationResponse(String content, String model, String provider, TokenUsage usage) {
    public GenerationResponse {
        if (content == null) {
            throw new IllegalArgumentException("Generated content is required");
        }
        usage = usage == null ? TokenUsage.empty() : usage;
    }
}
