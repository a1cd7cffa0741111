package me.go_gradually.voicerelay.domain.generation;

public record TokenUsage(int promptTokens, int completionTokens) {
    public static TokenUsage empty() {
        return new TokenUsage(0, 0);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
