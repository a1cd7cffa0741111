package me.go_gradually.voicerelay.application.synthesis.model;

import java.util.Set;

public record SpeakRequest(String text, String voiceProvider, Set<String> disabledProviders, String correlationId) {
    public SpeakRequest {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        disabledProviders = disabledProviders == null ? Set.of() : Set.copyOf(disabledProviders);
    }

    public boolean isDisabled(String provider) {
        return disabledProviders.contains(provider);
    }

    public boolean hasExplicitProvider() {
        return voiceProvider != null && !voiceProvider.isBlank() && !isDisabled(voiceProvider);
    }
}
