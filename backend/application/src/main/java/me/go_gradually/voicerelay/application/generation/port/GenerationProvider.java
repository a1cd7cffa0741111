package me.go_gradually.voicerelay.application.generation.port;

import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;

public interface GenerationProvider {
    String name();

    boolean isAvailable();

    /**
     * @throws me.go_gradually.voicerelay.application.generation.model.GenerationProviderException on any upstream failure
     */
    GenerationResponse generate(GenerationPrompt prompt);
}
