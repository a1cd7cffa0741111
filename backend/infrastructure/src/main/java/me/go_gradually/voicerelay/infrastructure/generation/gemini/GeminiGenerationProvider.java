package me.go_gradually.voicerelay.infrastructure.generation.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
import me.go_gradually.voicerelay.domain.generation.MessageRole;
import me.go_gradually.voicerelay.domain.generation.PromptMessage;
import me.go_gradually.voicerelay.domain.generation.TokenUsage;
import me.go_gradually.voicerelay.infrastructure.generation.support.GenerationErrorMapper;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

@Component
public class GeminiGenerationProvider implements GenerationProvider {
    public static final String NAME = "gemini";

    private static final Logger log = Logger.getLogger(GeminiGenerationProvider.class.getName());

    private final WebClient webClient;
    private final AppProperties.LanguageProvider settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiGenerationProvider(@Qualifier("geminiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getGemini();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return settings.isConfigured();
    }

    @Override
    public GenerationResponse generate(GenerationPrompt prompt) {
        if (!isAvailable()) {
            throw GenerationErrorMapper.notConfigured(NAME, "Gemini not configured");
        }
        String body;
        try {
            body = webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/v1beta/models/{model}:generateContent")
                            .queryParam("key", settings.getApiKey())
                            .build(settings.getModel()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestPayload(prompt))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (RuntimeException e) {
            throw GenerationErrorMapper.map(NAME, "Gemini", e);
        }
        return parse(body);
    }

    private Map<String, Object> requestPayload(GenerationPrompt prompt) {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (PromptMessage message : prompt.conversation()) {
            String role = message.role() == MessageRole.ASSISTANT ? "model" : "user";
            contents.add(Map.of(
                    "role", role,
                    "parts", List.of(Map.of("text", message.content()))
            ));
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("contents", contents);
        payload.put("generationConfig", Map.of(
                "maxOutputTokens", settings.getMaxTokens(),
                "temperature", settings.getTemperature()
        ));
        String systemInstruction = prompt.systemContent();
        if (!systemInstruction.isBlank()) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemInstruction))));
        }
        return payload;
    }

    private GenerationResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw GenerationErrorMapper.invalidResponse(NAME, "Gemini returned unparseable body");
        }
        JsonNode content = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!content.isTextual()) {
            throw GenerationErrorMapper.invalidResponse(NAME, "Gemini returned no candidates");
        }
        JsonNode usage = root.path("usageMetadata");
        TokenUsage tokens = new TokenUsage(usage.path("promptTokenCount").asInt(0), usage.path("candidatesTokenCount").asInt(0));
        log.fine(() -> "generation.gemini response model=" + settings.getModel()
                + " chars=" + content.asText().length()
                + " tokens=" + tokens.totalTokens());
        return new GenerationResponse(content.asText(), settings.getModel(), NAME, tokens);
    }
}
