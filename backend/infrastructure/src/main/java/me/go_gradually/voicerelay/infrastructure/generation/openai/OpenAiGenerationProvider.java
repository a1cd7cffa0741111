package me.go_gradually.voicerelay.infrastructure.generation.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
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
public class OpenAiGenerationProvider implements GenerationProvider {
    public static final String NAME = "openai";

    private static final Logger log = Logger.getLogger(OpenAiGenerationProvider.class.getName());

    private final WebClient webClient;
    private final AppProperties.LanguageProvider settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiGenerationProvider(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getOpenai();
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
            throw GenerationErrorMapper.notConfigured(NAME, "OpenAI not configured");
        }
        String body;
        try {
            body = webClient.post()
                    .uri("/v1/chat/completions")
                    .header("Authorization", "Bearer " + settings.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestPayload(prompt))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (RuntimeException e) {
            throw GenerationErrorMapper.map(NAME, "OpenAI", e);
        }
        return parse(body);
    }

    private Map<String, Object> requestPayload(GenerationPrompt prompt) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (PromptMessage message : prompt.messages()) {
            messages.add(Map.of("role", message.role().wireName(), "content", message.content()));
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", settings.getModel());
        payload.put("messages", messages);
        payload.put("max_tokens", settings.getMaxTokens());
        payload.put("temperature", settings.getTemperature());
        return payload;
    }

    private GenerationResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw GenerationErrorMapper.invalidResponse(NAME, "OpenAI returned unparseable body");
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw GenerationErrorMapper.invalidResponse(NAME, "OpenAI returned no choices");
        }
        JsonNode usage = root.path("usage");
        TokenUsage tokens = new TokenUsage(usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
        String model = root.path("model").asText(settings.getModel());
        log.fine(() -> "generation.openai response model=" + model
                + " chars=" + content.asText().length()
                + " tokens=" + tokens.totalTokens());
        return new GenerationResponse(content.asText(), model, NAME, tokens);
    }
}
