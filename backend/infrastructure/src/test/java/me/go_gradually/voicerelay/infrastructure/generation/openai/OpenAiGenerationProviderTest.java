package me.go_gradually.voicerelay.infrastructure.generation.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.generation.model.GenerationFailureKind;
import me.go_gradually.voicerelay.application.generation.model.GenerationProviderException;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
import me.go_gradually.voicerelay.domain.generation.PromptMessage;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiGenerationProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GenerationPrompt prompt = GenerationPrompt.of(
            PromptMessage.system("be brief"),
            PromptMessage.user("hi"),
            PromptMessage.assistant("hello"),
            PromptMessage.user("weather?")
    );

    private MockWebServer server;
    private AppProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new AppProperties();
        properties.getIntegrations().getOpenai().setApiKey("sk-test-key");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void generate_sendsChatCompletionAndParsesReply() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"model\":\"gpt-4o-2024\",\"choices\":[{\"message\":{\"content\":\"Sunny.\"}}],"
                        + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3}}"));

        GenerationResponse response = provider().generate(prompt);

        assertEquals("Sunny.", response.content());
        assertEquals("gpt-4o-2024", response.model());
        assertEquals("openai", response.provider());
        assertEquals(15, response.usage().totalTokens());

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer sk-test-key", request.getHeader("Authorization"));

        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("gpt-4o", payload.path("model").asText());
        assertEquals(1024, payload.path("max_tokens").asInt());
        assertEquals(4, payload.path("messages").size());
        assertEquals("system", payload.path("messages").path(0).path("role").asText());
        assertEquals("assistant", payload.path("messages").path(2).path("role").asText());
        assertEquals("weather?", payload.path("messages").path(3).path("content").asText());
    }

    @Test
    void generate_rateLimited_isRetryable() {
        server.enqueue(new MockResponse()
                .setResponseCode(429)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"Rate limit reached\"}}"));

        GenerationProviderException error = assertThrows(GenerationProviderException.class, () -> provider().generate(prompt));

        assertEquals(GenerationFailureKind.RATE_LIMITED, error.getKind());
        assertEquals(429, error.getStatus());
        assertTrue(error.isRetryable());
        assertEquals("OpenAI API error: 429 - Rate limit reached", error.getMessage());
    }

    @Test
    void generate_badRequest_isFatal() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":{\"message\":\"bad input\"}}"));

        GenerationProviderException error = assertThrows(GenerationProviderException.class, () -> provider().generate(prompt));

        assertEquals(GenerationFailureKind.MALFORMED_REQUEST, error.getKind());
        assertFalse(error.isRetryable());
    }

    @Test
    void generate_missingChoices_isInvalidResponse() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[]}"));

        GenerationProviderException error = assertThrows(GenerationProviderException.class, () -> provider().generate(prompt));

        assertEquals(GenerationFailureKind.INVALID_RESPONSE, error.getKind());
    }

    @Test
    void generate_withoutKey_isNotConfigured() {
        properties.getIntegrations().getOpenai().setApiKey("");
        OpenAiGenerationProvider provider = provider();

        assertFalse(provider.isAvailable());
        GenerationProviderException error = assertThrows(GenerationProviderException.class, () -> provider.generate(prompt));
        assertEquals(GenerationFailureKind.NOT_CONFIGURED, error.getKind());
    }

    private OpenAiGenerationProvider provider() {
        String baseUrl = "http://" + server.getHostName() + ":" + server.getPort();
        return new OpenAiGenerationProvider(WebClient.builder().baseUrl(baseUrl).build(), properties);
    }
}
