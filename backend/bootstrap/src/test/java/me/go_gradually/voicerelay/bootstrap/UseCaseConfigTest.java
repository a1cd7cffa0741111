package me.go_gradually.voicerelay.bootstrap;

import me.go_gradually.voicerelay.VoiceRelayApplication;
import me.go_gradually.voicerelay.application.generation.model.GenerationOutcome;
import me.go_gradually.voicerelay.application.generation.usecase.GenerationFallbackUseCase;
import me.go_gradually.voicerelay.application.relay.port.MessageStorePort;
import me.go_gradually.voicerelay.application.relay.usecase.RelayConnectionUseCase;
import me.go_gradually.voicerelay.application.synthesis.usecase.SynthesisFallbackUseCase;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.PromptMessage;
import me.go_gradually.voicerelay.infrastructure.conversation.store.InMemoryMessageStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(
        classes = VoiceRelayApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "relay.synthesis.test.enabled=true",
                "relay.generation.test-mode=true"
        }
)
class UseCaseConfigTest {

    @Autowired
    private SynthesisFallbackUseCase synthesisFallbackUseCase;
    @Autowired
    private GenerationFallbackUseCase generationFallbackUseCase;
    @Autowired
    private RelayConnectionUseCase relayConnectionUseCase;
    @Autowired
    private MessageStorePort messageStorePort;
    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void wiresChainsFromProperties() {
        assertNotNull(relayConnectionUseCase);
        assertEquals(List.of("fishaudio", "cartesia", "elevenlabs", "test"),
                synthesisFallbackUseCase.chain().fromPrimary());
        assertEquals(List.of("test"), generationFallbackUseCase.chain().fromPrimary());
        assertInstanceOf(InMemoryMessageStore.class, messageStorePort);
    }

    @Test
    void generationTestMode_servesDeterministicReply() {
        GenerationPrompt prompt = GenerationPrompt.of(PromptMessage.user("How was your weekend?"));

        GenerationOutcome first = generationFallbackUseCase.generate(prompt, "c-1");
        GenerationOutcome second = generationFallbackUseCase.generate(prompt, "c-2");

        assertEquals("test", first.response().provider());
        assertEquals(first.response().content(), second.response().content());
    }

    @Test
    void healthEndpoint_reportsProviderChains() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);

        assertTrue(response.getStatusCode().is2xxSuccessful());
        assertTrue(response.getBody().contains("synthesisProviders"));
        assertTrue(response.getBody().contains("generationProviders"));
    }
}
