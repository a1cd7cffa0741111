package me.go_gradually.voicerelay.application.generation.usecase;

import me.go_gradually.voicerelay.application.generation.model.GenerationChainExhaustedException;
import me.go_gradually.voicerelay.application.generation.model.GenerationFailureKind;
import me.go_gradually.voicerelay.application.generation.model.GenerationOutcome;
import me.go_gradually.voicerelay.application.generation.model.GenerationProviderException;
import me.go_gradually.voicerelay.application.generation.policy.GenerationPolicy;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
import me.go_gradually.voicerelay.domain.generation.PromptMessage;
import me.go_gradually.voicerelay.domain.generation.TokenUsage;
import me.go_gradually.voicerelay.domain.provider.ProviderChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationFallbackUseCaseTest {

    private final GenerationPrompt prompt = GenerationPrompt.of(PromptMessage.system("persona"), PromptMessage.user("hi"));

    @Mock
    private GenerationProvider openai;
    @Mock
    private GenerationProvider gemini;
    @Mock
    private MetricsPort metrics;

    @BeforeEach
    void setUp() {
        lenient().when(openai.name()).thenReturn("openai");
        lenient().when(gemini.name()).thenReturn("gemini");
        lenient().when(openai.isAvailable()).thenReturn(true);
        lenient().when(gemini.isAvailable()).thenReturn(true);
    }

    @Test
    void generate_returnsPrimaryResponse_withoutFallback() {
        GenerationResponse response = response("openai");
        when(openai.generate(prompt)).thenReturn(response);

        GenerationOutcome outcome = useCase().generate(prompt, "c1");

        assertSame(response, outcome.response());
        assertFalse(outcome.fallbackUsed());
        assertEquals("c1", outcome.correlationId());
        verify(gemini, never()).generate(any());
        verify(metrics).recordGenerationLatency(eq("openai"), any());
    }

    @Test
    void generate_retryableFailure_fallsBackToSecondary() {
        when(openai.generate(prompt)).thenThrow(failure("openai", GenerationFailureKind.RATE_LIMITED));
        when(gemini.generate(prompt)).thenReturn(response("gemini"));

        GenerationOutcome outcome = useCase().generate(prompt, "c1");

        assertEquals("gemini", outcome.response().provider());
        assertTrue(outcome.fallbackUsed());
        assertEquals(1, outcome.failures().size());
        assertEquals("openai", outcome.failures().get(0).provider());
        assertEquals(GenerationFailureKind.RATE_LIMITED, outcome.failures().get(0).kind());
        verify(metrics).incrementGenerationFallback();
        verify(metrics).incrementGenerationError("openai");
    }

    @Test
    void generate_fatalFailure_stopsChainImmediately() {
        GenerationProviderException fatal = failure("openai", GenerationFailureKind.MALFORMED_REQUEST);
        when(openai.generate(prompt)).thenThrow(fatal);

        GenerationProviderException thrown = assertThrows(GenerationProviderException.class,
                () -> useCase().generate(prompt, "c1"));

        assertSame(fatal, thrown);
        verify(gemini, never()).generate(any());
    }

    @Test
    void generate_unavailableProvider_isSkippedWithoutFailure() {
        when(openai.isAvailable()).thenReturn(false);
        when(gemini.generate(prompt)).thenReturn(response("gemini"));

        GenerationOutcome outcome = useCase().generate(prompt, "c1");

        assertEquals("gemini", outcome.response().provider());
        assertFalse(outcome.fallbackUsed());
        verify(openai, never()).generate(any());
    }

    @Test
    void generate_allFail_throwsExhaustedWithEveryFailure() {
        when(openai.generate(prompt)).thenThrow(failure("openai", GenerationFailureKind.SERVER_ERROR));
        when(gemini.generate(prompt)).thenThrow(failure("gemini", GenerationFailureKind.NETWORK));

        GenerationChainExhaustedException thrown = assertThrows(GenerationChainExhaustedException.class,
                () -> useCase().generate(prompt, "c9"));

        assertEquals("c9", thrown.getCorrelationId());
        assertEquals(List.of("openai", "gemini"), thrown.getFailures().stream().map(f -> f.provider()).toList());
    }

    @Test
    void generate_forcedProvider_skipsRestOfChain() {
        when(gemini.generate(prompt)).thenReturn(response("gemini"));

        GenerationOutcome outcome = useCase().generate(prompt, "gemini", "c1");

        assertEquals("gemini", outcome.response().provider());
        verify(openai, never()).generate(any());
    }

    @Test
    void failureKind_classifiesHttpStatuses() {
        assertEquals(GenerationFailureKind.UNAUTHORIZED, GenerationFailureKind.fromStatus(401));
        assertEquals(GenerationFailureKind.UNAUTHORIZED, GenerationFailureKind.fromStatus(403));
        assertEquals(GenerationFailureKind.RATE_LIMITED, GenerationFailureKind.fromStatus(429));
        assertEquals(GenerationFailureKind.SERVER_ERROR, GenerationFailureKind.fromStatus(503));
        assertEquals(GenerationFailureKind.MALFORMED_REQUEST, GenerationFailureKind.fromStatus(400));
        assertFalse(GenerationFailureKind.MALFORMED_REQUEST.isRetryable());
        assertTrue(GenerationFailureKind.NOT_CONFIGURED.isRetryable());
    }

    private GenerationFallbackUseCase useCase() {
        GenerationPolicy policy = () -> ProviderChain.of("openai", "gemini");
        return new GenerationFallbackUseCase(List.of(openai, gemini), policy, metrics);
    }

    private GenerationResponse response(String provider) {
        return new GenerationResponse("reply from " + provider, provider + "-model", provider, new TokenUsage(3, 4));
    }

    private GenerationProviderException failure(String provider, GenerationFailureKind kind) {
        return new GenerationProviderException(provider, kind, provider + " failed");
    }
}
