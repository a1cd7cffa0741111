package me.go_gradually.voicerelay.application.shared.log;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderLogRedactorTest {

    @Test
    void redact_masksQueryKeys() {
        String redacted = ProviderLogRedactor.redact(
                "GET wss://api.cartesia.ai/tts/websocket?api_key=abc123&cartesia_version=2024-06-10 failed");

        assertFalse(redacted.contains("abc123"));
        assertTrue(redacted.contains("api_key=***"));
        assertTrue(redacted.contains("cartesia_version=2024-06-10"));
    }

    @Test
    void redact_masksBearerTokensAndKeyHeaders() {
        String redacted = ProviderLogRedactor.redact("401 Bearer sk-live-token xi-api-key: eleven-secret");

        assertFalse(redacted.contains("sk-live-token"));
        assertFalse(redacted.contains("eleven-secret"));
    }

    @Test
    void redact_masksGeminiKeyParameter() {
        String redacted = ProviderLogRedactor.redact("/v1beta/models/gemini-1.5-flash:generateContent?key=AIzaSecretValue123");

        assertFalse(redacted.contains("AIzaSecretValue123"));
    }

    @Test
    void redact_flattensAndCapsLength() {
        String redacted = ProviderLogRedactor.redact("line1\nline2" + "x".repeat(500));

        assertFalse(redacted.contains("\n"));
        assertTrue(redacted.length() < 300);
    }

    @Test
    void describe_fallsBackToExceptionType() {
        assertEquals("IllegalStateException", ProviderLogRedactor.describe(new IllegalStateException()));
        assertEquals("", ProviderLogRedactor.describe(null));
    }
}
