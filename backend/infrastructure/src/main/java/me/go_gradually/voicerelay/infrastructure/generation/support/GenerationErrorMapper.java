package me.go_gradually.voicerelay.infrastructure.generation.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.generation.model.GenerationFailureKind;
import me.go_gradually.voicerelay.application.generation.model.GenerationProviderException;
import me.go_gradually.voicerelay.application.shared.log.ProviderLogRedactor;
import me.go_gradually.voicerelay.domain.util.TextUtils;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Translates WebClient failures into {@link GenerationProviderException} with a classified kind.
 */
public final class GenerationErrorMapper {
    private static final int ERROR_BODY_MAX_CHARS = 200;
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private GenerationErrorMapper() {
    }

    public static GenerationProviderException map(String provider, String label, RuntimeException error) {
        if (error instanceof GenerationProviderException providerException) {
            return providerException;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            String detail = resolveErrorMessage(response.getResponseBodyAsString());
            return new GenerationProviderException(provider, GenerationFailureKind.fromStatus(status), status,
                    label + " API error: " + status + " - " + detail, error);
        }
        if (error instanceof WebClientRequestException) {
            return new GenerationProviderException(provider, GenerationFailureKind.NETWORK, null,
                    label + " network error: " + ProviderLogRedactor.describe(error), error);
        }
        return new GenerationProviderException(provider, GenerationFailureKind.INVALID_RESPONSE, null,
                label + " request failed: " + ProviderLogRedactor.describe(error), error);
    }

    public static GenerationProviderException invalidResponse(String provider, String message) {
        return new GenerationProviderException(provider, GenerationFailureKind.INVALID_RESPONSE, message);
    }

    public static GenerationProviderException notConfigured(String provider, String message) {
        return new GenerationProviderException(provider, GenerationFailureKind.NOT_CONFIGURED, message);
    }

    static String resolveErrorMessage(String body) {
        if (TextUtils.isBlank(body)) {
            return "empty body";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return ProviderLogRedactor.redact(message.asText());
            }
        } catch (Exception e) {
            return ProviderLogRedactor.redact(TextUtils.trimToLength(body, ERROR_BODY_MAX_CHARS));
        }
        return ProviderLogRedactor.redact(TextUtils.trimToLength(body, ERROR_BODY_MAX_CHARS));
    }
}
