package me.go_gradually.voicerelay.infrastructure.synthesis.elevenlabs;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.domain.audio.AudioCodecs;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import me.go_gradually.voicerelay.infrastructure.synthesis.stream.HttpAudioBridge;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

@Component
public class ElevenLabsSynthesisProvider implements SynthesisProvider {
    public static final String NAME = "elevenlabs";

    private static final Logger log = Logger.getLogger(ElevenLabsSynthesisProvider.class.getName());

    private final WebClient webClient;
    private final AppProperties.SpeechProvider settings;

    public ElevenLabsSynthesisProvider(@Qualifier("elevenLabsWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getElevenlabs();
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
    public FrameStream stream(SynthesisCommand command) {
        if (!isAvailable()) {
            throw new SynthesisProviderException(NAME, "ElevenLabs not configured (requires API key + voice_id)");
        }
        log.fine(() -> "synthesis.elevenlabs request correlationId=" + command.correlationId()
                + " voiceIdLength=" + settings.getVoiceId().length());

        Flux<DataBuffer> body = webClient.post()
                .uri("/v1/text-to-speech/{voiceId}/stream", settings.getVoiceId())
                .header("xi-api-key", settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.valueOf("audio/mpeg"))
                .bodyValue(payload(command))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> HttpAudioBridge.toFailure(NAME, "ElevenLabs", response))
                .bodyToFlux(DataBuffer.class);

        return HttpAudioBridge.open(NAME, body, null,
                AudioCodecs.MP3, AudioCodecs.MP3_SAMPLE_RATE_HZ, AudioCodecs.MONO);
    }

    private Map<String, Object> payload(SynthesisCommand command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", command.text());
        payload.put("model_id", settings.getModel());
        payload.put("voice_settings", Map.of(
                "stability", 0.5,
                "similarity_boost", 0.75
        ));
        return payload;
    }
}
