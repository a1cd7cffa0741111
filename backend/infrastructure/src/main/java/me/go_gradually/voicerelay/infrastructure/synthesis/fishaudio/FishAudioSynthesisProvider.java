package me.go_gradually.voicerelay.infrastructure.synthesis.fishaudio;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.domain.audio.AudioCodecs;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import me.go_gradually.voicerelay.infrastructure.synthesis.stream.ByteRechunker;
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
public class FishAudioSynthesisProvider implements SynthesisProvider {
    public static final String NAME = "fishaudio";

    private static final Logger log = Logger.getLogger(FishAudioSynthesisProvider.class.getName());

    private final WebClient webClient;
    private final AppProperties.SpeechProvider settings;

    public FishAudioSynthesisProvider(@Qualifier("fishAudioWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getIntegrations().getFishaudio();
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
            throw new SynthesisProviderException(NAME, "Fish Audio not configured (missing API key or voice ID)");
        }
        log.fine(() -> "synthesis.fishaudio request correlationId=" + command.correlationId()
                + " chars=" + command.text().length());

        Flux<DataBuffer> body = webClient.post()
                .uri("/v1/tts")
                .header("Authorization", "Bearer " + settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.valueOf("audio/mpeg"))
                .bodyValue(payload(command))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> HttpAudioBridge.toFailure(NAME, "Fish Audio", response))
                .bodyToFlux(DataBuffer.class);

        return HttpAudioBridge.open(NAME, body, new ByteRechunker(),
                AudioCodecs.MP3, AudioCodecs.MP3_SAMPLE_RATE_HZ, AudioCodecs.MONO);
    }

    private Map<String, Object> payload(SynthesisCommand command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", command.text());
        payload.put("reference_id", settings.getVoiceId());
        payload.put("format", AudioCodecs.MP3);
        payload.put("latency", "normal");
        return payload;
    }
}
