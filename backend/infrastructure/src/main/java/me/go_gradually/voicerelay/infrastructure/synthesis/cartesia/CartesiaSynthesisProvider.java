package me.go_gradually.voicerelay.infrastructure.synthesis.cartesia;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.domain.audio.AudioCodecs;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import me.go_gradually.voicerelay.infrastructure.synthesis.stream.QueueFrameStream;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

@Component
public class CartesiaSynthesisProvider implements SynthesisProvider {
    public static final String NAME = "cartesia";

    private static final Logger log = Logger.getLogger(CartesiaSynthesisProvider.class.getName());

    private final AppProperties.SpeechProvider settings;
    private final String cartesiaVersion;
    private final long connectTimeoutMs;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CartesiaSynthesisProvider(AppProperties properties) {
        this.settings = properties.getIntegrations().getCartesia();
        this.cartesiaVersion = properties.getIntegrations().getCartesiaVersion();
        this.connectTimeoutMs = properties.getSynthesis().getConnectTimeoutMs();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
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
            throw new SynthesisProviderException(NAME, "Cartesia not configured (missing API key or voice ID)");
        }
        QueueFrameStream stream = new QueueFrameStream(NAME);
        WebSocket webSocket = connect(new CartesiaListener(stream, objectMapper));
        stream.onDemand(() -> webSocket.request(1));
        stream.onClose(() -> closeQuietly(webSocket));
        try {
            webSocket.sendText(objectMapper.writeValueAsString(payload(command)), true).join();
        } catch (Exception e) {
            stream.close();
            throw new SynthesisProviderException(NAME, "Cartesia request failed: " + describe(e), e);
        }
        log.fine(() -> "synthesis.cartesia request correlationId=" + command.correlationId()
                + " chars=" + command.text().length());
        return stream;
    }

    private WebSocket connect(CartesiaListener listener) {
        CompletableFuture<WebSocket> pending = httpClient.newWebSocketBuilder()
                .header("Cartesia-Version", cartesiaVersion)
                .buildAsync(toWebSocketUri(), listener);
        try {
            return pending.get(connectTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortWhenOpened(pending);
            throw new SynthesisProviderException(NAME, "Cartesia connect interrupted", e);
        } catch (TimeoutException e) {
            abortWhenOpened(pending);
            throw new SynthesisProviderException(NAME, "Cartesia WS connection timeout", e);
        } catch (ExecutionException e) {
            throw new SynthesisProviderException(NAME, "Cartesia WS error: " + describe(e.getCause()), e.getCause());
        }
    }

    // The handshake keeps running after we give up; a late socket must not stay open.
    private static void abortWhenOpened(CompletableFuture<WebSocket> pending) {
        pending.thenAccept(late -> {
            log.fine(() -> "synthesis.cartesia late_connection aborted");
            late.abort();
        });
    }

    private URI toWebSocketUri() {
        String base = settings.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String query = "api_key=" + URLEncoder.encode(settings.getApiKey(), StandardCharsets.UTF_8)
                + "&cartesia_version=" + URLEncoder.encode(cartesiaVersion, StandardCharsets.UTF_8);
        return URI.create(base + "/tts/websocket?" + query);
    }

    private Map<String, Object> payload(SynthesisCommand command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("context_id", UUID.randomUUID().toString());
        payload.put("model_id", settings.getModel());
        payload.put("transcript", command.text());
        payload.put("voice", Map.of("mode", "id", "id", settings.getVoiceId()));
        payload.put("output_format", Map.of(
                "container", "raw",
                "sample_rate", AudioCodecs.PCM_SAMPLE_RATE_HZ,
                "encoding", "pcm_s16le"
        ));
        payload.put("continue", false);
        return payload;
    }

    private static void closeQuietly(WebSocket webSocket) {
        if (webSocket.isOutputClosed()) {
            return;
        }
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "done")
                .exceptionally(error -> {
                    log.fine(() -> "synthesis.cartesia close failure reason=" + describe(error));
                    webSocket.abort();
                    return null;
                });
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static AudioFrame pcmFrame(byte[] data) {
        return AudioFrame.of(data, AudioCodecs.PCM_16000, AudioCodecs.PCM_SAMPLE_RATE_HZ, AudioCodecs.MONO);
    }

    static final class CartesiaListener implements WebSocket.Listener {
        private final QueueFrameStream stream;
        private final ObjectMapper objectMapper;
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();
        private volatile boolean done;

        CartesiaListener(QueueFrameStream stream, ObjectMapper objectMapper) {
            this.stream = stream;
            this.objectMapper = objectMapper;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        // Further messages are requested by the reader's demand once a frame was buffered.
        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            boolean buffered = false;
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                buffered = handleMessage(webSocket, payload);
            }
            requestUnlessBuffered(webSocket, buffered);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            binaryBuffer.write(bytes, 0, bytes.length);
            boolean buffered = false;
            if (last) {
                byte[] frame = binaryBuffer.toByteArray();
                binaryBuffer.reset();
                buffered = frame.length > 0 && stream.push(pcmFrame(frame));
            }
            requestUnlessBuffered(webSocket, buffered);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (statusCode != WebSocket.NORMAL_CLOSURE && !done) {
                stream.fail(new SynthesisProviderException(NAME, "Cartesia WS closed: code=" + statusCode));
            } else {
                stream.complete();
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            stream.fail(new SynthesisProviderException(NAME, "Cartesia WS error: " + describe(error), error));
        }

        private void requestUnlessBuffered(WebSocket webSocket, boolean buffered) {
            if (!buffered && !stream.isFinished()) {
                webSocket.request(1);
            }
        }

        /**
         * @return true when the message buffered an audio frame
         */
        private boolean handleMessage(WebSocket webSocket, String payload) {
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (Exception e) {
                stream.fail(new SynthesisProviderException(NAME, "Cartesia parse error: " + describe(e), e));
                return false;
            }
            String type = root.path("type").asText("");
            if ("chunk".equals(type)) {
                String data = root.path("data").asText("");
                if (data.isEmpty()) {
                    return false;
                }
                try {
                    return stream.push(pcmFrame(Base64.getDecoder().decode(data)));
                } catch (IllegalArgumentException e) {
                    stream.fail(new SynthesisProviderException(NAME, "Cartesia chunk is not valid base64", e));
                }
            } else if ("done".equals(type)) {
                done = true;
                stream.complete();
                closeQuietly(webSocket);
            } else if ("error".equals(type) || root.hasNonNull("error")) {
                String message = root.path("message").asText(root.path("error").asText("Unknown Cartesia error"));
                log.fine(() -> "synthesis.cartesia upstream_error type=" + type);
                stream.fail(new SynthesisProviderException(NAME, "Cartesia: " + message));
            }
            return false;
        }
    }
}
