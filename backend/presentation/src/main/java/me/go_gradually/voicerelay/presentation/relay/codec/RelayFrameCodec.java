package me.go_gradually.voicerelay.presentation.relay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicerelay.application.relay.model.AudioEndEvent;
import me.go_gradually.voicerelay.application.relay.model.AudioFrameEvent;
import me.go_gradually.voicerelay.application.relay.model.ConnectedEvent;
import me.go_gradually.voicerelay.application.relay.model.ErrorEvent;
import me.go_gradually.voicerelay.application.relay.model.PingCommand;
import me.go_gradually.voicerelay.application.relay.model.ProviderSwitchedEvent;
import me.go_gradually.voicerelay.application.relay.model.RelayCommand;
import me.go_gradually.voicerelay.application.relay.model.RelayEvent;
import me.go_gradually.voicerelay.application.relay.model.SessionBindCommand;
import me.go_gradually.voicerelay.application.relay.model.SessionBoundEvent;
import me.go_gradually.voicerelay.application.relay.model.SpeakCommand;
import me.go_gradually.voicerelay.application.relay.model.TranscriptDeltaEvent;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format of the relay socket.
 * <p>
 * Decoding never throws: malformed input comes back as a {@link DecodedFrame} carrying the
 * client-facing error text. Encoding writes a flat object with {@code type}, snake_case fields and an
 * ISO-8601 {@code timestamp}; optional fields without a value are left out.
 */
@Component
public class RelayFrameCodec {
    static final String INVALID_JSON = "Invalid JSON";
    static final String MISSING_TYPE = "Missing message type";
    static final String BIND_FIELDS_REQUIRED = "session.bind requires user_id and session_id";
    static final String SPEAK_TEXT_REQUIRED = "assistant.speak requires text string";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public RelayFrameCodec() {
        this(Clock.systemUTC());
    }

    RelayFrameCodec(Clock clock) {
        this.clock = clock;
    }

    public DecodedFrame decode(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            return DecodedFrame.failure(INVALID_JSON);
        }
        if (root == null || root.isMissingNode()) {
            return DecodedFrame.failure(INVALID_JSON);
        }

        String type = readString(root, "type");
        if (type == null || type.isEmpty()) {
            return DecodedFrame.failure(MISSING_TYPE);
        }

        switch (type) {
            case SessionBindCommand.TYPE -> {
                String userId = readString(root, "user_id");
                String sessionId = readString(root, "session_id");
                if (isBlank(userId) || isBlank(sessionId)) {
                    return DecodedFrame.failure(BIND_FIELDS_REQUIRED);
                }
                return DecodedFrame.success(new SessionBindCommand(userId, sessionId));
            }
            case SpeakCommand.TYPE -> {
                String text = readString(root, "text");
                if (isBlank(text)) {
                    return DecodedFrame.failure(SPEAK_TEXT_REQUIRED);
                }
                return DecodedFrame.success(new SpeakCommand(
                        text,
                        readString(root, "voice_provider"),
                        readStringList(root, "tts_disable"),
                        readString(root, "correlation_id")
                ));
            }
            case PingCommand.TYPE -> {
                return DecodedFrame.success(new PingCommand());
            }
            default -> {
                return DecodedFrame.failure("Unknown message type: " + type);
            }
        }
    }

    public String encode(RelayEvent event) throws JsonProcessingException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.type());
        if (event instanceof ConnectedEvent connected) {
            message.put("version", connected.version());
        } else if (event instanceof SessionBoundEvent bound) {
            message.put("user_id", bound.userId());
            message.put("session_id", bound.sessionId());
        } else if (event instanceof TranscriptDeltaEvent delta) {
            message.put("text", delta.text());
            message.put("is_final", delta.isFinal());
        } else if (event instanceof AudioFrameEvent frameEvent) {
            AudioFrame frame = frameEvent.frame();
            message.put("data_b64", Base64.getEncoder().encodeToString(frame.data()));
            message.put("codec", frame.codec());
            message.put("seq", frame.seq());
            message.put("sample_rate_hz", frame.sampleRateHz());
            message.put("channels", frame.channels());
        } else if (event instanceof AudioEndEvent end) {
            message.put("total_frames", end.totalFrames());
            message.put("provider", end.provider());
            putIfPresent(message, "codec", end.codec());
            putIfPresent(message, "sample_rate_hz", end.sampleRateHz());
            putIfPresent(message, "channels", end.channels());
            putIfPresent(message, "correlation_id", end.correlationId());
        } else if (event instanceof ProviderSwitchedEvent switched) {
            message.put("from", switched.from());
            message.put("to", switched.to());
            putIfPresent(message, "correlation_id", switched.correlationId());
        } else if (event instanceof ErrorEvent error) {
            message.put("code", error.code().name());
            message.put("message", error.message() == null ? "" : error.message());
        }
        message.put("timestamp", Instant.now(clock).toString());
        return objectMapper.writeValueAsString(message);
    }

    private void putIfPresent(Map<String, Object> message, String key, Object value) {
        if (value != null) {
            message.put(key, value);
        }
    }

    private String readString(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private List<String> readStringList(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record DecodedFrame(RelayCommand command, String error) {
        static DecodedFrame success(RelayCommand command) {
            return new DecodedFrame(command, null);
        }

        static DecodedFrame failure(String error) {
            return new DecodedFrame(null, error);
        }

        public boolean isValid() {
            return command != null;
        }
    }
}
