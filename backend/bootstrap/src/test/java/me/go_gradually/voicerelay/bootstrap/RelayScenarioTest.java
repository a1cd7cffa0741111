package me.go_gradually.voicerelay.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.go_gradually.voicerelay.application.relay.usecase.RelayConnectionUseCase;
import me.go_gradually.voicerelay.application.synthesis.usecase.SynthesisFallbackUseCase;
import me.go_gradually.voicerelay.domain.conversation.ConversationMessage;
import me.go_gradually.voicerelay.infrastructure.conversation.store.InMemoryMessageStore;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import me.go_gradually.voicerelay.infrastructure.shared.metrics.MicrometerMetricsAdapter;
import me.go_gradually.voicerelay.infrastructure.synthesis.cartesia.CartesiaSynthesisProvider;
import me.go_gradually.voicerelay.infrastructure.synthesis.synthetic.TestSynthesisProvider;
import me.go_gradually.voicerelay.presentation.relay.codec.RelayFrameCodec;
import me.go_gradually.voicerelay.presentation.relay.websocket.RelayWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelayScenarioTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<JsonNode> received = new ArrayList<>();

    @Mock
    private WebSocketSession webSocketSession;

    private InMemoryMessageStore messageStore;
    private RelayWebSocketHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        AppProperties properties = new AppProperties();
        properties.getSynthesis().getTest().setEnabled(true);
        properties.getSynthesis().getTest().setFrameDelayMs(0);

        MicrometerMetricsAdapter metrics = new MicrometerMetricsAdapter(new SimpleMeterRegistry());
        SynthesisFallbackUseCase synthesis = new SynthesisFallbackUseCase(
                List.of(new CartesiaSynthesisProvider(properties), new TestSynthesisProvider(properties)),
                properties,
                metrics
        );
        messageStore = new InMemoryMessageStore();
        RelayConnectionUseCase relay = new RelayConnectionUseCase(synthesis, messageStore, Runnable::run, metrics);
        handler = new RelayWebSocketHandler(relay, new RelayFrameCodec());

        when(webSocketSession.getId()).thenReturn("ws-1");
        when(webSocketSession.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            WebSocketMessage<?> message = invocation.getArgument(0);
            received.add(objectMapper.readTree((String) message.getPayload()));
            return null;
        }).when(webSocketSession).sendMessage(any());
    }

    @Test
    void bindThenSpeak_streamsTestFramesAndEndsOnce() throws Exception {
        handler.afterConnectionEstablished(webSocketSession);
        handler.handleMessage(webSocketSession, new TextMessage("{\"type\":\"session.bind\",\"user_id\":\"u1\",\"session_id\":\"s1\"}"));
        handler.handleMessage(webSocketSession, new TextMessage("{\"type\":\"assistant.speak\",\"text\":\"hello\",\"correlation_id\":\"c-1\"}"));

        assertEquals("connected", received.get(0).path("type").asText());
        assertEquals("1.0.0", received.get(0).path("version").asText());
        JsonNode bound = received.get(1);
        assertEquals("session.bound", bound.path("type").asText());
        assertEquals("u1", bound.path("user_id").asText());
        assertEquals("s1", bound.path("session_id").asText());
        assertEquals("transcript.delta", received.get(2).path("type").asText());
        assertTrue(received.get(2).path("is_final").asBoolean());

        List<JsonNode> frames = ofType("audio.frame");
        assertTrue(frames.size() >= 1);
        for (int i = 0; i < frames.size(); i++) {
            assertEquals(i, frames.get(i).path("seq").asLong());
            assertEquals("pcm_16000", frames.get(i).path("codec").asText());
        }
        List<JsonNode> ends = ofType("audio.end");
        assertEquals(1, ends.size());
        assertEquals("test", ends.get(0).path("provider").asText());
        assertEquals(frames.size(), ends.get(0).path("total_frames").asInt());
        assertEquals("c-1", ends.get(0).path("correlation_id").asText());
        assertTrue(ofType("provider.switched").isEmpty());
        assertEquals("audio.end", received.get(received.size() - 1).path("type").asText());

        List<ConversationMessage> stored = messageStore.messagesFor("s1");
        assertEquals(1, stored.size());
        assertEquals("hello", stored.get(0).content());
    }

    @Test
    void speakBeforeBind_isRejectedWithoutFrames() throws Exception {
        handler.afterConnectionEstablished(webSocketSession);
        handler.handleMessage(webSocketSession, new TextMessage("{\"type\":\"assistant.speak\",\"text\":\"hello\"}"));

        List<JsonNode> errors = ofType("error");
        assertEquals(1, errors.size());
        assertEquals("NOT_BOUND", errors.get(0).path("code").asText());
        assertTrue(ofType("audio.frame").isEmpty());
    }

    @Test
    void pingAndMalformedMessages_keepConnectionUsable() throws Exception {
        handler.afterConnectionEstablished(webSocketSession);
        handler.handleMessage(webSocketSession, new TextMessage("not json"));
        handler.handleMessage(webSocketSession, new TextMessage("{\"type\":\"ping\"}"));
        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        assertEquals("INVALID_MESSAGE", ofType("error").get(0).path("code").asText());
        assertEquals(1, ofType("pong").size());
    }

    private List<JsonNode> ofType(String type) {
        return received.stream().filter(node -> type.equals(node.path("type").asText())).toList();
    }
}
