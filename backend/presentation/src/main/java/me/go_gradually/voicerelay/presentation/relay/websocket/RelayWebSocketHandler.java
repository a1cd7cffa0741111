package me.go_gradually.voicerelay.presentation.relay.websocket;

import me.go_gradually.voicerelay.application.relay.model.ErrorEvent;
import me.go_gradually.voicerelay.application.relay.model.RelayCommand;
import me.go_gradually.voicerelay.application.relay.model.RelayEvent;
import me.go_gradually.voicerelay.application.relay.model.RelaySession;
import me.go_gradually.voicerelay.application.relay.model.SessionBindCommand;
import me.go_gradually.voicerelay.application.relay.model.SpeakCommand;
import me.go_gradually.voicerelay.application.relay.usecase.RelayConnectionUseCase;
import me.go_gradually.voicerelay.domain.relay.RelayErrorCode;
import me.go_gradually.voicerelay.presentation.relay.codec.RelayFrameCodec;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {
    static final int MESSAGE_SIZE_LIMIT = 1_048_576;
    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final String INTERNAL_ERROR_MESSAGE = "An error occurred processing your request";

    private static final Logger log = Logger.getLogger(RelayWebSocketHandler.class.getName());

    private final RelayConnectionUseCase relayConnectionUseCase;
    private final RelayFrameCodec codec;
    private final Map<String, RelaySession> sessionBySocketId = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(RelayConnectionUseCase relayConnectionUseCase, RelayFrameCodec codec) {
        this.relayConnectionUseCase = relayConnectionUseCase;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        rawSession.setTextMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, MESSAGE_SIZE_LIMIT);
        try {
            RelaySession relaySession = relayConnectionUseCase.open(session.getId(), event -> sendEvent(session, event));
            sessionBySocketId.put(session.getId(), relaySession);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "relay.socket open failure socketId=" + rawSession.getId(), e);
            sendEvent(session, new ErrorEvent(RelayErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        RelaySession relaySession = sessionBySocketId.get(session.getId());
        if (relaySession == null) {
            sendEvent(session, new ErrorEvent(RelayErrorCode.INTERNAL_ERROR, "Unknown relay connection"));
            return;
        }

        RelayFrameCodec.DecodedFrame decoded = codec.decode(message.getPayload());
        if (!decoded.isValid()) {
            log.fine(() -> "relay.socket invalid message socketId=" + session.getId() + " error=" + decoded.error());
            relaySession.reject(RelayErrorCode.INVALID_MESSAGE, decoded.error());
            return;
        }

        try {
            dispatch(relaySession, decoded.command());
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "relay.socket dispatch failure socketId=" + session.getId()
                    + " type=" + decoded.command().type(), e);
            relaySession.reject(RelayErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warning(() -> "relay.socket transport error socketId=" + session.getId()
                + " error=" + (exception == null ? "unknown" : exception.getMessage()));
        closeRelaySession(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.fine(() -> "relay.socket closed socketId=" + session.getId() + " status=" + status.getCode());
        closeRelaySession(session);
    }

    private void dispatch(RelaySession relaySession, RelayCommand command) {
        if (command instanceof SessionBindCommand bind) {
            relaySession.bind(bind);
        } else if (command instanceof SpeakCommand speak) {
            relaySession.speak(speak);
        } else {
            relaySession.ping();
        }
    }

    private void closeRelaySession(WebSocketSession session) {
        RelaySession relaySession = sessionBySocketId.remove(session.getId());
        if (relaySession != null) {
            relaySession.close();
        }
    }

    private boolean sendEvent(WebSocketSession session, RelayEvent event) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(event)));
            return true;
        } catch (Exception e) {
            log.fine(() -> "relay.socket send failure socketId=" + session.getId()
                    + " type=" + event.type() + " error=" + e.getMessage());
            return false;
        }
    }
}
