package me.go_gradually.voicerelay.application.relay.model;

import me.go_gradually.voicerelay.domain.relay.ConnectionState;
import me.go_gradually.voicerelay.domain.relay.RelayErrorCode;

public interface RelaySession {
    String connectionId();

    ConnectionState state();

    void bind(SessionBindCommand command);

    void speak(SpeakCommand command);

    void ping();

    void reject(RelayErrorCode code, String message);

    void close();
}
