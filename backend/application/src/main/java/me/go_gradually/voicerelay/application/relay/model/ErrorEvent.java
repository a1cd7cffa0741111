package me.go_gradually.voicerelay.application.relay.model;

import me.go_gradually.voicerelay.domain.relay.RelayErrorCode;

public record ErrorEvent(RelayErrorCode code, String message) implements RelayEvent {
    public static final String TYPE = "error";

    @Override
    public String type() {
        return TYPE;
    }
}
