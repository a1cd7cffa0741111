package me.go_gradually.voicerelay.application.relay.model;

public record PongEvent() implements RelayEvent {
    public static final String TYPE = "pong";

    @Override
    public String type() {
        return TYPE;
    }
}
