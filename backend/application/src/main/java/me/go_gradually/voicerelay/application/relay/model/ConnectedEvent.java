package me.go_gradually.voicerelay.application.relay.model;

public record ConnectedEvent(String version) implements RelayEvent {
    public static final String TYPE = "connected";

    @Override
    public String type() {
        return TYPE;
    }
}
