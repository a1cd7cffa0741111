package me.go_gradually.voicerelay.application.relay.model;

public record SessionBoundEvent(String userId, String sessionId) implements RelayEvent {
    public static final String TYPE = "session.bound";

    @Override
    public String type() {
        return TYPE;
    }
}
