package me.go_gradually.voicerelay.application.relay.model;

public record SessionBindCommand(String userId, String sessionId) implements RelayCommand {
    public static final String TYPE = "session.bind";

    @Override
    public String type() {
        return TYPE;
    }
}
