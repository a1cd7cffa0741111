package me.go_gradually.voicerelay.application.relay.model;

public record ProviderSwitchedEvent(String from, String to, String correlationId) implements RelayEvent {
    public static final String TYPE = "provider.switched";

    @Override
    public String type() {
        return TYPE;
    }
}
