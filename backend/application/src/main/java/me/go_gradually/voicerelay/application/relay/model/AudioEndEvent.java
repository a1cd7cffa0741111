package me.go_gradually.voicerelay.application.relay.model;

public record AudioEndEvent(long totalFrames, String provider, String codec, Integer sampleRateHz, Integer channels, String correlationId) implements RelayEvent {
    public static final String TYPE = "audio.end";

    @Override
    public String type() {
        return TYPE;
    }
}
