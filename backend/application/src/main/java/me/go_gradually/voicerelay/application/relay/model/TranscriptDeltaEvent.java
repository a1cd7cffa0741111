package me.go_gradually.voicerelay.application.relay.model;

public record TranscriptDeltaEvent(String text, boolean isFinal) implements RelayEvent {
    public static final String TYPE = "transcript.delta";

    @Override
    public String type() {
        return TYPE;
    }
}
