package me.go_gradually.voicerelay.application.relay.model;

import me.go_gradually.voicerelay.domain.audio.AudioFrame;

public record AudioFrameEvent(AudioFrame frame) implements RelayEvent {
    public static final String TYPE = "audio.frame";

    @Override
    public String type() {
        return TYPE;
    }
}
