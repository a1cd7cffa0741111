package me.go_gradually.voicerelay.application.relay.model;

import java.util.List;

public record SpeakCommand(String text, String voiceProvider, List<String> ttsDisable, String correlationId)
        implements RelayCommand {
    public static final String TYPE = "assistant.speak";

    public SpeakCommand {
        ttsDisable = ttsDisable == null ? List.of() : List.copyOf(ttsDisable);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
