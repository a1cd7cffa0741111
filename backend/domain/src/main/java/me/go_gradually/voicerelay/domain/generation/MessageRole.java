package me.go_gradually.voicerelay.domain.generation;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Message role is required");
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
