package me.go_gradually.voicerelay.application.synthesis.model;

public enum FallbackStatus {
    COMPLETED,
    EXHAUSTED,
    CANCELLED
}
