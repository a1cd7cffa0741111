package me.go_gradually.voicerelay.application.generation.model;

import java.time.Duration;

public record GenerationFailure(String provider, GenerationFailureKind kind, String message, Duration elapsed) {
}
