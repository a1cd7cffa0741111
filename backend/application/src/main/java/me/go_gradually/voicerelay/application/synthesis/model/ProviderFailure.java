package me.go_gradually.voicerelay.application.synthesis.model;

import java.time.Duration;

public record ProviderFailure(String provider, String message, Duration elapsed) {
}
