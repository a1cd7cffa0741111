package me.go_gradually.voicerelay.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordSynthesisLatency(String provider, Duration duration);

    void recordGenerationLatency(String provider, Duration duration);

    void recordSynthesisFrames(String provider, long frames);

    void incrementSynthesisFallback();

    void incrementSynthesisError(String provider);

    void incrementGenerationFallback();

    void incrementGenerationError(String provider);

    void incrementRelayConnection();
}
