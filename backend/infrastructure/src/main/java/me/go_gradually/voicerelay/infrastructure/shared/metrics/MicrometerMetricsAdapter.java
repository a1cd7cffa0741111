package me.go_gradually.voicerelay.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private static final String PROVIDER_TAG = "provider";

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSynthesisLatency(String provider, Duration duration) {
        record("synthesis.latency", provider, duration);
    }

    @Override
    public void recordGenerationLatency(String provider, Duration duration) {
        record("generation.latency", provider, duration);
    }

    @Override
    public void recordSynthesisFrames(String provider, long frames) {
        meterRegistry.counter("synthesis.frames", PROVIDER_TAG, provider).increment(frames);
    }

    @Override
    public void incrementSynthesisFallback() {
        meterRegistry.counter("synthesis.fallbacks").increment();
    }

    @Override
    public void incrementSynthesisError(String provider) {
        meterRegistry.counter("synthesis.errors", PROVIDER_TAG, provider).increment();
    }

    @Override
    public void incrementGenerationFallback() {
        meterRegistry.counter("generation.fallbacks").increment();
    }

    @Override
    public void incrementGenerationError(String provider) {
        meterRegistry.counter("generation.errors", PROVIDER_TAG, provider).increment();
    }

    @Override
    public void incrementRelayConnection() {
        meterRegistry.counter("relay.connections").increment();
    }

    private void record(String name, String provider, Duration duration) {
        Timer.builder(name)
                .tag(PROVIDER_TAG, provider)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
