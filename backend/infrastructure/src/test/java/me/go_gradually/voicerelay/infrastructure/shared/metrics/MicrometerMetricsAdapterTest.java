package me.go_gradually.voicerelay.infrastructure.shared.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MicrometerMetricsAdapterTest {

    @Test
    void recordsProviderTimersAndCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(registry);

        adapter.recordSynthesisLatency("fishaudio", Duration.ofMillis(10));
        adapter.recordSynthesisLatency("cartesia", Duration.ofMillis(15));
        adapter.recordGenerationLatency("openai", Duration.ofMillis(20));
        adapter.recordSynthesisFrames("fishaudio", 12);
        adapter.incrementSynthesisFallback();
        adapter.incrementSynthesisError("fishaudio");
        adapter.incrementGenerationFallback();
        adapter.incrementGenerationError("gemini");
        adapter.incrementRelayConnection();
        adapter.incrementRelayConnection();

        assertNotNull(registry.find("synthesis.latency").tag("provider", "fishaudio").timer());
        assertEquals(1, registry.find("synthesis.latency").tag("provider", "cartesia").timer().count());
        assertEquals(1, registry.find("generation.latency").tag("provider", "openai").timer().count());

        assertEquals(12.0, registry.find("synthesis.frames").tag("provider", "fishaudio").counter().count());
        assertEquals(1.0, registry.find("synthesis.fallbacks").counter().count());
        assertEquals(1.0, registry.find("synthesis.errors").tag("provider", "fishaudio").counter().count());
        assertEquals(1.0, registry.find("generation.fallbacks").counter().count());
        assertEquals(1.0, registry.find("generation.errors").tag("provider", "gemini").counter().count());
        assertEquals(2.0, registry.find("relay.connections").counter().count());
    }
}
