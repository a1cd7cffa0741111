package me.go_gradually.voicerelay.infrastructure.synthesis.synthetic;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.domain.audio.AudioCodecs;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestSynthesisProviderTest {

    private AppProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getSynthesis().getTest().setEnabled(true);
        properties.getSynthesis().getTest().setFrameDelayMs(0);
    }

    @Test
    void stream_shortText_yieldsHalfSecondOfPcm() {
        List<AudioFrame> frames = collect("hello");

        assertEquals(10, frames.size());
        for (AudioFrame frame : frames) {
            assertEquals(AudioCodecs.PCM_16000, frame.codec());
            assertEquals(16_000, frame.sampleRateHz());
            assertEquals(1, frame.channels());
            assertEquals(1600, frame.size());
        }
    }

    @Test
    void stream_durationScalesWithWordCount() {
        assertEquals(12, TestSynthesisProvider.frameCount("one two three four five six"));
        assertEquals(10, TestSynthesisProvider.frameCount("  "));
    }

    @Test
    void stream_sameText_isDeterministic() {
        List<AudioFrame> first = collect("good morning relay");
        List<AudioFrame> second = collect("good morning relay");

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(first.get(i).data(), second.get(i).data());
        }
        int frequency = TestSynthesisProvider.frequencyHz("good morning relay");
        assertTrue(frequency >= 200 && frequency < 600);
    }

    @Test
    void close_stopsIteration() {
        FrameStream stream = provider().stream(new SynthesisCommand("hello", "c1"));
        stream.next();

        stream.close();

        assertFalse(stream.hasNext());
    }

    @Test
    void disabled_isUnavailableAndRefusesToStream() {
        properties.getSynthesis().getTest().setEnabled(false);
        TestSynthesisProvider provider = provider();

        assertFalse(provider.isAvailable());
        assertThrows(SynthesisProviderException.class, () -> provider.stream(new SynthesisCommand("hello", "c1")));
    }

    private List<AudioFrame> collect(String text) {
        List<AudioFrame> frames = new ArrayList<>();
        try (FrameStream stream = provider().stream(new SynthesisCommand(text, "c1"))) {
            stream.forEachRemaining(frames::add);
        }
        return frames;
    }

    private TestSynthesisProvider provider() {
        return new TestSynthesisProvider(properties);
    }
}
