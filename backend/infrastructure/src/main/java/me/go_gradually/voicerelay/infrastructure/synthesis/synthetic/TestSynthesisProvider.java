package me.go_gradually.voicerelay.infrastructure.synthesis.synthetic;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.domain.audio.AudioCodecs;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.domain.util.TextUtils;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Deterministic sine-wave synthesizer for local runs and CI. Same text, same frames.
 */
@Component
public class TestSynthesisProvider implements SynthesisProvider {
    public static final String NAME = AppProperties.TEST_PROVIDER;

    static final int FRAME_DURATION_MS = 50;
    static final int SAMPLES_PER_FRAME = AudioCodecs.PCM_SAMPLE_RATE_HZ * FRAME_DURATION_MS / 1000;
    static final int BYTES_PER_FRAME = SAMPLES_PER_FRAME * 2;
    private static final int MIN_DURATION_MS = 500;
    private static final int MS_PER_WORD = 100;
    private static final int AMPLITUDE = 16_384;

    private final AppProperties.TestSynthesizer settings;

    public TestSynthesisProvider(AppProperties properties) {
        this.settings = properties.getSynthesis().getTest();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return settings.isEnabled();
    }

    @Override
    public FrameStream stream(SynthesisCommand command) {
        if (!isAvailable()) {
            throw new SynthesisProviderException(NAME, "Test synthesizer not enabled");
        }
        return new SineFrameStream(command.text(), settings.getFrameDelayMs());
    }

    static int frameCount(String text) {
        int durationMs = Math.max(MIN_DURATION_MS, TextUtils.countWords(text) * MS_PER_WORD);
        return (durationMs + FRAME_DURATION_MS - 1) / FRAME_DURATION_MS;
    }

    static int frequencyHz(String text) {
        int sum = 0;
        for (int i = 0; i < text.length(); i++) {
            sum += text.charAt(i);
        }
        return 200 + (sum % 400);
    }

    private static final class SineFrameStream implements FrameStream {
        private final int totalFrames;
        private final int frequencyHz;
        private final long frameDelayMs;
        private final CountDownLatch closed = new CountDownLatch(1);
        private int emitted;

        private SineFrameStream(String text, long frameDelayMs) {
            this.totalFrames = frameCount(text);
            this.frequencyHz = frequencyHz(text);
            this.frameDelayMs = frameDelayMs;
        }

        @Override
        public boolean hasNext() {
            return emitted < totalFrames && closed.getCount() > 0;
        }

        @Override
        public AudioFrame next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            pace();
            byte[] pcm = sine(emitted * (long) SAMPLES_PER_FRAME);
            emitted++;
            return AudioFrame.of(pcm, AudioCodecs.PCM_16000, AudioCodecs.PCM_SAMPLE_RATE_HZ, AudioCodecs.MONO);
        }

        @Override
        public void close() {
            closed.countDown();
        }

        private void pace() {
            if (frameDelayMs <= 0) {
                return;
            }
            try {
                closed.await(frameDelayMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SynthesisProviderException(NAME, "Interrupted while pacing frames", e);
            }
        }

        private byte[] sine(long sampleOffset) {
            byte[] pcm = new byte[BYTES_PER_FRAME];
            for (int i = 0; i < SAMPLES_PER_FRAME; i++) {
                double t = (double) (sampleOffset + i) / AudioCodecs.PCM_SAMPLE_RATE_HZ;
                short sample = (short) Math.floor(AMPLITUDE * Math.sin(2 * Math.PI * frequencyHz * t));
                pcm[i * 2] = (byte) (sample & 0xff);
                pcm[i * 2 + 1] = (byte) ((sample >> 8) & 0xff);
            }
            return pcm;
        }
    }
}
