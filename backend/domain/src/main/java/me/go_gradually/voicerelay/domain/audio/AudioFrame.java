package me.go_gradually.voicerelay.domain.audio;

public record AudioFrame(byte[] data, long seq, String codec, int sampleRateHz, int channels) {
    public AudioFrame {
        if (data == null) {
            throw new IllegalArgumentException("Frame data is required");
        }
        if (seq < 0) {
            throw new IllegalArgumentException("Frame seq must be >= 0");
        }
        if (codec == null || codec.isBlank()) {
            throw new IllegalArgumentException("Frame codec is required");
        }
        if (sampleRateHz <= 0 || channels <= 0) {
            throw new IllegalArgumentException("Frame sample rate and channels must be positive");
        }
    }

    public static AudioFrame of(byte[] data, String codec, int sampleRateHz, int channels) {
        return new AudioFrame(data, 0, codec, sampleRateHz, channels);
    }

    public AudioFrame withSeq(long nextSeq) {
        return new AudioFrame(data, nextSeq, codec, sampleRateHz, channels);
    }

    public int size() {
        return data.length;
    }
}
