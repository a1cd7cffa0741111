package me.go_gradually.voicerelay.domain.audio;

public final class AudioCodecs {
    public static final String PCM_16000 = "pcm_16000";
    public static final String MP3 = "mp3";

    public static final int PCM_SAMPLE_RATE_HZ = 16_000;
    public static final int MP3_SAMPLE_RATE_HZ = 44_100;
    public static final int MONO = 1;

    private AudioCodecs() {
    }
}
