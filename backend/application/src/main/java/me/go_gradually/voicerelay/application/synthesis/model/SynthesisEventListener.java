package me.go_gradually.voicerelay.application.synthesis.model;

import me.go_gradually.voicerelay.domain.audio.AudioFrame;

public interface SynthesisEventListener {
    /**
     * @return false when the frame could not be delivered; the stream stops as if cancelled.
     */
    boolean onFrame(AudioFrame frame, String provider);

    void onProviderSwitched(String from, String to);
}
