package me.go_gradually.voicerelay.application.synthesis.model;

import me.go_gradually.voicerelay.domain.audio.AudioFrame;

import java.util.Iterator;

/**
 * Ordered frames from one provider attempt. {@link #close()} may be called from another thread and must
 * unblock a reader waiting in {@link #hasNext()}.
 */
public interface FrameStream extends Iterator<AudioFrame>, AutoCloseable {
    @Override
    void close();
}
