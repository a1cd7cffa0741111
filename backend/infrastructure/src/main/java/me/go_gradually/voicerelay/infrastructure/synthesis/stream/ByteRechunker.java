package me.go_gradually.voicerelay.infrastructure.synthesis.stream;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Regroups arbitrary upstream byte chunks into fixed-size frames. Not thread-safe.
 */
public final class ByteRechunker {
    public static final int DEFAULT_FRAME_BYTES = 4096;

    private final int frameBytes;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public ByteRechunker() {
        this(DEFAULT_FRAME_BYTES);
    }

    public ByteRechunker(int frameBytes) {
        if (frameBytes <= 0) {
            throw new IllegalArgumentException("frameBytes must be positive");
        }
        this.frameBytes = frameBytes;
    }

    public List<byte[]> accept(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        pending.write(chunk, 0, chunk.length);
        if (pending.size() < frameBytes) {
            return List.of();
        }
        byte[] buffered = pending.toByteArray();
        pending.reset();
        List<byte[]> frames = new ArrayList<>();
        int offset = 0;
        while (buffered.length - offset >= frameBytes) {
            frames.add(Arrays.copyOfRange(buffered, offset, offset + frameBytes));
            offset += frameBytes;
        }
        pending.write(buffered, offset, buffered.length - offset);
        return frames;
    }

    public List<byte[]> flush() {
        if (pending.size() == 0) {
            return List.of();
        }
        byte[] rest = pending.toByteArray();
        pending.reset();
        return List.of(rest);
    }
}
