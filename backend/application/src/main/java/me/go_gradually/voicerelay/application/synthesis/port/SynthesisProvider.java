package me.go_gradually.voicerelay.application.synthesis.port;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;

public interface SynthesisProvider {
    String name();

    boolean isAvailable();

    /**
     * Opens a lazy frame stream. Connection failures are raised here, stream failures from the iterator.
     */
    FrameStream stream(SynthesisCommand command);
}
