package me.go_gradually.voicerelay.domain.relay;

import java.util.Optional;

/**
 * Lifecycle of one client connection: UNBOUND -> BOUND -> SPEAKING -> BOUND, CLOSED from anywhere.
 */
public class RelayConnection {
    private final String id;
    private ConnectionState state = ConnectionState.UNBOUND;
    private BoundIdentity identity;

    public RelayConnection(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Connection id is required");
        }
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized Optional<BoundIdentity> getIdentity() {
        return Optional.ofNullable(identity);
    }

    // Binding while SPEAKING records the identity but leaves the stream running.
    public synchronized void bind(BoundIdentity next) {
        if (next == null) {
            throw new IllegalArgumentException("Identity is required");
        }
        requireOpen();
        identity = next;
        if (state == ConnectionState.UNBOUND) {
            state = ConnectionState.BOUND;
        }
    }

    public synchronized BoundIdentity beginSpeaking() {
        requireOpen();
        if (state == ConnectionState.UNBOUND) {
            throw new RelayStateException(RelayErrorCode.NOT_BOUND, "Call session.bind first");
        }
        if (state == ConnectionState.SPEAKING) {
            throw new RelayStateException(RelayErrorCode.ALREADY_SPEAKING, "Already speaking, wait for audio.end");
        }
        state = ConnectionState.SPEAKING;
        return identity;
    }

    public synchronized void finishSpeaking() {
        if (state == ConnectionState.SPEAKING) {
            state = ConnectionState.BOUND;
        }
    }

    public synchronized boolean close() {
        if (state == ConnectionState.CLOSED) {
            return false;
        }
        state = ConnectionState.CLOSED;
        return true;
    }

    public synchronized boolean isClosed() {
        return state == ConnectionState.CLOSED;
    }

    public synchronized boolean isSpeaking() {
        return state == ConnectionState.SPEAKING;
    }

    private void requireOpen() {
        if (state == ConnectionState.CLOSED) {
            throw new IllegalStateException("Connection is closed: " + id);
        }
    }
}
