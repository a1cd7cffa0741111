package me.go_gradually.voicerelay.domain.relay;

public enum ConnectionState {
    UNBOUND,
    BOUND,
    SPEAKING,
    CLOSED
}
