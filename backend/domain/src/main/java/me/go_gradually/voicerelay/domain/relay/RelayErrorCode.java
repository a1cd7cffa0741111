package me.go_gradually.voicerelay.domain.relay;

public enum RelayErrorCode {
    INVALID_MESSAGE,
    NOT_BOUND,
    ALREADY_SPEAKING,
    TTS_ERROR,
    INTERNAL_ERROR
}
