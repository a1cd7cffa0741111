package me.go_gradually.voicerelay.domain.relay;

public class RelayStateException extends RuntimeException {
    private final RelayErrorCode code;

    public RelayStateException(RelayErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RelayErrorCode getCode() {
        return code;
    }
}
