package me.go_gradually.voicerelay.application.generation.model;

public enum GenerationFailureKind {
    NETWORK(true),
    UNAUTHORIZED(true),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    NOT_CONFIGURED(true),
    INVALID_RESPONSE(true),
    MALFORMED_REQUEST(false);

    private final boolean retryable;

    GenerationFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static GenerationFailureKind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return UNAUTHORIZED;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        return MALFORMED_REQUEST;
    }
}
