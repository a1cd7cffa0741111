package me.go_gradually.voicerelay.application.generation.model;

public class GenerationProviderException extends RuntimeException {
    private final String provider;
    private final GenerationFailureKind kind;
    private final Integer status;

    public GenerationProviderException(String provider, GenerationFailureKind kind, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
        this.status = status;
    }

    public GenerationProviderException(String provider, GenerationFailureKind kind, String message) {
        this(provider, kind, null, message, null);
    }

    public String getProvider() {
        return provider;
    }

    public GenerationFailureKind getKind() {
        return kind;
    }

    public Integer getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
