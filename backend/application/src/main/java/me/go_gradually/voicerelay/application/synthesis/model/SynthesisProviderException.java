package me.go_gradually.voicerelay.application.synthesis.model;

public class SynthesisProviderException extends RuntimeException {
    private final String provider;

    public SynthesisProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public SynthesisProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
