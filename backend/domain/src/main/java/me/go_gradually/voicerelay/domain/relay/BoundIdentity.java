package me.go_gradually.voicerelay.domain.relay;

public record BoundIdentity(String callerId, String sessionId) {
    public BoundIdentity {
        if (callerId == null || callerId.isBlank() || sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("callerId and sessionId are required");
        }
    }

    public static BoundIdentity of(String callerId, String sessionId) {
        return new BoundIdentity(callerId, sessionId);
    }
}
