package me.go_gradually.voicerelay.domain.generation;

public record PromptMessage(MessageRole role, String content) {
    public PromptMessage {
        if (role == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        content = content == null ? "" : content;
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(MessageRole.SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(MessageRole.USER, content);
    }

    public static PromptMessage assistant(String content) {
        return new PromptMessage(MessageRole.ASSISTANT, content);
    }
}
