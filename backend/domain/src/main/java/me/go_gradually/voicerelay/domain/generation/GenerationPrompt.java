package me.go_gradually.voicerelay.domain.generation;

import java.util.List;
import java.util.stream.Collectors;

public record GenerationPrompt(List<PromptMessage> messages) {
    public GenerationPrompt {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Prompt requires at least one message");
        }
        messages = List.copyOf(messages);
    }

    public static GenerationPrompt of(PromptMessage... messages) {
        return new GenerationPrompt(List.of(messages));
    }

    public String lastUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            PromptMessage message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                return message.content();
            }
        }
        return "";
    }

    public String systemContent() {
        return messages.stream()
                .filter(message -> message.role() == MessageRole.SYSTEM)
                .map(PromptMessage::content)
                .collect(Collectors.joining("\n\n"));
    }

    public List<PromptMessage> conversation() {
        return messages.stream()
                .filter(message -> message.role() != MessageRole.SYSTEM)
                .collect(Collectors.toList());
    }
}
