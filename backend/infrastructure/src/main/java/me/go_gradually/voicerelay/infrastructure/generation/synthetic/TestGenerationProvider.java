package me.go_gradually.voicerelay.infrastructure.generation.synthetic;

import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.domain.generation.GenerationPrompt;
import me.go_gradually.voicerelay.domain.generation.GenerationResponse;
import me.go_gradually.voicerelay.domain.generation.TokenUsage;
import me.go_gradually.voicerelay.infrastructure.generation.support.GenerationErrorMapper;
import me.go_gradually.voicerelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic replies for local runs and CI, picked by an MD5 hash of the latest user message.
 */
@Component
public class TestGenerationProvider implements GenerationProvider {
    public static final String NAME = AppProperties.TEST_PROVIDER;
    public static final String MODEL = "test-relay-v1";

    private static final int INPUT_PREVIEW_CHARS = 50;
    private static final Pattern USER_ROLE = Pattern.compile("user_role:\\s*\"([^\"]+)\"");

    static final List<String> REPLIES = List.of(
            "Got it. I have your request about \"{input}\". Want me to go ahead?",
            "Sure. Your question on \"{input}\" is noted. What else can I do?",
            "Understood. \"{input}\" is recorded. Anything to add?",
            "Okay. I'm looking at \"{input}\" now. Should I go into more detail?",
            "Right away. Working on \"{input}\". Do you want a summary afterwards?",
            "Noted. \"{input}\" is on my list. How should we continue?"
    );

    static final List<String> ROLE_REPLIES = List.of(
            "Got it. Since you work as {role}, I read \"{input}\" with that in mind. Want me to go ahead?",
            "Sure. Keeping your {role} role in view, \"{input}\" is noted. What else can I do?",
            "Understood. As a {role}, you asked about \"{input}\". Should I expand on it?"
    );

    private final AppProperties properties;

    public TestGenerationProvider(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return properties.getGeneration().isTestMode();
    }

    @Override
    public GenerationResponse generate(GenerationPrompt prompt) {
        if (!isAvailable()) {
            throw GenerationErrorMapper.notConfigured(NAME, "Test generator not enabled");
        }
        String input = prompt.lastUserContent();
        String preview = input.length() > INPUT_PREVIEW_CHARS ? input.substring(0, INPUT_PREVIEW_CHARS) : input;
        String role = extractUserRole(prompt.systemContent());
        long hash = hash(input);

        String reply;
        if (role == null) {
            reply = REPLIES.get((int) (hash % REPLIES.size())).replace("{input}", preview);
        } else {
            reply = ROLE_REPLIES.get((int) (hash % ROLE_REPLIES.size()))
                    .replace("{role}", role)
                    .replace("{input}", preview);
        }
        int promptChars = prompt.messages().stream().mapToInt(message -> message.content().length()).sum();
        return new GenerationResponse(reply, MODEL, NAME, new TokenUsage(promptChars, reply.length()));
    }

    static long hash(String input) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(input.getBytes(StandardCharsets.UTF_8));
            long value = 0;
            for (int i = 0; i < 4; i++) {
                value = (value << 8) | (digest[i] & 0xff);
            }
            return value;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String extractUserRole(String systemContent) {
        Matcher matcher = USER_ROLE.matcher(systemContent);
        return matcher.find() ? matcher.group(1) : null;
    }
}
