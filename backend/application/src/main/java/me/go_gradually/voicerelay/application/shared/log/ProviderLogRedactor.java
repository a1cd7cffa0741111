package me.go_gradually.voicerelay.application.shared.log;

import me.go_gradually.voicerelay.domain.util.TextUtils;

import java.util.regex.Pattern;

/**
 * Masks credentials in upstream error text before it reaches a log line.
 */
public final class ProviderLogRedactor {
    private static final int MAX_CHARS = 300;
    private static final Pattern QUERY_SECRET = Pattern.compile("(?i)((?:api_)?key=)[^&\\s\"']+");
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._\\-]+");
    private static final Pattern HEADER_SECRET = Pattern.compile("(?i)((?:xi-api-key|x-api-key|authorization)\\s*[:=]\\s*)[^,\\s\"']+");
    private static final Pattern SECRET_TOKEN = Pattern.compile("\\b(sk-|AIza)[A-Za-z0-9_\\-]{8,}");

    private ProviderLogRedactor() {
    }

    public static String redact(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String masked = QUERY_SECRET.matcher(message).replaceAll("$1***");
        masked = BEARER.matcher(masked).replaceAll("$1***");
        masked = HEADER_SECRET.matcher(masked).replaceAll("$1***");
        masked = SECRET_TOKEN.matcher(masked).replaceAll("$1***");
        masked = masked.replace('\r', ' ').replace('\n', ' ');
        return TextUtils.trimToLength(masked, MAX_CHARS);
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        return redact(message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
    }
}
