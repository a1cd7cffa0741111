package me.go_gradually.voicerelay.domain.util;

public final class TextUtils {
    private TextUtils() {
    }

    public static String trimToLength(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, Math.max(0, maxChars - 1)).trim();
    }

    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
