package me.go_gradually.voicerelay.application.relay.usecase;

import java.util.concurrent.ThreadLocalRandom;

final class CorrelationIds {
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;

    private CorrelationIds() {
    }

    static String resolve(String supplied) {
        if (supplied != null && !supplied.isBlank()) {
            return supplied;
        }
        return next(System.currentTimeMillis());
    }

    static String next(long epochMillis) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return "tts-" + epochMillis + "-" + suffix;
    }
}
