package com.agentloop.core.context;

/**
 * Deterministic length-based token estimate: one token per four characters, rounded up.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /** Largest number of characters that still fits in {@code tokens}. */
    public static int maxChars(int tokens) {
        return Math.max(0, tokens) * CHARS_PER_TOKEN;
    }
}
