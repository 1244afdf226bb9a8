package com.tanmi.core.workspace;

import java.security.SecureRandom;

/**
 * Identifier generation: {@code {prefix}-{base36 millis}-{6 random base36 chars}}.
 */
public final class Ids {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {}

    public static String workspaceId() {
        return "ws-" + timeAndRandom();
    }

    public static String nodeId() {
        return "node-" + timeAndRandom();
    }

    public static String memoId() {
        return "memo-" + timeAndRandom();
    }

    private static String timeAndRandom() {
        return Long.toString(System.currentTimeMillis(), 36) + "-" + randomPart();
    }

    private static String randomPart() {
        var sb = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
