package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Vocabulary-free tokenizer: each whitespace separated word maps to {@code 1 + |hash| mod 32768}. Id 0 stands for
 * "no input".
 */
public final class HashingTokenizer {

    public static final long TOKEN_SPACE = 32_768L;
    public static final long UNKNOWN_TOKEN_ID = 0L;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^\\p{Punct}+|\\p{Punct}+$");

    public long[] encode(String text, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        String sanitized = text == null ? "" : text.trim();
        if (sanitized.isEmpty()) {
            return new long[] {UNKNOWN_TOKEN_ID};
        }
        long[] tokens = WHITESPACE.splitAsStream(sanitized)
                .map(this::normalize)
                .filter(word -> !word.isEmpty())
                .limit(maxTokens)
                .mapToLong(word -> Math.floorMod((long) word.hashCode(), TOKEN_SPACE) + 1)
                .toArray();
        return tokens.length == 0 ? new long[] {UNKNOWN_TOKEN_ID} : tokens;
    }

    /** Pads with {@link #UNKNOWN_TOKEN_ID} or truncates to exactly {@code length} ids. */
    public long[] pad(long[] tokens, int length) {
        return Arrays.copyOf(tokens, length);
    }

    private String normalize(String word) {
        return EDGE_PUNCTUATION.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
