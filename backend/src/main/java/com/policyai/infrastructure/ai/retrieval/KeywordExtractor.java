package com.policyai.infrastructure.ai.retrieval;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts retrieval keywords from free-text request context.
 * Deterministic: identical input always yields the same keywords in the same order.
 */
@Component
public class KeywordExtractor {

    public static final int MAX_KEYWORDS = 10;

    private static final int MIN_KEYWORD_LENGTH = 4;

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Anything that is not a letter, digit, underscore or whitespace
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Every entry is also shorter than MIN_KEYWORD_LENGTH; modal words such as "must" stay as keywords
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for"
    );

    /**
     * @param context free-text request context
     * @return at most {@value #MAX_KEYWORDS} keywords, in order of first appearance
     */
    public List<String> extract(String context) {
        if (context == null || context.isBlank()) {
            return List.of();
        }

        // 1. Unicode NFC normalization
        String text = Normalizer.normalize(context, Normalizer.Form.NFC);

        // 2. Remove invisible characters
        text = INVISIBLE_CHARS.matcher(text).replaceAll("");

        // 3. Lowercase and strip punctuation
        text = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");

        // 4. Split, drop short tokens and stop-words, keep the first ten
        return Arrays.stream(WHITESPACE.split(text.strip()))
                .filter(token -> token.length() >= MIN_KEYWORD_LENGTH)
                .filter(token -> !STOP_WORDS.contains(token))
                .limit(MAX_KEYWORDS)
                .toList();
    }
}
