package com.policyai.infrastructure.ai.synthesis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls verbatim text out of source documents. Nothing returned here is composed;
 * every string is a sentence, list item or prefix of the input.
 */
@Component
public class SectionExtractor {

    public static final int ANCHOR_KEYWORDS = 5;
    public static final int LEADING_TEXT_LENGTH = 200;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    // "1. item", "2) item", "- item", "* item", "• item"
    private static final Pattern LIST_ITEM = Pattern.compile(
            "^\\s*(?:\\d+[.)]|[-*•])\\s+(.+)$", Pattern.MULTILINE);

    private static final Pattern RATIONALE_MARKER = Pattern.compile(
            "\\b(ensure[sd]?|purpose|required|must|because)\\b", Pattern.CASE_INSENSITIVE);

    public List<String> sentences(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_BOUNDARY.split(content.strip()))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Sentences mentioning any of the first {@value #ANCHOR_KEYWORDS} keywords, in document order.
     */
    public List<String> keywordSentences(String content, List<String> keywords) {
        List<String> anchors = keywords.stream().limit(ANCHOR_KEYWORDS).toList();
        if (anchors.isEmpty()) {
            return List.of();
        }
        return sentences(content).stream()
                .filter(sentence -> {
                    String lower = sentence.toLowerCase(Locale.ROOT);
                    return anchors.stream().anyMatch(lower::contains);
                })
                .toList();
    }

    /**
     * Keyword-anchored sentences joined, or the leading text when no sentence matches.
     */
    public String anchoredText(String content, List<String> keywords) {
        List<String> matches = keywordSentences(content, keywords);
        if (matches.isEmpty()) {
            return leadingText(content);
        }
        return String.join(" ", matches);
    }

    /**
     * First keyword-anchored sentence, or the leading text when no sentence matches.
     */
    public String excerpt(String content, List<String> keywords) {
        List<String> matches = keywordSentences(content, keywords);
        return matches.isEmpty() ? leadingText(content) : matches.get(0);
    }

    public Optional<String> rationale(String content) {
        return sentences(content).stream()
                .filter(sentence -> RATIONALE_MARKER.matcher(sentence).find())
                .findFirst();
    }

    public List<String> listItems(String content, int limit) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        Matcher m = LIST_ITEM.matcher(content);
        while (m.find() && items.size() < limit) {
            items.add(m.group(1).strip());
        }
        return items;
    }

    public String leadingText(String content) {
        if (content == null) {
            return "";
        }
        String text = content.strip();
        return text.length() <= LEADING_TEXT_LENGTH ? text : text.substring(0, LEADING_TEXT_LENGTH);
    }
}
