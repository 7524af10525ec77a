package com.policyai.infrastructure.ai.retrieval;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword relevance heuristic:
 * <pre>
 *   score = 0.6 × (keywords present / keywords)
 *         + min(0.4, 4 × keyword occurrences / words in title+body)
 * </pre>
 * clamped to [0, 1]. With no keywords every document scores {@value #NO_KEYWORD_SCORE}.
 */
@Component
public class RelevanceScorer {

    static final double NO_KEYWORD_SCORE = 0.8;

    private static final double MATCH_WEIGHT = 0.6;
    private static final double MAX_FREQUENCY_BONUS = 0.4;
    // A keyword density of 10% earns the full frequency bonus
    private static final double DENSITY_WEIGHT = 4.0;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public double score(String title, String content, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return NO_KEYWORD_SCORE;
        }

        String text = ((title == null ? "" : title) + " " + (content == null ? "" : content))
                .toLowerCase(Locale.ROOT)
                .strip();
        if (text.isEmpty()) {
            return 0.0;
        }

        int matched = 0;
        int occurrences = 0;
        for (String keyword : keywords) {
            int count = countOccurrences(text, keyword);
            if (count > 0) {
                matched++;
                occurrences += count;
            }
        }

        double matchFraction = (double) matched / keywords.size();
        int wordCount = WHITESPACE.split(text).length;
        double density = (double) occurrences / wordCount;
        double frequencyBonus = Math.min(MAX_FREQUENCY_BONUS, density * DENSITY_WEIGHT);

        return clamp(matchFraction * MATCH_WEIGHT + frequencyBonus);
    }

    private static int countOccurrences(String text, String keyword) {
        if (keyword.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(keyword, from)) >= 0) {
            count++;
            from += keyword.length();
        }
        return count;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
