package com.policyai.infrastructure.ai.validation;

import com.policyai.domain.suggestion.model.SafetyContext;
import com.policyai.domain.suggestion.model.SafetyIssue;
import com.policyai.domain.suggestion.model.SafetyIssue.Severity;
import com.policyai.domain.suggestion.model.SafetyIssueType;
import com.policyai.domain.suggestion.model.SafetyVerdict;
import com.policyai.domain.suggestion.service.ContentSafetyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based content-safety check for assembled suggestions.
 * <p>
 * ERROR-level rules make the content unsafe; WARNING-level rules only lower the verdict's confidence.
 * </p>
 */
@Slf4j
@Component
public class RuleBasedSafetyValidator implements ContentSafetyValidator {

    static final double BASE_CONFIDENCE = 0.95;
    static final double WARNING_PENALTY = 0.15;
    static final double UNSAFE_CONFIDENCE = 0.1;

    // Rule 2: personal data
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern UK_PHONE_PATTERN = Pattern.compile(
            "(?<!\\d)(?:\\+44\\s?\\d{2,4}|0\\d{2,4})[\\s-]?\\d{3,4}[\\s-]?\\d{3,4}(?!\\d)");
    private static final Pattern NHS_NUMBER_PATTERN = Pattern.compile(
            "(?<!\\d)\\d{3}\\s?\\d{3}\\s?\\d{4}(?!\\d)");

    // Rule 3: generative or meta commentary, which verified source text never contains
    private static final List<String> GENERATIVE_PHRASES = List.of(
            "as an ai",
            "as a language model",
            "i think",
            "i believe",
            "in my opinion",
            "i would suggest",
            "i recommend",
            "here is a suggested"
    );

    // Rule 4: unresolved template placeholders
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
            "\\{\\{[^}]*}}|\\[(?:INSERT|TBC|TODO)[^\\]]*]", Pattern.CASE_INSENSITIVE);

    // Rule 5: absolute compliance claims
    private static final Pattern ABSOLUTE_CLAIM_PATTERN = Pattern.compile(
            "\\b(?:guarantee[sd]?|100% compliant|always compliant|fully compliant)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public SafetyVerdict validate(String content, SafetyContext context) {
        List<SafetyIssue> issues = new ArrayList<>();

        if (content == null || content.isBlank()) {
            issues.add(new SafetyIssue(SafetyIssueType.EMPTY_CONTENT, Severity.ERROR,
                    "Suggestion content is empty", null));
            return verdict(issues);
        }

        checkPersonalData(content, issues);
        checkGenerativePhrases(content, issues);
        checkPlaceholders(content, issues);
        checkAbsoluteClaims(content, issues);

        SafetyVerdict verdict = verdict(issues);
        if (!issues.isEmpty()) {
            log.info("[Safety] {} issues ({} errors, {} warnings), category={}",
                    issues.size(), verdict.errors().size(), verdict.warnings().size(),
                    context != null ? context.category() : null);
        }
        return verdict;
    }

    private SafetyVerdict verdict(List<SafetyIssue> issues) {
        boolean safe = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        long warnings = issues.stream().filter(i -> i.severity() == Severity.WARNING).count();
        double confidence = safe
                ? Math.max(0.0, BASE_CONFIDENCE - WARNING_PENALTY * warnings)
                : UNSAFE_CONFIDENCE;
        return new SafetyVerdict(safe, confidence, List.copyOf(issues));
    }

    private void checkPersonalData(String content, List<SafetyIssue> issues) {
        addMatches(EMAIL_PATTERN, content, SafetyIssueType.PERSONAL_DATA, Severity.ERROR,
                "E-mail address in suggestion content", issues);
        addMatches(NHS_NUMBER_PATTERN, content, SafetyIssueType.PERSONAL_DATA, Severity.ERROR,
                "Possible NHS number in suggestion content", issues);
        // NHS-number shaped digits also match the phone pattern; report them once
        Matcher phone = UK_PHONE_PATTERN.matcher(content);
        while (phone.find()) {
            if (!NHS_NUMBER_PATTERN.matcher(phone.group()).matches()) {
                issues.add(new SafetyIssue(SafetyIssueType.PERSONAL_DATA, Severity.ERROR,
                        "Telephone number in suggestion content", phone.group()));
            }
        }
    }

    private void checkGenerativePhrases(String content, List<SafetyIssue> issues) {
        String lower = content.toLowerCase(Locale.ROOT);
        for (String phrase : GENERATIVE_PHRASES) {
            if (lower.contains(phrase)) {
                issues.add(new SafetyIssue(SafetyIssueType.GENERATIVE_PHRASE, Severity.ERROR,
                        "Generative phrasing: \"" + phrase + "\"", phrase));
            }
        }
    }

    private void checkPlaceholders(String content, List<SafetyIssue> issues) {
        addMatches(PLACEHOLDER_PATTERN, content, SafetyIssueType.UNRESOLVED_PLACEHOLDER, Severity.WARNING,
                "Unresolved placeholder", issues);
    }

    private void checkAbsoluteClaims(String content, List<SafetyIssue> issues) {
        addMatches(ABSOLUTE_CLAIM_PATTERN, content, SafetyIssueType.ABSOLUTE_CLAIM, Severity.WARNING,
                "Absolute compliance claim", issues);
    }

    private static void addMatches(Pattern pattern, String content, SafetyIssueType type, Severity severity,
                                   String message, List<SafetyIssue> issues) {
        Matcher m = pattern.matcher(content);
        while (m.find()) {
            issues.add(new SafetyIssue(type, severity, message, m.group()));
        }
    }
}
