package com.policyai.domain.suggestion.model;

/**
 * Individual issue found by the content-safety check.
 *
 * @param type        the kind of issue
 * @param severity    ERROR makes the content unsafe, WARNING only lowers confidence
 * @param message     human-readable description of the issue
 * @param matchedText the specific text that triggered this issue (nullable)
 */
public record SafetyIssue(
        SafetyIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
