package com.policyai.domain.suggestion.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Regulatory regions a suggestion can be scoped to. One per British Isles care regulator.
 */
public enum Jurisdiction {
    ENGLAND("England", "CQC"),
    SCOTLAND("Scotland", "Care Inspectorate"),
    WALES("Wales", "CIW"),
    NORTHERN_IRELAND("Northern Ireland", "RQIA"),
    ISLE_OF_MAN("Isle of Man", "Isle of Man Registration and Inspection"),
    JERSEY("Jersey", "Jersey Care Commission"),
    GUERNSEY("Guernsey", "Guernsey Health and Social Care");

    private final String displayName;
    private final String regulator;

    Jurisdiction(String displayName, String regulator) {
        this.displayName = displayName;
        this.regulator = regulator;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getRegulator() {
        return regulator;
    }

    /**
     * Accepts either the constant name ("NORTHERN_IRELAND") or the display name ("Northern Ireland"),
     * ignoring case and surrounding whitespace.
     */
    public static Optional<Jurisdiction> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(j -> j.name().equalsIgnoreCase(trimmed.replace(' ', '_'))
                        || j.displayName.toLowerCase(Locale.ROOT).equals(trimmed.toLowerCase(Locale.ROOT)))
                .findFirst();
    }
}
