package com.policyai.domain.suggestion.exception;

/**
 * The audit record for a suggestion could not be written. The suggestion is not returned.
 */
public class SuggestionAuditException extends RuntimeException {

    public SuggestionAuditException(String suggestionId, Throwable cause) {
        super("Failed to write audit record for suggestion " + suggestionId, cause);
    }
}
