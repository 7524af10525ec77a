package com.policyai.domain.suggestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.policyai.domain.suggestion.model.SuggestionRequest;
import jakarta.persistence.Converter;

@Converter
public class SuggestionRequestConverter extends JsonColumnConverter<SuggestionRequest> {

    public SuggestionRequestConverter() {
        super(new TypeReference<>() {});
    }
}
