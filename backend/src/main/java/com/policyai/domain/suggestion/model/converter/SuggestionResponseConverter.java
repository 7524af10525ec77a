package com.policyai.domain.suggestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.policyai.domain.suggestion.model.SuggestionResponse;
import jakarta.persistence.Converter;

@Converter
public class SuggestionResponseConverter extends JsonColumnConverter<SuggestionResponse> {

    public SuggestionResponseConverter() {
        super(new TypeReference<>() {});
    }
}
