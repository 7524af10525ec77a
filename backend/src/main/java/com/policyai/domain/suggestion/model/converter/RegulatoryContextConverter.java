package com.policyai.domain.suggestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.policyai.domain.suggestion.model.RegulatoryContext;
import jakarta.persistence.Converter;

@Converter
public class RegulatoryContextConverter extends JsonColumnConverter<RegulatoryContext> {

    public RegulatoryContextConverter() {
        super(new TypeReference<>() {});
    }
}
