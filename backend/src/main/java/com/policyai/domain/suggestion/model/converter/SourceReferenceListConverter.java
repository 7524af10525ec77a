package com.policyai.domain.suggestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.policyai.domain.suggestion.model.SourceReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class SourceReferenceListConverter extends JsonColumnConverter<List<SourceReference>> {

    public SourceReferenceListConverter() {
        super(new TypeReference<>() {});
    }
}
