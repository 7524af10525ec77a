package com.policyai.domain.suggestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.policyai.domain.suggestion.model.Jurisdiction;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class JurisdictionListConverter extends JsonColumnConverter<List<Jurisdiction>> {

    public JurisdictionListConverter() {
        super(new TypeReference<>() {});
    }
}
