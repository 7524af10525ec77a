package com.policyai.domain.suggestion.model;

import java.util.List;

public record RegulatoryContext(
        List<Jurisdiction> jurisdictions,
        List<String> standards
) {}
