package com.policyai.domain.knowledge.model;

import com.policyai.domain.suggestion.model.Jurisdiction;

import java.util.List;

/**
 * Filter criteria applied by each knowledge collection query.
 *
 * @param keywords          a document must contain at least one in its title or body; empty disables the text filter
 * @param jurisdictions     a document must be tagged with at least one
 * @param standards         standard codes to restrict to where the collection carries codes; empty disables it
 * @param includeDeprecated when false, deprecated documents are excluded
 */
public record KnowledgeFilter(
        List<String> keywords,
        List<Jurisdiction> jurisdictions,
        List<String> standards,
        boolean includeDeprecated
) {}
