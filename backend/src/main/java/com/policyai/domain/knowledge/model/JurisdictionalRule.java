package com.policyai.domain.knowledge.model;

import com.policyai.domain.suggestion.model.Jurisdiction;
import com.policyai.domain.suggestion.model.SourceType;
import com.policyai.domain.suggestion.model.VerificationStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A statutory or regulator rule specific to one or more jurisdictions.
 */
@Entity
@Table(name = "jurisdictional_rules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JurisdictionalRule extends KnowledgeEntry {

    @Column(name = "regulatory_body", length = 100)
    private String regulatoryBody;

    @Column(name = "related_standard_code", length = 50)
    private String relatedStandardCode;

    @Column(nullable = false)
    private boolean mandatory;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "jurisdictional_rule_jurisdictions", joinColumns = @JoinColumn(name = "rule_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "jurisdiction", nullable = false, length = 30)
    private Set<Jurisdiction> jurisdictions = new HashSet<>();

    @Builder
    public JurisdictionalRule(String id, String title, String content, String version, String section,
                              boolean deprecated, VerificationStatus verificationStatus, Instant updatedAt,
                              String regulatoryBody, String relatedStandardCode, boolean mandatory,
                              Set<Jurisdiction> jurisdictions) {
        super(id, title, content, version, section, deprecated, verificationStatus, updatedAt);
        this.regulatoryBody = regulatoryBody;
        this.relatedStandardCode = relatedStandardCode;
        this.mandatory = mandatory;
        this.jurisdictions = new HashSet<>(jurisdictions);
    }

    public KnowledgeDocument toDocument() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("mandatory", mandatory);
        if (regulatoryBody != null) {
            metadata.put("regulatoryBody", regulatoryBody);
        }
        List<String> codes = relatedStandardCode != null ? List.of(relatedStandardCode) : List.of();
        return new KnowledgeDocument(SourceType.JURISDICTIONAL_RULE, getId(), getTitle(), getContent(),
                getVersion(), getSection(), Set.copyOf(jurisdictions), codes, effectiveStatus(),
                getUpdatedAt(), Map.copyOf(metadata));
    }
}
