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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Entity
@Table(name = "policy_templates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PolicyTemplate extends KnowledgeEntry {

    @Column(length = 100)
    private String category;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "policy_template_jurisdictions", joinColumns = @JoinColumn(name = "template_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "jurisdiction", nullable = false, length = 30)
    private Set<Jurisdiction> jurisdictions = new HashSet<>();

    @Builder
    public PolicyTemplate(String id, String title, String content, String version, String section,
                          boolean deprecated, VerificationStatus verificationStatus, Instant updatedAt,
                          String category, Set<Jurisdiction> jurisdictions) {
        super(id, title, content, version, section, deprecated, verificationStatus, updatedAt);
        this.category = category;
        this.jurisdictions = new HashSet<>(jurisdictions);
    }

    public KnowledgeDocument toDocument() {
        return new KnowledgeDocument(SourceType.POLICY_TEMPLATE, getId(), getTitle(), getContent(),
                getVersion(), getSection(), Set.copyOf(jurisdictions), List.of(), effectiveStatus(),
                getUpdatedAt(), category != null ? Map.of("category", category) : Map.of());
    }
}
