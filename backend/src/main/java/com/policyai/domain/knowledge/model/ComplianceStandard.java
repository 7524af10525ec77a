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

/**
 * A regulator's standard, e.g. CQC "Regulation 12: Safe care and treatment".
 */
@Entity
@Table(name = "compliance_standards")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ComplianceStandard extends KnowledgeEntry {

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(length = 100)
    private String regulator;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "compliance_standard_jurisdictions", joinColumns = @JoinColumn(name = "standard_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "jurisdiction", nullable = false, length = 30)
    private Set<Jurisdiction> jurisdictions = new HashSet<>();

    @Builder
    public ComplianceStandard(String id, String title, String content, String version, String section,
                              boolean deprecated, VerificationStatus verificationStatus, Instant updatedAt,
                              String code, String regulator, Set<Jurisdiction> jurisdictions) {
        super(id, title, content, version, section, deprecated, verificationStatus, updatedAt);
        this.code = code;
        this.regulator = regulator;
        this.jurisdictions = new HashSet<>(jurisdictions);
    }

    public KnowledgeDocument toDocument() {
        return new KnowledgeDocument(SourceType.COMPLIANCE_STANDARD, getId(), getTitle(), getContent(),
                getVersion(), getSection(), Set.copyOf(jurisdictions), List.of(code), effectiveStatus(),
                getUpdatedAt(), regulator != null ? Map.of("regulator", regulator) : Map.of());
    }
}
