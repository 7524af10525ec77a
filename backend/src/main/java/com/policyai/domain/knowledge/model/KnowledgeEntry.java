package com.policyai.domain.knowledge.model;

import com.policyai.domain.suggestion.model.VerificationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Columns shared by every verified knowledge collection.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class KnowledgeEntry {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(nullable = false, length = 20)
    private String version;

    @Column(length = 100)
    private String section;

    @Column(nullable = false)
    private boolean deprecated;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 20)
    private VerificationStatus verificationStatus;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected KnowledgeEntry(String id, String title, String content, String version, String section,
                             boolean deprecated, VerificationStatus verificationStatus, Instant updatedAt) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.version = version;
        this.section = section;
        this.deprecated = deprecated;
        this.verificationStatus = verificationStatus != null ? verificationStatus : VerificationStatus.VERIFIED;
        this.updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    /**
     * Deprecated entries always report {@link VerificationStatus#DEPRECATED}.
     */
    public VerificationStatus effectiveStatus() {
        return deprecated ? VerificationStatus.DEPRECATED : verificationStatus;
    }
}
