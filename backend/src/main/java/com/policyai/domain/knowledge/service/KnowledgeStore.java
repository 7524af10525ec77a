package com.policyai.domain.knowledge.service;

import com.policyai.domain.knowledge.model.KnowledgeDocument;
import com.policyai.domain.knowledge.model.KnowledgeFilter;

import java.util.List;

/**
 * Read-only structured store of verified policy material. Ingestion and versioning happen elsewhere.
 */
public interface KnowledgeStore {

    List<KnowledgeDocument> queryTemplates(KnowledgeFilter filter);

    List<KnowledgeDocument> queryStandards(KnowledgeFilter filter);

    List<KnowledgeDocument> queryRules(KnowledgeFilter filter);
}
