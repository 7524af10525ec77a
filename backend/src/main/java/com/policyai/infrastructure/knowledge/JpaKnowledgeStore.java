package com.policyai.infrastructure.knowledge;

import com.policyai.domain.knowledge.model.ComplianceStandard;
import com.policyai.domain.knowledge.model.JurisdictionalRule;
import com.policyai.domain.knowledge.model.KnowledgeDocument;
import com.policyai.domain.knowledge.model.KnowledgeFilter;
import com.policyai.domain.knowledge.model.PolicyTemplate;
import com.policyai.domain.knowledge.repository.ComplianceStandardRepository;
import com.policyai.domain.knowledge.repository.JurisdictionalRuleRepository;
import com.policyai.domain.knowledge.repository.PolicyTemplateRepository;
import com.policyai.domain.knowledge.service.KnowledgeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Knowledge store backed by the policy_templates, compliance_standards and jurisdictional_rules tables.
 * <p>
 * Active and jurisdiction filters run in the database; the keyword text filter runs over
 * title + body after loading, since the keyword set varies per request.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaKnowledgeStore implements KnowledgeStore {

    private final PolicyTemplateRepository templateRepository;
    private final ComplianceStandardRepository standardRepository;
    private final JurisdictionalRuleRepository ruleRepository;

    @Override
    @Transactional(readOnly = true)
    public List<KnowledgeDocument> queryTemplates(KnowledgeFilter filter) {
        if (filter.jurisdictions().isEmpty()) {
            return List.of();
        }
        List<KnowledgeDocument> docs = textFilter(
                templateRepository.findForJurisdictions(filter.jurisdictions(), filter.includeDeprecated())
                        .stream().map(PolicyTemplate::toDocument), filter);
        log.debug("[KnowledgeStore] templates: {} hits", docs.size());
        return docs;
    }

    @Override
    @Transactional(readOnly = true)
    public List<KnowledgeDocument> queryStandards(KnowledgeFilter filter) {
        if (filter.jurisdictions().isEmpty()) {
            return List.of();
        }
        List<ComplianceStandard> standards = filter.standards().isEmpty()
                ? standardRepository.findForJurisdictions(filter.jurisdictions(), filter.includeDeprecated())
                : standardRepository.findForJurisdictionsAndCodes(
                        filter.jurisdictions(), upperCased(filter.standards()), filter.includeDeprecated());
        List<KnowledgeDocument> docs = textFilter(standards.stream().map(ComplianceStandard::toDocument), filter);
        log.debug("[KnowledgeStore] standards: {} hits", docs.size());
        return docs;
    }

    @Override
    @Transactional(readOnly = true)
    public List<KnowledgeDocument> queryRules(KnowledgeFilter filter) {
        if (filter.jurisdictions().isEmpty()) {
            return List.of();
        }
        List<KnowledgeDocument> docs = textFilter(
                ruleRepository.findForJurisdictions(filter.jurisdictions(), filter.includeDeprecated())
                        .stream().map(JurisdictionalRule::toDocument), filter);
        log.debug("[KnowledgeStore] rules: {} hits", docs.size());
        return docs;
    }

    private static List<String> upperCased(List<String> codes) {
        return codes.stream().map(code -> code.toUpperCase(Locale.ROOT)).toList();
    }

    private List<KnowledgeDocument> textFilter(Stream<KnowledgeDocument> docs, KnowledgeFilter filter) {
        if (filter.keywords().isEmpty()) {
            return docs.toList();
        }
        return docs.filter(doc -> mentionsAnyKeyword(doc, filter.keywords())).toList();
    }

    private boolean mentionsAnyKeyword(KnowledgeDocument doc, List<String> keywords) {
        String text = (doc.title() + " " + doc.content()).toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(text::contains);
    }
}
