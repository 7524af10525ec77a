package com.policyai.domain.knowledge.repository;

import com.policyai.domain.knowledge.model.JurisdictionalRule;
import com.policyai.domain.suggestion.model.Jurisdiction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface JurisdictionalRuleRepository extends JpaRepository<JurisdictionalRule, String> {

    @Query("select distinct r from JurisdictionalRule r join r.jurisdictions j " +
            "where j in :jurisdictions and (:includeDeprecated = true or r.deprecated = false)")
    List<JurisdictionalRule> findForJurisdictions(@Param("jurisdictions") Collection<Jurisdiction> jurisdictions,
                                                  @Param("includeDeprecated") boolean includeDeprecated);
}
