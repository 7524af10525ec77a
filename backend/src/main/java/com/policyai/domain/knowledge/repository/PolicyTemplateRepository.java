package com.policyai.domain.knowledge.repository;

import com.policyai.domain.knowledge.model.PolicyTemplate;
import com.policyai.domain.suggestion.model.Jurisdiction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface PolicyTemplateRepository extends JpaRepository<PolicyTemplate, String> {

    @Query("select distinct t from PolicyTemplate t join t.jurisdictions j " +
            "where j in :jurisdictions and (:includeDeprecated = true or t.deprecated = false)")
    List<PolicyTemplate> findForJurisdictions(@Param("jurisdictions") Collection<Jurisdiction> jurisdictions,
                                              @Param("includeDeprecated") boolean includeDeprecated);
}
