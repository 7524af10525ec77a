package com.policyai.domain.knowledge.repository;

import com.policyai.domain.knowledge.model.ComplianceStandard;
import com.policyai.domain.suggestion.model.Jurisdiction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ComplianceStandardRepository extends JpaRepository<ComplianceStandard, String> {

    @Query("select distinct s from ComplianceStandard s join s.jurisdictions j " +
            "where j in :jurisdictions and (:includeDeprecated = true or s.deprecated = false)")
    List<ComplianceStandard> findForJurisdictions(@Param("jurisdictions") Collection<Jurisdiction> jurisdictions,
                                                  @Param("includeDeprecated") boolean includeDeprecated);

    /**
     * Codes match case-insensitively; callers pass them upper-cased.
     */
    @Query("select distinct s from ComplianceStandard s join s.jurisdictions j " +
            "where j in :jurisdictions and upper(s.code) in :codes " +
            "and (:includeDeprecated = true or s.deprecated = false)")
    List<ComplianceStandard> findForJurisdictionsAndCodes(@Param("jurisdictions") Collection<Jurisdiction> jurisdictions,
                                                          @Param("codes") Collection<String> codes,
                                                          @Param("includeDeprecated") boolean includeDeprecated);
}
