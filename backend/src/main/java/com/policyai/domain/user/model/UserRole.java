package com.policyai.domain.user.model;

public enum UserRole {
    SYSTEM_ADMIN,
    COMPLIANCE_OFFICER,
    CARE_HOME_MANAGER,
    QUALITY_ASSURANCE,
    CARE_STAFF
}
