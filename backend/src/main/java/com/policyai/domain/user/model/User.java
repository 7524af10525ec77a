package com.policyai.domain.user.model;

/**
 * Requesting user as resolved by the external user directory.
 */
public record User(
        String id,
        UserRole role,
        String organizationId
) {}
