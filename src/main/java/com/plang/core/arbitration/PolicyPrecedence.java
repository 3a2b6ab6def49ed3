package com.plang.core.arbitration;

/**
 * Stored precedence of a policy within a tenant. Lower value = higher precedence.
 *
 * @param strategy conflict strategy this policy declares, or null
 */
public record PolicyPrecedence(String policyId, String tenantId, int precedence, ConflictStrategy strategy) {}
