package com.plang.core.arbitration;

import java.util.Optional;

/**
 * Lookup of policy precedence records, keyed by (policy id, tenant id).
 */
public interface PrecedenceStore {

    Optional<PolicyPrecedence> find(String policyId, String tenantId);

    void save(PolicyPrecedence precedence);
}
