package com.plang.core.arbitration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link PrecedenceStore}.
 */
@Component
public class InMemoryPrecedenceStore implements PrecedenceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPrecedenceStore.class);

    private final ConcurrentHashMap<Key, PolicyPrecedence> records = new ConcurrentHashMap<>();

    @Override
    public Optional<PolicyPrecedence> find(String policyId, String tenantId) {
        return Optional.ofNullable(records.get(new Key(policyId, tenantId)));
    }

    @Override
    public void save(PolicyPrecedence precedence) {
        records.put(new Key(precedence.policyId(), precedence.tenantId()), precedence);
        log.debug("Saved precedence {} for {} (tenant {})",
                precedence.precedence(), precedence.policyId(), precedence.tenantId());
    }

    public int size() {
        return records.size();
    }

    private record Key(String policyId, String tenantId) {}
}
