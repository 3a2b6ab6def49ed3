package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;

/**
 * Record of one condition block that fired.
 *
 * @param policy   function that owns the block
 * @param block    block label, e.g. {@code "pii_filter#0"}
 * @param action   action emitted by the block
 * @param target   route target for ROUTE, otherwise null
 * @param reason   optional reason string from source
 * @param category governance category of the owning function
 */
public record Intent(
    String policy,
    String block,
    ActionKind action,
    String target,
    String reason,
    GovernanceCategory category
) {}
