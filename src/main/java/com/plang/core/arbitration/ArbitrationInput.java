package com.plang.core.arbitration;

import java.util.List;

/**
 * Contributions to arbitrate, in any order.
 */
public record ArbitrationInput(List<PolicyContribution> contributions) {

    public ArbitrationInput {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public static ArbitrationInput of(PolicyContribution... contributions) {
        return new ArbitrationInput(List.of(contributions));
    }
}
