package io.hivememory.planning;

import java.util.List;

/**
 * A committed plan: the ordered action ids that reach {@code goalId}. Immutable once stored.
 */
public record GoapPlan(String id, String goalId, List<String> sequence, int totalCost, long createdAt) {

    public GoapPlan {
        sequence = sequence == null ? List.of() : List.copyOf(sequence);
    }
}
