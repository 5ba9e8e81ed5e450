package io.hivememory.planning;

import java.util.Set;

/**
 * A goal: the facts that must hold ({@code !fact} for facts that must not).
 */
public record GoapGoal(String id, Set<String> conditions, int cost, String priority, long createdAt) {

    public GoapGoal {
        conditions = conditions == null ? Set.of() : Set.copyOf(conditions);
    }
}
