package io.hivememory.planning;

import java.util.HashSet;
import java.util.Set;

/**
 * A plannable action. Preconditions use the same fact syntax as goals; an effect
 * {@code fact} adds the fact and {@code !fact} removes it.
 */
public record GoapAction(String id, Set<String> preconditions, Set<String> effects, int cost, String agentType,
                         long createdAt) {

    public GoapAction {
        preconditions = preconditions == null ? Set.of() : Set.copyOf(preconditions);
        effects = effects == null ? Set.of() : Set.copyOf(effects);
    }

    public boolean isApplicable(Set<String> facts) {
        return GoapPlanner.satisfies(facts, preconditions);
    }

    public Set<String> apply(Set<String> facts) {
        Set<String> next = new HashSet<>(facts);
        for (String effect : effects) {
            if (effect.startsWith("!")) {
                next.remove(effect.substring(1));
            } else {
                next.add(effect);
            }
        }
        return next;
    }
}
