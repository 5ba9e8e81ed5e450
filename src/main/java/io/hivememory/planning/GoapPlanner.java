package io.hivememory.planning;

import io.hivememory.core.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * A* search from a set of facts to a goal over the stored actions.
 *
 * <p>The cost of a path is the sum of its action costs; the heuristic is the number of
 * goal conditions not yet met. Search stops after {@code maxExpansions} states.</p>
 */
@Component
public class GoapPlanner {

    private static final Logger log = LoggerFactory.getLogger(GoapPlanner.class);
    static final int DEFAULT_MAX_EXPANSIONS = 10_000;

    private record Node(Set<String> facts, int cost, int estimate, Node parent, GoapAction via) {
        int priority() {
            return cost + estimate;
        }
    }

    private final GoapStore store;
    private final int maxExpansions;

    @Autowired
    public GoapPlanner(GoapStore store) {
        this(store, DEFAULT_MAX_EXPANSIONS);
    }

    GoapPlanner(GoapStore store, int maxExpansions) {
        this.store = store;
        this.maxExpansions = maxExpansions;
    }

    /**
     * Cheapest action sequence turning {@code initial} into a state satisfying {@code goal}.
     * An already satisfied goal yields an empty list.
     */
    public Optional<List<GoapAction>> plan(Set<String> initial, Set<String> goal, List<GoapAction> actions) {
        PriorityQueue<Node> open = new PriorityQueue<>(
                Comparator.comparingInt(Node::priority).thenComparingInt(Node::cost));
        Map<Set<String>, Integer> bestCost = new HashMap<>();
        Set<String> start = new TreeSet<>(initial);
        open.add(new Node(start, 0, unmet(start, goal), null, null));
        bestCost.put(start, 0);

        int expanded = 0;
        while (!open.isEmpty() && expanded < maxExpansions) {
            Node node = open.poll();
            if (node.cost() > bestCost.getOrDefault(node.facts(), Integer.MAX_VALUE)) {
                continue;
            }
            if (satisfies(node.facts(), goal)) {
                return Optional.of(path(node));
            }
            expanded++;
            for (GoapAction action : actions) {
                if (!action.isApplicable(node.facts())) {
                    continue;
                }
                Set<String> next = new TreeSet<>(action.apply(node.facts()));
                int cost = node.cost() + action.cost();
                if (cost < bestCost.getOrDefault(next, Integer.MAX_VALUE)) {
                    bestCost.put(next, cost);
                    open.add(new Node(next, cost, unmet(next, goal), node, action));
                }
            }
        }
        log.debug("No plan found after expanding {} states", expanded);
        return Optional.empty();
    }

    /**
     * Plans for a stored goal with every stored action and commits the result.
     *
     * @throws NotFoundException the goal does not exist
     */
    public Optional<GoapPlan> planAndCommit(String goalId, Set<String> initial) {
        GoapGoal goal = store.getGoal(goalId)
                .orElseThrow(() -> new NotFoundException("Goal not found: " + goalId));
        return plan(initial, goal.conditions(), store.listActions()).map(steps -> {
            List<String> sequence = new ArrayList<>();
            int total = 0;
            for (GoapAction step : steps) {
                sequence.add(step.id());
                total += step.cost();
            }
            return store.commitPlan(goalId, sequence, total);
        });
    }

    static boolean satisfies(Set<String> facts, Set<String> conditions) {
        return unmet(facts, conditions) == 0;
    }

    static int unmet(Set<String> facts, Set<String> conditions) {
        int count = 0;
        for (String condition : conditions) {
            boolean met = condition.startsWith("!")
                    ? !facts.contains(condition.substring(1))
                    : facts.contains(condition);
            if (!met) {
                count++;
            }
        }
        return count;
    }

    private static List<GoapAction> path(Node node) {
        List<GoapAction> steps = new ArrayList<>();
        for (Node n = node; n.via() != null; n = n.parent()) {
            steps.add(n.via());
        }
        Collections.reverse(steps);
        return steps;
    }
}
