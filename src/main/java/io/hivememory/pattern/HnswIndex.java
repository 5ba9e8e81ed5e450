package io.hivememory.pattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;

/**
 * Hierarchical Navigable Small World graph over unit vectors, using cosine distance
 * ({@code 1 - dot}).
 *
 * <p>Search descends greedily from the top layer to layer 1, then runs a beam search
 * of width {@code ef} on layer 0. Inserts connect the new node on every layer up to its
 * random level, choosing neighbours with the diversity heuristic and pruning
 * neighbour lists that overflow. Removal leaves a tombstone: the node keeps routing
 * searches but is never returned.</p>
 *
 * <p>Not thread-safe. Callers serialize access.</p>
 */
public class HnswIndex {

    /** A search hit. */
    public record Neighbor(String id, double similarity) {
    }

    private record Candidate(int node, double distance) {
    }

    private static final Comparator<Candidate> NEAREST_FIRST = Comparator.comparingDouble(Candidate::distance);
    private static final Comparator<Candidate> FARTHEST_FIRST = NEAREST_FIRST.reversed();

    private final int dimension;
    private final int maxConnections;
    private final int maxConnectionsLayer0;
    private final int efConstruction;
    private final double levelMultiplier;
    private final Random random;

    private final List<String> ids = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();
    private final List<List<List<Integer>>> links = new ArrayList<>();
    private final Set<Integer> deleted = new HashSet<>();
    private final Map<String, Integer> nodeById = new HashMap<>();

    private int entryPoint = -1;
    private int maxLevel = -1;

    public HnswIndex(int dimension, int maxConnections, int efConstruction) {
        this(dimension, maxConnections, efConstruction, 42L);
    }

    public HnswIndex(int dimension, int maxConnections, int efConstruction, long seed) {
        this.dimension = dimension;
        this.maxConnections = maxConnections;
        this.maxConnectionsLayer0 = maxConnections * 2;
        this.efConstruction = efConstruction;
        this.levelMultiplier = 1.0 / Math.log(Math.max(2, maxConnections));
        this.random = new Random(seed);
    }

    /**
     * Adds {@code vector} under {@code id}. Re-adding a live id replaces its vector.
     */
    public void add(String id, float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException("Expected dimension " + dimension + ", got " + vector.length);
        }
        remove(id);

        int node = ids.size();
        int level = randomLevel();
        ids.add(id);
        vectors.add(vector);
        List<List<Integer>> layers = new ArrayList<>(level + 1);
        for (int l = 0; l <= level; l++) {
            layers.add(new ArrayList<>());
        }
        links.add(layers);
        nodeById.put(id, node);

        if (entryPoint < 0) {
            entryPoint = node;
            maxLevel = level;
            return;
        }

        int ep = entryPoint;
        for (int l = maxLevel; l > level; l--) {
            ep = greedyClosest(vector, ep, l);
        }
        for (int l = Math.min(level, maxLevel); l >= 0; l--) {
            List<Candidate> candidates = searchLayer(vector, ep, efConstruction, l);
            List<Integer> selected = selectNeighbors(candidates, maxConnections);
            layers.get(l).addAll(selected);
            for (int neighbor : selected) {
                connect(neighbor, node, l);
            }
            ep = candidates.get(0).node();
        }
        if (level > maxLevel) {
            maxLevel = level;
            entryPoint = node;
        }
    }

    /**
     * Tombstones {@code id}.
     *
     * @return true if a live node was removed
     */
    public boolean remove(String id) {
        Integer node = nodeById.remove(id);
        if (node == null) {
            return false;
        }
        deleted.add(node);
        return true;
    }

    public boolean contains(String id) {
        return nodeById.containsKey(id);
    }

    /** Ids of the live vectors. */
    public Set<String> ids() {
        return Set.copyOf(nodeById.keySet());
    }

    /** Number of live vectors. */
    public int size() {
        return nodeById.size();
    }

    /**
     * Up to {@code k} live nodes closest to {@code query}, most similar first.
     */
    public List<Neighbor> search(float[] query, int k, int ef) {
        List<Neighbor> result = new ArrayList<>();
        if (entryPoint < 0 || k <= 0 || nodeById.isEmpty()) {
            return result;
        }
        int ep = entryPoint;
        for (int l = maxLevel; l > 0; l--) {
            ep = greedyClosest(query, ep, l);
        }
        // Tombstones take beam slots, so widen the beam by their count.
        int beam = Math.max(ef, k) + Math.min(deleted.size(), ids.size());
        for (Candidate c : searchLayer(query, ep, beam, 0)) {
            if (deleted.contains(c.node())) {
                continue;
            }
            result.add(new Neighbor(ids.get(c.node()), 1.0 - c.distance()));
            if (result.size() == k) {
                break;
            }
        }
        return result;
    }

    private int randomLevel() {
        double u = 1.0 - random.nextDouble();
        return (int) Math.floor(-Math.log(u) * levelMultiplier);
    }

    private int greedyClosest(float[] query, int start, int level) {
        int current = start;
        double currentDistance = distance(query, current);
        boolean improved = true;
        while (improved) {
            improved = false;
            for (int neighbor : neighbors(current, level)) {
                double d = distance(query, neighbor);
                if (d < currentDistance) {
                    currentDistance = d;
                    current = neighbor;
                    improved = true;
                }
            }
        }
        return current;
    }

    /**
     * Beam search on one layer. Returns at most {@code ef} candidates, nearest first.
     */
    private List<Candidate> searchLayer(float[] query, int start, int ef, int level) {
        Set<Integer> visited = new HashSet<>();
        PriorityQueue<Candidate> frontier = new PriorityQueue<>(NEAREST_FIRST);
        PriorityQueue<Candidate> best = new PriorityQueue<>(FARTHEST_FIRST);

        Candidate first = new Candidate(start, distance(query, start));
        visited.add(start);
        frontier.add(first);
        best.add(first);

        while (!frontier.isEmpty()) {
            Candidate current = frontier.poll();
            if (best.size() >= ef && current.distance() > best.peek().distance()) {
                break;
            }
            for (int neighbor : neighbors(current.node(), level)) {
                if (!visited.add(neighbor)) {
                    continue;
                }
                double d = distance(query, neighbor);
                if (best.size() < ef || d < best.peek().distance()) {
                    Candidate next = new Candidate(neighbor, d);
                    frontier.add(next);
                    best.add(next);
                    if (best.size() > ef) {
                        best.poll();
                    }
                }
            }
        }

        List<Candidate> ordered = new ArrayList<>(best);
        ordered.sort(NEAREST_FIRST);
        return ordered;
    }

    /**
     * Diversity heuristic: a candidate is kept only if it is closer to the base than
     * to every neighbour kept so far. Remaining slots are filled with the closest
     * discarded candidates.
     */
    private List<Integer> selectNeighbors(List<Candidate> candidates, int max) {
        List<Integer> selected = new ArrayList<>();
        List<Integer> discarded = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (selected.size() >= max) {
                break;
            }
            boolean diverse = true;
            for (int kept : selected) {
                if (distance(vectors.get(candidate.node()), kept) < candidate.distance()) {
                    diverse = false;
                    break;
                }
            }
            if (diverse) {
                selected.add(candidate.node());
            } else {
                discarded.add(candidate.node());
            }
        }
        for (int i = 0; i < discarded.size() && selected.size() < max; i++) {
            selected.add(discarded.get(i));
        }
        return selected;
    }

    private void connect(int from, int to, int level) {
        List<Integer> neighborList = links.get(from).get(level);
        neighborList.add(to);
        int limit = level == 0 ? maxConnectionsLayer0 : maxConnections;
        if (neighborList.size() <= limit) {
            return;
        }
        float[] base = vectors.get(from);
        List<Candidate> candidates = new ArrayList<>(neighborList.size());
        for (int n : neighborList) {
            candidates.add(new Candidate(n, distance(base, n)));
        }
        candidates.sort(NEAREST_FIRST);
        List<Integer> pruned = selectNeighbors(candidates, limit);
        neighborList.clear();
        neighborList.addAll(pruned);
    }

    private List<Integer> neighbors(int node, int level) {
        List<List<Integer>> layers = links.get(node);
        return level < layers.size() ? layers.get(level) : List.of();
    }

    private double distance(float[] query, int node) {
        return 1.0 - PatternEmbedder.cosine(query, vectors.get(node));
    }
}
