package io.hivememory.pattern;

import java.util.List;
import java.util.Optional;

/**
 * Store of reusable patterns with similarity search. Near-duplicates within the same
 * (agentId, domain) scope are merged rather than stored twice.
 */
public interface PatternBank {

    /**
     * Stores {@code content}, or merges it into the nearest existing pattern of the same
     * scope when their cosine similarity reaches the configured threshold.
     *
     * @throws io.hivememory.core.ValidationException blank content or confidence outside [0, 1]
     */
    PatternStoreResult storePattern(String content, double confidence, String agentId, String domain,
                                    Double successRate);

    default PatternStoreResult storePattern(String content, double confidence, String agentId, String domain) {
        return storePattern(content, confidence, agentId, domain, null);
    }

    /**
     * Patterns of {@code domain}, ordered by success rate (unknown last), then confidence.
     */
    List<Pattern> queryPatternsByDomain(String domain);

    /**
     * Patterns of {@code agentId}, ordered like {@link #queryPatternsByDomain}.
     */
    List<Pattern> queryPatternsByAgent(String agentId);

    /**
     * Up to {@code k} patterns of the scope most similar to {@code content}.
     */
    List<PatternMatch> searchSimilar(String content, int k, String agentId, String domain);

    Optional<Pattern> getPattern(String id);

    /**
     * Folds one observed outcome into the pattern's success rate.
     */
    Optional<Pattern> recordOutcome(String id, boolean success);

    boolean deletePattern(String id);

    long countPatterns();
}
