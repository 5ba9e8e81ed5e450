package io.hivememory.pattern;

/**
 * A reusable piece of knowledge with its embedding.
 *
 * @param id          pattern id
 * @param content     pattern text
 * @param embedding   unit-length vector derived from {@code content}
 * @param confidence  confidence in [0, 1]
 * @param usageCount  times stored or merged into
 * @param successRate observed success rate in [0, 1], null until known
 * @param agentId     owning agent, null for shared patterns
 * @param domain      domain, null when unscoped
 * @param createdAt   epoch millis
 * @param updatedAt   epoch millis
 */
public record Pattern(
        String id,
        String content,
        float[] embedding,
        double confidence,
        long usageCount,
        Double successRate,
        String agentId,
        String domain,
        long createdAt,
        long updatedAt
) {

    /**
     * Key of the ANN index and consolidation scope this pattern belongs to.
     */
    public String scopeKey() {
        return scopeKey(agentId, domain);
    }

    public static String scopeKey(String agentId, String domain) {
        return (agentId == null ? "" : agentId) + "|" + (domain == null ? "" : domain);
    }
}
