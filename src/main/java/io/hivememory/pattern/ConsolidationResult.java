package io.hivememory.pattern;

/**
 * Summary of one consolidation run.
 *
 * @param scopesScanned     (agentId, domain) scopes visited
 * @param patternsScanned   patterns read
 * @param clustersMerged    clusters with at least one member folded into a representative
 * @param patternsRemoved   member rows deleted
 * @param durationMs        wall time of the run
 */
public record ConsolidationResult(
        int scopesScanned,
        int patternsScanned,
        int clustersMerged,
        int patternsRemoved,
        long durationMs
) {
}
