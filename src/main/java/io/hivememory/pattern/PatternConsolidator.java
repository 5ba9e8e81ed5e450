package io.hivememory.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds near-duplicate patterns of each (agentId, domain) scope into a single
 * representative.
 *
 * <p>Patterns are ranked by {@link PatternQuality} (ties: earliest created, then smallest
 * id). Walking that order, each pattern not yet claimed becomes a representative and
 * claims every unclaimed pattern whose similarity to it reaches the threshold. Each
 * cluster is merged under the bank lock on its own, so concurrent stores wait at most
 * one cluster merge. Representatives keep their embedding, which makes a second run
 * a no-op.</p>
 *
 * <p>A failing scope is logged and skipped; {@link #consolidate()} never throws and
 * reports what the completed scopes did.</p>
 */
@Component
public class PatternConsolidator {

    private static final Logger log = LoggerFactory.getLogger(PatternConsolidator.class);

    private final SQLitePatternBank bank;

    public PatternConsolidator(SQLitePatternBank bank) {
        this.bank = bank;
    }

    public ConsolidationResult consolidate() {
        long start = System.currentTimeMillis();
        int scopes = 0;
        int scanned = 0;
        int clusters = 0;
        int removed = 0;

        List<String[]> scopeList;
        try {
            scopeList = bank.listScopes();
        } catch (RuntimeException e) {
            log.error("Pattern consolidation aborted: scopes could not be listed", e);
            scopeList = List.of();
        }
        for (String[] scope : scopeList) {
            scopes++;
            try {
                List<Pattern> patterns = bank.patternsInScope(scope[0], scope[1]);
                scanned += patterns.size();
                for (Map.Entry<String, List<String>> cluster
                        : cluster(patterns, bank.similarityThreshold()).entrySet()) {
                    int merged = bank.mergeCluster(cluster.getKey(), cluster.getValue());
                    if (merged > 0) {
                        clusters++;
                        removed += merged;
                    }
                }
            } catch (RuntimeException e) {
                log.error("Pattern consolidation of scope ({}, {}) failed", scope[0], scope[1], e);
            }
        }

        long duration = System.currentTimeMillis() - start;
        log.info("Pattern consolidation: {} scopes, {} patterns scanned, {} clusters merged, {} removed in {}ms",
                scopes, scanned, clusters, removed, duration);
        return new ConsolidationResult(scopes, scanned, clusters, removed, duration);
    }

    /**
     * Greedy clustering. Returns representative id to member ids, only for clusters
     * that have members.
     */
    static Map<String, List<String>> cluster(List<Pattern> patterns, double threshold) {
        Map<String, Double> quality = new HashMap<>();
        for (Pattern p : patterns) {
            quality.put(p.id(), PatternQuality.score(p));
        }
        List<Pattern> ranked = new ArrayList<>(patterns);
        ranked.sort(Comparator.<Pattern>comparingDouble(p -> quality.get(p.id())).reversed()
                .thenComparingLong(Pattern::createdAt)
                .thenComparing(Pattern::id));

        Map<String, List<String>> clusters = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (int i = 0; i < ranked.size(); i++) {
            Pattern representative = ranked.get(i);
            if (!claimed.add(representative.id())) {
                continue;
            }
            List<String> members = new ArrayList<>();
            for (int j = i + 1; j < ranked.size(); j++) {
                Pattern candidate = ranked.get(j);
                if (claimed.contains(candidate.id())) {
                    continue;
                }
                if (PatternEmbedder.cosine(representative.embedding(), candidate.embedding()) >= threshold) {
                    if (quality.get(candidate.id()).doubleValue() == quality.get(representative.id()).doubleValue()) {
                        log.debug("Equal-quality patterns '{}' and '{}', keeping the earlier '{}'",
                                representative.id(), candidate.id(), representative.id());
                    }
                    claimed.add(candidate.id());
                    members.add(candidate.id());
                }
            }
            if (!members.isEmpty()) {
                clusters.put(representative.id(), members);
            }
        }
        return clusters;
    }
}
