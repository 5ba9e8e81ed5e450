package io.hivememory.pattern;

import java.util.HashSet;
import java.util.List;

/**
 * Scores how good a pattern is as the representative of a cluster of near-duplicates.
 *
 * <p>Weighted sum in [0, 1]: readability 0.15, completeness 0.20, specificity 0.15,
 * reusability 0.20, success rate 0.30. An unknown success rate counts as 0.5.</p>
 */
public final class PatternQuality {

    static final double READABILITY_WEIGHT = 0.15;
    static final double COMPLETENESS_WEIGHT = 0.20;
    static final double SPECIFICITY_WEIGHT = 0.15;
    static final double REUSABILITY_WEIGHT = 0.20;
    static final double SUCCESS_WEIGHT = 0.30;

    private static final double IDEAL_WORD_LENGTH = 5.5;
    private static final int COMPLETE_WORD_COUNT = 20;
    private static final int SATURATED_USAGE = 10;

    private PatternQuality() {
    }

    public static double score(Pattern pattern) {
        List<String> tokens = PatternEmbedder.tokenize(pattern.content());
        double successRate = pattern.successRate() == null ? 0.5 : pattern.successRate();
        return READABILITY_WEIGHT * readability(tokens)
                + COMPLETENESS_WEIGHT * completeness(tokens)
                + SPECIFICITY_WEIGHT * specificity(tokens)
                + REUSABILITY_WEIGHT * reusability(pattern.usageCount())
                + SUCCESS_WEIGHT * clamp(successRate);
    }

    static double readability(List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0;
        }
        double totalLength = 0;
        for (String token : tokens) {
            totalLength += token.length();
        }
        double average = totalLength / tokens.size();
        return clamp(1.0 - Math.abs(average - IDEAL_WORD_LENGTH) / 10.0);
    }

    static double completeness(List<String> tokens) {
        return clamp((double) tokens.size() / COMPLETE_WORD_COUNT);
    }

    /** Share of distinct words. */
    static double specificity(List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0;
        }
        return (double) new HashSet<>(tokens).size() / tokens.size();
    }

    static double reusability(long usageCount) {
        return clamp(Math.log1p(Math.max(0, usageCount)) / Math.log1p(SATURATED_USAGE));
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
