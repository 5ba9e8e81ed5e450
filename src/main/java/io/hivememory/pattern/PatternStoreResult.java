package io.hivememory.pattern;

/**
 * Outcome of {@link PatternBank#storePattern}: the stored pattern and whether the
 * content was merged into an existing near-duplicate.
 */
public record PatternStoreResult(Pattern pattern, boolean merged) {
}
