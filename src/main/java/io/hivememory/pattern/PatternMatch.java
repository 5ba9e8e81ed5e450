package io.hivememory.pattern;

/**
 * A similarity search hit; {@code similarity} is the cosine similarity to the query.
 */
public record PatternMatch(Pattern pattern, double similarity) {
}
