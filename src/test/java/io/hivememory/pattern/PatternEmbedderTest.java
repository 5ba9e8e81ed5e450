package io.hivememory.pattern;

import io.hivememory.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternEmbedderTest {

    private final PatternEmbedder embedder = new PatternEmbedder(256);

    @Test
    void shouldBeDeterministicAndUnitLength() {
        float[] a = embedder.embed("Retry the request with exponential backoff");
        float[] b = embedder.embed("retry the request, with exponential backoff!");

        assertArrayEquals(a, b);
        assertEquals(1.0, PatternEmbedder.cosine(a, a), 1e-5);
    }

    @Test
    void similarTextShouldScoreHigherThanUnrelatedText() {
        float[] base = embedder.embed("retry the request with exponential backoff");
        float[] near = embedder.embed("retry the request with exponential backoff and jitter");
        float[] far = embedder.embed("parse invoice totals from scanned pdf documents");

        assertTrue(PatternEmbedder.cosine(base, near) > 0.7);
        assertTrue(PatternEmbedder.cosine(base, far) < PatternEmbedder.cosine(base, near));
    }

    @Test
    void punctuationOnlyContentShouldStillNormalize() {
        float[] vector = embedder.embed("!!!");
        assertEquals(1.0f, vector[0]);
    }

    @Test
    void shouldRejectBlankContent() {
        assertThrows(ValidationException.class, () -> embedder.embed("   "));
        assertThrows(ValidationException.class, () -> embedder.embed(null));
    }

    @Test
    void shouldTokenizeOnWhitespaceAndPunctuation() {
        assertEquals(List.of("use", "a", "cache", "v2"), PatternEmbedder.tokenize("Use a-cache (v2)"));
    }
}
