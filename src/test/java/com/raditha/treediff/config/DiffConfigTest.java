package com.raditha.treediff.config;

import com.raditha.treediff.gram.LabelFunction;
import com.raditha.treediff.similarity.DistanceMetric;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffConfigTest {

    @Test
    void testPresetsAreOrderedByStrictness() {
        assertTrue(DiffConfig.strict().threshold() < DiffConfig.moderate().threshold());
        assertTrue(DiffConfig.moderate().threshold() < DiffConfig.lenient().threshold());
    }

    @Test
    void testForPreset() {
        assertEquals(DiffConfig.strict(), DiffConfig.forPreset("strict"));
        assertThrows(IllegalArgumentException.class, () -> DiffConfig.forPreset("unknown"));
    }

    @Test
    void testValidation() {
        DiffConfig m = DiffConfig.moderate();
        assertThrows(IllegalArgumentException.class, () -> m.withGramSizes(0, 3));
        assertThrows(IllegalArgumentException.class, () -> m.withDimension(0));
        assertThrows(IllegalArgumentException.class, () -> m.withThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new DiffConfig(2, 3, 64, 0.3, null,
                0.5, 16, 3, 0.5, LabelFunction.CATEGORY));
        assertThrows(IllegalArgumentException.class, () -> new DiffConfig(2, 3, 64, 0.3, DistanceMetric.COSINE,
                0.5, 0, 3, 0.5, LabelFunction.CATEGORY));
    }

    @Test
    void testNullLabelsDefaultToCategory() {
        DiffConfig config = new DiffConfig(2, 3, 64, 0.3, DistanceMetric.COSINE, 0.5, 16, 3, 0.5, null);
        assertEquals(LabelFunction.CATEGORY, config.labels());
    }

    @Test
    void testWithers() {
        DiffConfig config = DiffConfig.moderate().withThreshold(0.1).withGramSizes(1, 1).withDimension(8);
        assertEquals(0.1, config.threshold());
        assertEquals(1, config.p());
        assertEquals(8, config.dimension());
        assertEquals(DiffConfig.moderate().candidateLimit(), config.candidateLimit());
    }
}
