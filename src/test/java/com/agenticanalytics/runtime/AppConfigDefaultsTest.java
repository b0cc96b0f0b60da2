package com.agenticanalytics.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToFallbackReadyLocalSetup() {
        AppConfig config = new AppConfig();

        assertNull(config.getEmbedding().getEndpoint());
        assertEquals(384, config.getEmbedding().getFallbackDimension());
        assertEquals(32, config.getEmbedding().getBatchSize());
        assertEquals("auto", config.getIndex().getBackend());
        assertEquals(5, config.getIndex().getDefaultTopK());
        assertEquals(1.3f, config.getRerank().getBoostFactors().get("metric"));
        assertEquals(0.9f, config.getRerank().getBoostFactors().get("relationship"));
        assertTrue(config.getCache().isEnabled());
        assertEquals(0.95f, config.getCache().getSimilarityThreshold());
        assertEquals(1000, config.getCache().getMaxEntries());
        assertNull(config.getCache().getTtl());
        assertTrue(config.getTelemetry().isEnabled());
    }
}
