package com.netmotif.io;

import org.junit.Test;

import static org.junit.Assert.*;

public class PipelineConfigTest {

    @Test
    public void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();
        assertEquals(1_000_000, config.getMaxNodeCount());
        assertEquals(5_000_000, config.getMaxEdgeCount());
        assertTrue(config.isWarnOnRebinding());
        assertTrue(config.isPrettyPrint());
    }

    @Test
    public void testLoadFromClasspath() {
        assertEquals(PipelineConfig.defaults(), PipelineConfig.load());
    }

    @Test
    public void testPartialDocumentKeepsDefaults() {
        PipelineConfig config = PipelineConfig.fromJson("{\"maxNodeCount\": 10, \"somethingElse\": true}");
        assertEquals(10, config.getMaxNodeCount());
        assertEquals(5_000_000, config.getMaxEdgeCount());
        assertTrue(config.isPrettyPrint());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedDocument() {
        PipelineConfig.fromJson("{maxNodeCount: ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeLimitBeyondIntRangeRejected() {
        PipelineConfig.fromJson("{\"maxNodeCount\": 5000000000, \"maxEdgeCount\": 20000000000}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeLimitAboveCeilingRejected() {
        PipelineConfig.fromJson("{\"maxEdgeCount\": " + (PipelineConfig.EDGE_LIMIT_CEILING + 1L) + "}");
    }

    @Test
    public void testNonPositiveLimitsRejected() {
        for (String json : new String[] { "{\"maxNodeCount\": -1}", "{\"maxNodeCount\": 0}",
                "{\"maxEdgeCount\": 0}" }) {
            try {
                PipelineConfig.fromJson(json);
                fail("Expected rejection of " + json);
            } catch (IllegalArgumentException expected) {
                assertTrue(expected.getMessage(), expected.getMessage().contains("must be in 1.."));
            }
        }
    }

    @Test
    public void testLimitsAtCeilingAccepted() {
        PipelineConfig config = PipelineConfig.defaults();
        config.setMaxNodeCount(PipelineConfig.NODE_LIMIT_CEILING);
        config.setMaxEdgeCount(PipelineConfig.EDGE_LIMIT_CEILING);
        assertSame(config, config.validate());
    }
}
