package com.taxprep.fdg.config;

import org.junit.Test;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testBundledDefaults() {
        EngineConfig config = EngineConfig.load();
        assertEquals(2025, config.getTaxYear());
        assertEquals(256, config.getMaxEvaluationDepth());
        assertEquals(3, config.getSelectionLimit());
        assertTrue(config.isVerifyFieldLayout());
        assertEquals(1024, config.getRingBufferSize());
        assertEquals(7070, config.getApiPort());
    }

    @Test
    public void testOverridesAndUnknownKeys() {
        EngineConfig config = EngineConfig.load("form-graph-small.json");
        assertEquals(64, config.getMaxEvaluationDepth());
        assertEquals(2, config.getSelectionLimit());
        assertFalse(config.isVerifyFieldLayout());
        assertEquals(16, config.getRingBufferSize());
        assertEquals(0, config.getApiPort());
    }

    @Test
    public void testMissingResourceFallsBackToDefaults() {
        assertEquals(new EngineConfig(), EngineConfig.load("no-such-config.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingBufferMustBePowerOfTwo() {
        EngineConfig.load("form-graph-bad.json");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPortRange() {
        EngineConfig config = new EngineConfig();
        config.setApiPort(70000);
        config.validate();
    }
}
