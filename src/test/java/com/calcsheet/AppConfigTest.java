package com.calcsheet;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaults() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[0]);
        assertEquals(AppConfig.DEFAULT_PORT, builder.getPreferredPort());
        assertEquals(AppConfig.DEFAULT_UNIT_TIMEOUT_MS, builder.getUnitCheckTimeoutMs());
        assertFalse(builder.isDevMode());
    }

    @Test
    void parsesBothArgumentStyles() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[] {
            "--port", "9090", "--compute-url=http://compute:9000", "--unit-timeout-ms=2500", "--dev"});
        assertEquals(9090, builder.getPreferredPort());
        assertEquals("http://compute:9000", builder.resolveComputeUrl());
        assertEquals(2500, builder.getUnitCheckTimeoutMs());
        assertTrue(builder.isDevMode());
    }

    @Test
    void invalidNumbersAreIgnored() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[] {
            "--port=abc", "--unit-timeout-ms", "-5"});
        assertEquals(AppConfig.DEFAULT_PORT, builder.getPreferredPort());
        assertEquals(AppConfig.DEFAULT_UNIT_TIMEOUT_MS, builder.getUnitCheckTimeoutMs());
    }

    @Test
    void explicitComputeUrlWinsOverEnvironment() {
        AppConfig.Builder builder = new AppConfig.Builder().computeUrl("  http://sidecar:8000 ");
        assertEquals("http://sidecar:8000", builder.resolveComputeUrl());
        assertEquals("http://localhost:8000", AppConfig.DEFAULT_COMPUTE_URL);
    }
}
