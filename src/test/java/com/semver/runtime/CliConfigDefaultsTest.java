package com.semver.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliConfigDefaultsTest {

    @Test
    void shouldDefaultToPrettyTextOutput() {
        CliConfig config = new CliConfig();

        assertEquals("text", config.getOutput().getFormat());
        assertTrue(config.getOutput().isPrettyPrint());
    }

    @Test
    void shouldReplaceMissingSectionsWithDefaults() {
        CliConfig config = new CliConfig();
        config.setOutput(null);
        config.getOutput().setFormat(" ");

        assertNotNull(config.getOutput());
        assertEquals("text", config.getOutput().getFormat());
    }
}
