package com.github.jshook.cqllabs.lab;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LabSettingsTest {

    @Test
    public void testDefaults() {
        LabSettings settings = LabSettings.defaults();
        assertEquals("education", settings.keyspace());
        assertEquals(3, settings.replicationFactor());
        assertNull(settings.expectedNodes());
        assertEquals("education.user", settings.userTable());
    }

    @Test
    public void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new LabSettings("education; DROP", 3, null));
        assertThrows(IllegalArgumentException.class, () -> new LabSettings("1education", 3, null));
        assertThrows(IllegalArgumentException.class, () -> new LabSettings(null, 3, null));
        assertThrows(IllegalArgumentException.class, () -> new LabSettings("education", 0, null));
        assertThrows(IllegalArgumentException.class, () -> new LabSettings("education", 1, 0));
    }
}
