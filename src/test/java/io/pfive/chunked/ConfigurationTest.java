// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationTest {

    @Test
    void bundledDefaults () {
        assertEquals(4, Configuration.WORKER_THREADS);
        assertEquals(3, Configuration.MAX_DELIVERIES);
        assertEquals(1.0, Configuration.FRAME_DURATION_SEC);
        assertEquals(0xC0C0C0, Configuration.FRAME_FILL_RGB);
        assertEquals("library/tasks", Configuration.STORE_PATH);
    }

    @Test
    void productPrefixes () {
        assertEquals("ls8_lasrc_", Configuration.productPrefix("LANDSAT_8"));
        assertTrue(Configuration.hasProductPrefix("LANDSAT_7"));
        assertFalse(Configuration.hasProductPrefix("SENTINEL_2"));
        assertThrows(RuntimeException.class, () -> Configuration.productPrefix("SENTINEL_2"));
    }

}
