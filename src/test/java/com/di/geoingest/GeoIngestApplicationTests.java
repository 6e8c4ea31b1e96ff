package com.di.geoingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for GeoIngestApplication. A full context needs warehouse credentials, so only the
 * entry point is checked here.
 */
@DisplayName("GeoIngestApplication Tests")
class GeoIngestApplicationTests {

    @Test
    @DisplayName("Should have a public static main method")
    void testMainMethodExists() throws NoSuchMethodException {
        Method main = GeoIngestApplication.class.getMethod("main", String[].class);

        assertTrue(Modifier.isStatic(main.getModifiers()));
        assertTrue(Modifier.isPublic(main.getModifiers()));
    }
}
