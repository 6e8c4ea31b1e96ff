package com.di.geoingest.warehouse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableRef Tests")
class TableRefTest {

    @Test
    @DisplayName("Full ids keep their project")
    void testParse_Full() {
        TableRef ref = TableRef.parse("analytics.gis.roads", "fallback");

        assertEquals("analytics", ref.project());
        assertEquals("gis", ref.dataset());
        assertEquals("roads", ref.table());
        assertEquals("analytics.gis.roads", ref.toString());
        assertEquals("analytics.gis", ref.datasetId());
    }

    @Test
    @DisplayName("Short ids take the default project and backticks are ignored")
    void testParse_Short() {
        assertEquals(new TableRef("fallback", "gis", "roads"), TableRef.parse("gis.roads", "fallback"));
        assertEquals(new TableRef("p", "gis", "roads"), TableRef.parse("`p.gis.roads`", null));
    }

    @Test
    @DisplayName("Should reject ids that cannot be resolved")
    void testParse_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> TableRef.parse("gis.roads", null));
        assertThrows(IllegalArgumentException.class, () -> TableRef.parse("roads", "fallback"));
        assertThrows(IllegalArgumentException.class, () -> TableRef.parse(" ", "fallback"));
    }
}
