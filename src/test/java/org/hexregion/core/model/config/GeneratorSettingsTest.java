package org.hexregion.core.model.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class GeneratorSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("region.width");
        System.clearProperty("region.name");
        System.clearProperty("region.validation");
        System.clearProperty("region.landFraction");
    }

    @Test
    void testDefaultsAreValid() {
        GeneratorSettings s = new GeneratorSettings(3);
        assertEquals(3, s.seed);
        assertEquals(RegionConfig.DEFAULT_WIDTH, s.width);
        assertEquals(RegionConfig.DEFAULT_HEIGHT, s.height);
        assertDoesNotThrow(s::validate);
    }

    @Test
    void testSizeBounds() {
        GeneratorSettings s = new GeneratorSettings(1);
        s.width = RegionConfig.MIN_SIZE;
        s.height = RegionConfig.MAX_SIZE;
        assertDoesNotThrow(s::validate);

        s.width = RegionConfig.MIN_SIZE - 1;
        assertThrows(IllegalArgumentException.class, s::validate);

        s.width = 100;
        s.height = RegionConfig.MAX_SIZE + 1;
        assertThrows(IllegalArgumentException.class, s::validate);
    }

    @Test
    void testFractionsAndCounts() {
        GeneratorSettings s = new GeneratorSettings(1);
        s.landFraction = 1.5;
        assertThrows(IllegalArgumentException.class, s::validate);

        s = new GeneratorSettings(1);
        s.riverFraction = Double.NaN;
        assertThrows(IllegalArgumentException.class, s::validate);

        s = new GeneratorSettings(1);
        s.landNoiseOctaves = 0;
        assertThrows(IllegalArgumentException.class, s::validate);

        s = new GeneratorSettings(1);
        s.maxRoadDistance = 0;
        assertThrows(IllegalArgumentException.class, s::validate);
    }

    @Test
    void testPickHelpers() {
        assertNull(GeneratorSettings.pick((String) null, "  "));
        assertEquals("b", GeneratorSettings.pick(null, " b ", "c"));
        assertEquals(7, GeneratorSettings.pickInt(7, (String) null));
        assertEquals(12, GeneratorSettings.pickInt(7, "12"));
        assertEquals(0.25, GeneratorSettings.pickDouble(1.0, "0.25"));
        assertThrows(IllegalArgumentException.class, () -> GeneratorSettings.pickInt(7, "abc"));
        assertThrows(IllegalArgumentException.class, () -> GeneratorSettings.pickDouble(1.0, "x"));
    }

    @Test
    void testSystemPropertyOverrides() {
        System.setProperty("region.width", "120");
        System.setProperty("region.name", "Override");
        System.setProperty("region.validation", "false");
        System.setProperty("region.landFraction", "0.7");

        GeneratorSettings s = new GeneratorSettings(1);
        s.applyOverridesFromSystem();
        assertEquals(120, s.width);
        assertEquals("Override", s.name);
        assertFalse(s.validation);
        assertEquals(0.7, s.landFraction);
    }
}
