package org.hexregion.core.generation;

import static org.junit.jupiter.api.Assertions.*;

import org.hexregion.core.TestRegions;
import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.SpecialFeature;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.util.CancellationToken;
import org.junit.jupiter.api.Test;

public class FeatureGeneratorTest {

    private static GenerationContext contextFor(RegionData region) {
        return new GenerationContext(region, new GeneratorSettings(1), CancellationToken.none());
    }

    @Test
    void testEveryPlainsCellGetsSettlement() {
        RegionData region = TestRegions.flatPlains(10, 10);
        TestRegions.makeWater(region, 0, 0, TerrainType.OCEAN);
        assertTrue(region.setOutgoingRiver(5, 5, HexDirection.E));

        new FeatureGenerator().generate(region, 1, 1.0, 0.0, CancellationToken.none());

        for (CellData c : region.cells()) {
            if (c.isUnderwater() || c.hasRiver()) {
                assertEquals(0, c.urbanLevel, "no settlement expected at " + c);
                assertEquals(0, c.plantLevel);
                continue;
            }
            assertTrue(c.urbanLevel >= 1 && c.urbanLevel <= 3);
            assertEquals(c.urbanLevel == 3, c.walled);
        }
        Validation.afterFeatures(contextFor(region));
    }

    @Test
    void testSpecialsByTerrain() {
        RegionData desert = TestRegions.flat(6, 6, 6, TerrainType.DESERT);
        new FeatureGenerator().generate(desert, 2, 0.0, 1.0, CancellationToken.none());
        for (CellData c : desert.cells()) {
            assertEquals(SpecialFeature.ZIGGURAT, c.special());
        }

        RegionData highPlains = TestRegions.flat(6, 6, 8, TerrainType.PLAINS);
        new FeatureGenerator().generate(highPlains, 2, 1.0, 1.0, CancellationToken.none());
        for (CellData c : highPlains.cells()) {
            assertEquals(SpecialFeature.CASTLE, c.special());
            assertEquals(0, c.urbanLevel);
        }
        Validation.afterFeatures(contextFor(highPlains));

        RegionData jungle = TestRegions.flat(6, 6, 6, TerrainType.JUNGLE);
        for (CellData c : jungle.cells()) c.moisture = 0.95f;
        new FeatureGenerator().generate(jungle, 2, 0.0, 1.0, CancellationToken.none());
        for (CellData c : jungle.cells()) {
            assertEquals(SpecialFeature.MEGAFLORA, c.special());
            assertEquals(0, c.plantLevel);
        }

        RegionData lowPlains = TestRegions.flatPlains(6, 6);
        new FeatureGenerator().generate(lowPlains, 2, 0.0, 1.0, CancellationToken.none());
        for (CellData c : lowPlains.cells()) {
            assertFalse(c.isSpecial());
        }
    }

    @Test
    void testRerunResetsPreviousFeatures() {
        RegionData region = TestRegions.flat(6, 6, 6, TerrainType.DESERT);
        new FeatureGenerator().generate(region, 2, 0.0, 1.0, CancellationToken.none());
        new FeatureGenerator().generate(region, 2, 0.0, 0.0, CancellationToken.none());
        for (CellData c : region.cells()) {
            assertFalse(c.isSpecial());
        }
    }

    @Test
    void testSnowIsNeverSettled() {
        RegionData region = TestRegions.flat(6, 6, 12, TerrainType.SNOW);
        new FeatureGenerator().generate(region, 4, 1.0, 1.0, CancellationToken.none());
        for (CellData c : region.cells()) {
            assertEquals(0, c.urbanLevel);
            assertEquals(0, c.plantLevel);
            assertFalse(c.isSpecial());
        }
    }
}
