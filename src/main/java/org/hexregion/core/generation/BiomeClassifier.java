package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.topology.HexMetrics;

/**
 * Тип местности по высоте над уровнем суши и влажности.
 */
public class BiomeClassifier {

    public void apply(RegionData region) {
        for (CellData c : region.cells()) {
            c.terrainTypeIndex = classify(c).index();
        }
    }

    public static TerrainType classify(CellData c) {
        if (c.isUnderwater()) {
            return c.elevation < HexMetrics.SEA_LEVEL - 2 ? TerrainType.OCEAN : TerrainType.COAST;
        }
        int h = c.elevation - HexMetrics.LAND_MIN_ELEVATION;
        double m = c.moisture;

        if (h >= 6) return TerrainType.SNOW;
        if (h >= 4) return TerrainType.MOUNTAINS;
        if (m < 0.2) return TerrainType.DESERT;
        if (m < 0.4) return h >= 2 ? TerrainType.HILLS : TerrainType.SAVANNA;
        if (m < 0.6) return TerrainType.PLAINS;
        if (m < 0.8) return TerrainType.FOREST;
        return TerrainType.JUNGLE;
    }
}
