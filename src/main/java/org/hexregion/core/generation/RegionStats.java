package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.SpecialFeature;
import org.hexregion.core.model.TerrainType;

import java.util.EnumMap;
import java.util.Map;

public class RegionStats {

    public int cellCount;
    public int landCount;
    public int waterCount;

    // elevation
    public int elevationMin = Integer.MAX_VALUE;
    public int elevationMax = Integer.MIN_VALUE;
    public double elevationAvg;

    // moisture
    public double moistureMin = Double.POSITIVE_INFINITY;
    public double moistureMax = Double.NEGATIVE_INFINITY;
    public double moistureAvg;

    public final Map<TerrainType, Integer> terrainCounts = new EnumMap<>(TerrainType.class);
    public final Map<SpecialFeature, Integer> specialCounts = new EnumMap<>(SpecialFeature.class);

    // rivers
    public int riverCellCount;
    public int riverSourceCount;

    // roads: каждое ребро считаем один раз
    public int roadEdgeCount;
    public int settlementCount;

    public static RegionStats compute(RegionData region) {
        RegionStats s = new RegionStats();
        s.cellCount = region.cellCount();

        long elevSum = 0;
        double moistSum = 0;
        int roadBits = 0;

        for (CellData c : region.cells()) {
            s.terrainCounts.merge(TerrainType.fromIndex(c.terrainTypeIndex), 1, Integer::sum);
            if (c.isSpecial()) {
                s.specialCounts.merge(SpecialFeature.fromIndex(c.specialIndex), 1, Integer::sum);
            }

            if (c.isUnderwater()) s.waterCount++;
            else s.landCount++;

            s.elevationMin = Math.min(s.elevationMin, c.elevation);
            s.elevationMax = Math.max(s.elevationMax, c.elevation);
            elevSum += c.elevation;

            s.moistureMin = Math.min(s.moistureMin, c.moisture);
            s.moistureMax = Math.max(s.moistureMax, c.moisture);
            moistSum += c.moisture;

            if (c.hasRiver()) s.riverCellCount++;
            if (c.hasOutgoingRiver && !c.hasIncomingRiver) s.riverSourceCount++;

            roadBits += c.roadCount();
            if (isSettlement(c)) s.settlementCount++;
        }

        if (s.cellCount > 0) {
            s.elevationAvg = elevSum / (double) s.cellCount;
            s.moistureAvg = moistSum / s.cellCount;
        }
        s.roadEdgeCount = roadBits / 2;
        return s;
    }

    public double landRatio() {
        return cellCount == 0 ? 0.0 : landCount / (double) cellCount;
    }

    static boolean isSettlement(CellData c) {
        if (c.isUnderwater()) return false;
        if (c.specialIndex == SpecialFeature.MEGAFLORA.index()) return false;
        return c.urbanLevel >= 2 || SpecialFeature.fromIndex(c.specialIndex).isSettlement();
    }
}
