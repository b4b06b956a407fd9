package org.hexregion.core.generation;

import org.hexregion.core.model.SpecialFeature;
import org.hexregion.core.model.TerrainType;

import java.util.Locale;
import java.util.Map;

public final class RegionStatsReport {

    private RegionStatsReport() {}

    public static void print(RegionStats s) {
        System.out.println("========== REGION STATS ==========");
        System.out.println("Cells: " + s.cellCount
                + " | land=" + s.landCount
                + " water=" + s.waterCount
                + String.format(Locale.ROOT, " (land %.1f%%)", s.landRatio() * 100.0));

        System.out.println(String.format(Locale.ROOT,
                "Elevation: min=%d max=%d avg=%.2f", s.elevationMin, s.elevationMax, s.elevationAvg));
        System.out.println(String.format(Locale.ROOT,
                "Moisture:  min=%.3f max=%.3f avg=%.3f", s.moistureMin, s.moistureMax, s.moistureAvg));

        System.out.println("Terrain:");
        for (Map.Entry<TerrainType, Integer> e : s.terrainCounts.entrySet()) {
            System.out.println("  " + e.getKey() + ": " + e.getValue());
        }
        if (!s.specialCounts.isEmpty()) {
            System.out.println("Specials:");
            for (Map.Entry<SpecialFeature, Integer> e : s.specialCounts.entrySet()) {
                System.out.println("  " + e.getKey() + ": " + e.getValue());
            }
        }

        System.out.println("Rivers: cells=" + s.riverCellCount + " sources=" + s.riverSourceCount);
        System.out.println("Roads:  edges=" + s.roadEdgeCount + " settlements=" + s.settlementCount);
        System.out.println("==================================");
    }
}
