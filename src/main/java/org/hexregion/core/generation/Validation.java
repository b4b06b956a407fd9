package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RoadRules;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.topology.HexMetrics;

public final class Validation {

    private Validation() {}

    public static void afterLand(GenerationContext ctx) {
        int land = 0;
        for (CellData c : ctx.region.cells()) {
            if (!HexMetrics.isValidElevation(c.elevation)) {
                throw new IllegalStateException("Elevation out of range after Land for " + c + ": " + c.elevation);
            }
            if (c.waterLevel != HexMetrics.LAND_MIN_ELEVATION) {
                throw new IllegalStateException("Unexpected water level after Land for " + c + ": " + c.waterLevel);
            }
            if (!c.isUnderwater()) land++;
        }
        double f = ctx.settings.landFraction;
        if (f > 0.0 && f < 1.0 && (land == 0 || land == ctx.region.cellCount())) {
            System.out.println("[WARN] Land stage produced no " + (land == 0 ? "land" : "water")
                    + " for landFraction=" + f);
        }
    }

    public static void afterClimate(GenerationContext ctx) {
        for (CellData c : ctx.region.cells()) {
            if (Float.isNaN(c.moisture) || c.moisture < 0f || c.moisture > 1f) {
                throw new IllegalStateException("Moisture out of [0,1] for " + c + ": " + c.moisture);
            }
        }
    }

    public static void afterBiomes(GenerationContext ctx) {
        for (CellData c : ctx.region.cells()) {
            if (!TerrainType.isValidIndex(c.terrainTypeIndex)) {
                throw new IllegalStateException("Invalid terrain index for " + c + ": " + c.terrainTypeIndex);
            }
            if (c.isUnderwater() != c.terrainType().isWater()) {
                throw new IllegalStateException("Terrain " + c.terrainType() + " does not match water state of " + c);
            }
        }
    }

    public static void afterRivers(GenerationContext ctx) {
        checkRivers(ctx.region);
    }

    public static void afterFeatures(GenerationContext ctx) {
        for (CellData c : ctx.region.cells()) {
            if (c.urbanLevel < 0 || c.urbanLevel > 3 || c.farmLevel < 0 || c.farmLevel > 3
                    || c.plantLevel < 0 || c.plantLevel > 3) {
                throw new IllegalStateException("Feature level out of [0,3] for " + c);
            }
            if (c.isSpecial() && (c.urbanLevel | c.farmLevel | c.plantLevel) != 0) {
                throw new IllegalStateException("Special cell keeps density levels: " + c);
            }
            if (c.isUnderwater() && (c.isSpecial() || c.urbanLevel > 0)) {
                throw new IllegalStateException("Feature placed under water: " + c);
            }
        }
    }

    public static void afterRoads(GenerationContext ctx) {
        checkRoads(ctx.region);
    }

    /**
     * Реки не текут вверх, каждому исходящему соответствует сосед с рекой на том же ребре
     * (входящей, либо слиянием с уже существующей рекой).
     */
    public static void checkRivers(RegionData region) {
        for (CellData c : region.cells()) {
            if (!c.hasOutgoingRiver) continue;
            HexDirection dir = HexDirection.fromIndex(c.outgoingRiverDirection);
            CellData n = region.getNeighbor(c, dir);
            if (n == null) {
                throw new IllegalStateException("River leaves the region at " + c + " dir=" + dir);
            }
            if (n.elevation > c.elevation) {
                throw new IllegalStateException("River flows uphill: " + c + " -> " + n);
            }
            if (!n.hasIncomingRiver) {
                throw new IllegalStateException("River target has no incoming river: " + c + " -> " + n);
            }
            if (c.hasIncomingRiver && c.incomingRiverDirection == c.outgoingRiverDirection) {
                throw new IllegalStateException("River enters and leaves through the same edge: " + c);
            }
        }
    }

    /** Симметрия маски дорог и правила размещения на каждом ребре. */
    public static void checkRoads(RegionData region) {
        for (CellData c : region.cells()) {
            if ((c.roadMask & ~0x3F) != 0) {
                throw new IllegalStateException("Road mask has bits above 5: " + c);
            }
            for (HexDirection d : HexDirection.values()) {
                if (!c.hasRoad(d)) continue;
                CellData n = region.getNeighbor(c, d);
                if (n == null) {
                    throw new IllegalStateException("Road leaves the region at " + c + " dir=" + d);
                }
                if (!n.hasRoad(d.opposite())) {
                    throw new IllegalStateException("Asymmetric road " + c + " -> " + n);
                }
                if (!RoadRules.canPlaceRoad(c, n, d)) {
                    throw new IllegalStateException("Road violates placement rules: " + c + " -> " + n);
                }
            }
        }
    }
}
