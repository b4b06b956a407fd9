package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.topology.HexEdgeType;
import org.hexregion.core.topology.HexMetrics;

public class LandMovementCost implements MovementCostFunction {

    static final double UPHILL_COST_PER_LEVEL = 0.5;
    static final double RIVER_CROSSING_COST = 1.0;

    public static double terrainCost(TerrainType terrain) {
        return switch (terrain) {
            case PLAINS, COAST, DESERT, SAVANNA -> 1.0;
            case FOREST, TAIGA, TUNDRA -> 1.5;
            case JUNGLE, HILLS -> 2.0;
            case SNOW -> 2.5;
            case MOUNTAINS, OCEAN -> Double.POSITIVE_INFINITY;
        };
    }

    @Override
    public boolean isPassable(CellData cell) {
        return !cell.isUnderwater() && Double.isFinite(terrainCost(cell.terrainType()));
    }

    @Override
    public double stepCost(CellData from, CellData to, HexDirection direction) {
        if (!isPassable(to)) {
            return Double.POSITIVE_INFINITY;
        }
        if (HexMetrics.edgeType(from.elevation, to.elevation) == HexEdgeType.CLIFF) {
            return Double.POSITIVE_INFINITY;
        }
        double cost = terrainCost(to.terrainType());
        int gain = to.elevation - from.elevation;
        if (gain > 0) {
            cost += UPHILL_COST_PER_LEVEL * gain;
        }
        if (from.hasRiverThroughEdge(direction)) {
            cost += RIVER_CROSSING_COST;
        }
        return cost;
    }
}
