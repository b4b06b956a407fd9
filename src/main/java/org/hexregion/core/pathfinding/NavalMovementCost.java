package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.topology.HexDirection;

public class NavalMovementCost implements MovementCostFunction {

    public static boolean isWater(CellData cell) {
        return cell.isUnderwater() || cell.terrainType().isWater();
    }

    @Override
    public boolean isPassable(CellData cell) {
        return isWater(cell);
    }

    @Override
    public double stepCost(CellData from, CellData to, HexDirection direction) {
        if (!isWater(to)) {
            return Double.POSITIVE_INFINITY;
        }
        TerrainType t = to.terrainType();
        if (t == TerrainType.COAST) {
            return 1.5;
        }
        // OCEAN и прочая вода под уровнем
        return 1.0;
    }
}
