package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RoadRules;
import org.hexregion.core.topology.HexDirection;

/**
 * Стоимость прокладки дороги: существующая дорога дешевле всего, перепад высот и реки дороже.
 */
public class RoadBuildCost implements MovementCostFunction {

    static final double EXISTING_ROAD_COST = 1.0;
    static final double ELEVATION_COST = 2.0;
    static final double RIVER_COST = 1.0;

    @Override
    public boolean isPassable(CellData cell) {
        return !cell.isUnderwater() && !RoadRules.isMegaflora(cell);
    }

    @Override
    public double stepCost(CellData from, CellData to, HexDirection direction) {
        if (from.hasRoad(direction)) {
            return EXISTING_ROAD_COST;
        }
        if (!RoadRules.canPlaceRoad(from, to, direction)) {
            return Double.POSITIVE_INFINITY;
        }
        double cost = 1.0 + ELEVATION_COST * Math.abs(to.elevation - from.elevation);
        if (from.hasRiver() || to.hasRiver()) {
            cost += RIVER_COST;
        }
        return cost;
    }
}
