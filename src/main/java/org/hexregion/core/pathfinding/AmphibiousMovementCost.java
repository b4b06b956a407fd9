package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.topology.HexDirection;

/**
 * Дешевле из сухопутной и морской стоимости; смена среды (посадка / высадка) стоит +1.
 */
public class AmphibiousMovementCost implements MovementCostFunction {

    static final double EMBARK_COST = 1.0;

    private final LandMovementCost land;
    private final NavalMovementCost naval;

    public AmphibiousMovementCost(LandMovementCost land, NavalMovementCost naval) {
        this.land = land;
        this.naval = naval;
    }

    @Override
    public boolean isPassable(CellData cell) {
        return land.isPassable(cell) || naval.isPassable(cell);
    }

    @Override
    public double stepCost(CellData from, CellData to, HexDirection direction) {
        double cost = Math.min(land.stepCost(from, to, direction), naval.stepCost(from, to, direction));
        if (Double.isInfinite(cost)) {
            return cost;
        }
        if (NavalMovementCost.isWater(from) != NavalMovementCost.isWater(to)) {
            cost += EMBARK_COST;
        }
        return cost;
    }
}
