package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.topology.HexDirection;

/**
 * Стоимость шага между соседними клетками. {@link Double#POSITIVE_INFINITY} = непроходимо.
 * Эвристика A* умножает гекс-дистанцию на {@link #minStepCost()}, поэтому он обязан
 * быть не больше любой конечной стоимости шага.
 */
public interface MovementCostFunction {

    double stepCost(CellData from, CellData to, HexDirection direction);

    boolean isPassable(CellData cell);

    default double minStepCost() {
        return 1.0;
    }
}
