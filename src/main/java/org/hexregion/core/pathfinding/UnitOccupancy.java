package org.hexregion.core.pathfinding;

import org.hexregion.core.topology.HexCoordinates;

/**
 * Занятость клеток юнитами. Владение юнитами живёт снаружи, поиску пути нужен только этот вопрос.
 */
@FunctionalInterface
public interface UnitOccupancy {

    UnitOccupancy NONE = c -> false;

    boolean isOccupied(HexCoordinates cell);
}
