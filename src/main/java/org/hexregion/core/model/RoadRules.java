package org.hexregion.core.model;

import org.hexregion.core.topology.HexDirection;

public final class RoadRules {

    /** Максимальный перепад высот между клетками, соединёнными дорогой. */
    public static final int MAX_ROAD_ELEVATION_DELTA = 1;

    private RoadRules() {
    }

    /**
     * Можно ли положить дорогу по ребру from -> to (direction смотрит из from).
     * Дорога не идёт по ребру, через которое течёт река. Мост допустим только через
     * прямую реку: если река в клетке поворачивает, дороги из клетки не выходят.
     */
    public static boolean canPlaceRoad(CellData from, CellData to, HexDirection direction) {
        if (from == null || to == null) {
            return false;
        }
        if (from.isUnderwater() || to.isUnderwater()) {
            return false;
        }
        if (isMegaflora(from) || isMegaflora(to)) {
            return false;
        }
        if (Math.abs(from.elevation - to.elevation) > MAX_ROAD_ELEVATION_DELTA) {
            return false;
        }
        if (from.hasRiverThroughEdge(direction) || to.hasRiverThroughEdge(direction.opposite())) {
            return false;
        }
        return !from.hasBentRiver() && !to.hasBentRiver();
    }

    public static boolean isMegaflora(CellData cell) {
        return cell.specialIndex == SpecialFeature.MEGAFLORA.index();
    }
}
