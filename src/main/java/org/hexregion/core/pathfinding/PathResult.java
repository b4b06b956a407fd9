package org.hexregion.core.pathfinding;

import org.hexregion.core.topology.HexCoordinates;

import java.util.List;

/**
 * Результат поиска пути. Недостижимая цель: пустой путь, стоимость +inf.
 */
public record PathResult(List<HexCoordinates> path, double cost, boolean reachable) {

    private static final PathResult NOT_REACHABLE = new PathResult(List.of(), Double.POSITIVE_INFINITY, false);

    public PathResult {
        path = List.copyOf(path);
    }

    public static PathResult notReachable() {
        return NOT_REACHABLE;
    }

    public int length() {
        return path.size();
    }
}
