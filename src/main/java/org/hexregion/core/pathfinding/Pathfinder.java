package org.hexregion.core.pathfinding;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.util.CancellationToken;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A* и Дейкстра по плоскому массиву клеток региона.
 * Запросы только читают регион, поэтому их можно выполнять параллельно.
 */
public class Pathfinder {

    private static final int CANCEL_CHECK_INTERVAL = 1024;

    private final RegionData region;

    public Pathfinder(RegionData region) {
        this.region = region;
    }

    public PathResult findPath(HexCoordinates start, HexCoordinates goal) {
        return findPath(start, goal, PathOptions.defaults());
    }

    public PathResult findPath(HexCoordinates start, HexCoordinates goal, PathOptions options) {
        CellData startCell = region.getCell(start);
        CellData goalCell = region.getCell(goal);
        if (startCell == null || goalCell == null) {
            return PathResult.notReachable();
        }
        if (start.equals(goal)) {
            return new PathResult(List.of(start), 0.0, true);
        }

        MovementCostFunction cost = options.costFunction();
        UnitOccupancy occupancy = options.occupancy();
        if (!cost.isPassable(goalCell)) {
            return PathResult.notReachable();
        }
        if (!options.ignoreUnits() && occupancy.isOccupied(goal)) {
            return PathResult.notReachable();
        }

        int n = region.cellCount();
        double[] costSoFar = new double[n];
        int[] cameFrom = new int[n];
        boolean[] closed = new boolean[n];
        Arrays.fill(costSoFar, Double.POSITIVE_INFINITY);
        Arrays.fill(cameFrom, -1);

        int startIdx = region.index(startCell.x, startCell.z);
        int goalIdx = region.index(goalCell.x, goalCell.z);
        double hScale = cost.minStepCost();

        PriorityQueue<Node> open = new PriorityQueue<>();
        long seq = 0;
        costSoFar[startIdx] = 0.0;
        open.add(new Node(startIdx, start.distanceTo(goal) * hScale, 0.0, seq++));

        int pops = 0;
        while (!open.isEmpty()) {
            Node node = open.poll();
            if ((++pops % CANCEL_CHECK_INTERVAL) == 0) {
                checkCancelled(options.token());
            }
            if (closed[node.index] || node.g > costSoFar[node.index]) {
                continue;
            }
            if (node.index == goalIdx) {
                return new PathResult(reconstruct(cameFrom, goalIdx), costSoFar[goalIdx], true);
            }
            closed[node.index] = true;

            CellData current = region.getCell(node.index);
            for (HexDirection d : HexDirection.values()) {
                CellData next = region.getNeighbor(current, d);
                if (next == null) continue;
                int nextIdx = region.index(next.x, next.z);
                if (closed[nextIdx]) continue;

                if (!options.ignoreUnits() && nextIdx != goalIdx && occupancy.isOccupied(next.coordinates())) {
                    continue;
                }

                double step = cost.stepCost(current, next, d);
                if (Double.isInfinite(step)) continue;

                double newCost = costSoFar[node.index] + step;
                if (newCost > options.maxCost()) continue;

                if (newCost < costSoFar[nextIdx]) {
                    costSoFar[nextIdx] = newCost;
                    cameFrom[nextIdx] = node.index;
                    double f = newCost + next.coordinates().distanceTo(goal) * hScale;
                    open.add(new Node(nextIdx, f, newCost, seq++));
                }
            }
        }
        return PathResult.notReachable();
    }

    public boolean hasPath(HexCoordinates start, HexCoordinates goal, PathOptions options) {
        return findPath(start, goal, options).reachable();
    }

    /**
     * Все клетки, достижимые не дороже budget (Дейкстра). Стартовая клетка входит со стоимостью 0.
     * Порядок обхода: по возрастанию стоимости.
     */
    public Map<HexCoordinates, Double> getReachableCells(HexCoordinates start, double budget, PathOptions options) {
        CellData startCell = region.getCell(start);
        if (startCell == null) {
            return Collections.emptyMap();
        }
        MovementCostFunction cost = options.costFunction();
        UnitOccupancy occupancy = options.occupancy();

        int n = region.cellCount();
        double[] costSoFar = new double[n];
        boolean[] closed = new boolean[n];
        Arrays.fill(costSoFar, Double.POSITIVE_INFINITY);

        double limit = Math.min(budget, options.maxCost());
        Map<HexCoordinates, Double> out = new LinkedHashMap<>();
        PriorityQueue<Node> open = new PriorityQueue<>();
        long seq = 0;
        int startIdx = region.index(startCell.x, startCell.z);
        costSoFar[startIdx] = 0.0;
        open.add(new Node(startIdx, 0.0, 0.0, seq++));

        int pops = 0;
        while (!open.isEmpty()) {
            Node node = open.poll();
            if ((++pops % CANCEL_CHECK_INTERVAL) == 0) {
                checkCancelled(options.token());
            }
            if (closed[node.index] || node.g > costSoFar[node.index]) {
                continue;
            }
            closed[node.index] = true;
            CellData current = region.getCell(node.index);
            out.put(current.coordinates(), node.g);

            for (HexDirection d : HexDirection.values()) {
                CellData next = region.getNeighbor(current, d);
                if (next == null) continue;
                int nextIdx = region.index(next.x, next.z);
                if (closed[nextIdx]) continue;
                if (!options.ignoreUnits() && occupancy.isOccupied(next.coordinates())) continue;

                double step = cost.stepCost(current, next, d);
                if (Double.isInfinite(step)) continue;
                double newCost = node.g + step;
                if (newCost > limit) continue;
                if (newCost < costSoFar[nextIdx]) {
                    costSoFar[nextIdx] = newCost;
                    open.add(new Node(nextIdx, newCost, newCost, seq++));
                }
            }
        }
        return out;
    }

    /**
     * Стоимость одного шага; +inf если клетки не соседние или шаг непроходим.
     */
    public double getStepCost(HexCoordinates from, HexCoordinates to, UnitDomain domain) {
        CellData a = region.getCell(from);
        CellData b = region.getCell(to);
        if (a == null || b == null) {
            return Double.POSITIVE_INFINITY;
        }
        HexDirection d = HexDirection.between(from, to);
        if (d == null) {
            return Double.POSITIVE_INFINITY;
        }
        return MovementCosts.forDomain(domain).stepCost(a, b, d);
    }

    /** Суммарная стоимость готового пути; +inf если путь рвётся. */
    public double pathCost(List<HexCoordinates> path, MovementCostFunction cost) {
        double total = 0.0;
        for (int i = 1; i < path.size(); i++) {
            CellData a = region.getCell(path.get(i - 1));
            CellData b = region.getCell(path.get(i));
            HexDirection d = HexDirection.between(path.get(i - 1), path.get(i));
            if (a == null || b == null || d == null) {
                return Double.POSITIVE_INFINITY;
            }
            total += cost.stepCost(a, b, d);
        }
        return total;
    }

    public CompletableFuture<PathResult> findPathAsync(HexCoordinates start, HexCoordinates goal,
                                                       PathOptions options, Executor executor) {
        return CompletableFuture.supplyAsync(() -> findPath(start, goal, options), executor);
    }

    public CompletableFuture<Map<HexCoordinates, Double>> getReachableCellsAsync(HexCoordinates start, double budget,
                                                                                  PathOptions options,
                                                                                  Executor executor) {
        return CompletableFuture.supplyAsync(() -> getReachableCells(start, budget, options), executor);
    }

    private List<HexCoordinates> reconstruct(int[] cameFrom, int goalIdx) {
        List<HexCoordinates> path = new ArrayList<>();
        for (int i = goalIdx; i != -1; i = cameFrom[i]) {
            path.add(region.getCell(i).coordinates());
        }
        Collections.reverse(path);
        return path;
    }

    private static void checkCancelled(CancellationToken token) {
        if (token != null) {
            token.throwIfCancelled("pathfinding");
        }
    }

    /** Элемент очереди; при равном f раньше выходит тот, кто раньше добавлен. */
    private static final class Node implements Comparable<Node> {
        final int index;
        final double f;
        final double g;
        final long seq;

        Node(int index, double f, double g, long seq) {
            this.index = index;
            this.f = f;
            this.g = g;
            this.seq = seq;
        }

        @Override
        public int compareTo(Node o) {
            int c = Double.compare(f, o.f);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }
}
