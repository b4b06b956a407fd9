package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RoadRules;
import org.hexregion.core.pathfinding.MovementCosts;
import org.hexregion.core.pathfinding.PathOptions;
import org.hexregion.core.pathfinding.PathResult;
import org.hexregion.core.pathfinding.Pathfinder;
import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.util.CancellationToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Дороги между поселениями. Пары соединяются от ближних к дальним; пара,
 * уже связанная дорожной сетью, пропускается (как в алгоритме Краскала).
 */
public class RoadGenerator {

    // запас по стоимости относительно гекс-дистанции пары
    private static final double COST_SLACK_PER_HEX = 3.0;
    private static final double COST_SLACK_BASE = 6.0;

    /** Итог прохода. */
    public record Result(int settlements, int pairsConsidered, int roadsBuilt, int edgesAdded) {
    }

    private record Pair(int a, int b, int distance) {
    }

    public Result generate(RegionData region, int seed, int maxDistance, CancellationToken token) {
        List<CellData> settlements = new ArrayList<>();
        for (CellData c : region.cells()) {
            if (RegionStats.isSettlement(c)) {
                settlements.add(c);
            }
        }

        Random rng = new Random(seed + SeedOffsets.ROADS);
        int[] rank = new int[settlements.size()];
        for (int i = 0; i < rank.length; i++) {
            rank[i] = rng.nextInt();
        }

        int[] component = labelRoadComponents(region);

        List<Pair> pairs = new ArrayList<>();
        for (int i = 0; i < settlements.size(); i++) {
            HexCoordinates ci = settlements.get(i).coordinates();
            int compI = component[indexOf(region, settlements.get(i))];
            for (int j = i + 1; j < settlements.size(); j++) {
                CellData other = settlements.get(j);
                if (compI < 0 || compI != component[indexOf(region, other)]) continue;
                int d = ci.distanceTo(other.coordinates());
                if (d <= maxDistance) {
                    pairs.add(new Pair(i, j, d));
                }
            }
        }
        pairs.sort(Comparator.<Pair>comparingInt(p -> p.distance)
                .thenComparingInt(p -> Math.min(rank[p.a], rank[p.b]))
                .thenComparingInt(p -> Math.max(rank[p.a], rank[p.b]))
                .thenComparingInt(p -> p.a)
                .thenComparingInt(p -> p.b));

        UnionFind networks = new UnionFind(settlements.size());
        Pathfinder pathfinder = new Pathfinder(region);
        PathOptions base = PathOptions.defaults()
                .withCostFunction(MovementCosts.ROAD)
                .withIgnoreUnits(true)
                .withCancellation(token);

        int built = 0;
        int edges = 0;
        int considered = 0;
        for (Pair p : pairs) {
            token.throwIfCancelled("roads");
            if (networks.find(p.a) == networks.find(p.b)) {
                continue;
            }
            considered++;
            CellData from = settlements.get(p.a);
            CellData to = settlements.get(p.b);
            PathOptions options = base.withMaxCost(COST_SLACK_BASE + COST_SLACK_PER_HEX * p.distance);
            PathResult path = pathfinder.findPath(from.coordinates(), to.coordinates(), options);
            if (!path.reachable() || path.length() < 2) {
                continue;
            }
            edges += applyRoad(region, path.path());
            networks.union(p.a, p.b);
            built++;
        }

        System.out.println("[ROADS] settlements=" + settlements.size() + " pairs=" + pairs.size()
                + " searched=" + considered + " built=" + built + " newEdges=" + edges);
        return new Result(settlements.size(), considered, built, edges);
    }

    private static int applyRoad(RegionData region, List<HexCoordinates> path) {
        int added = 0;
        for (int i = 1; i < path.size(); i++) {
            CellData a = region.getCell(path.get(i - 1));
            HexDirection d = HexDirection.between(path.get(i - 1), path.get(i));
            if (a.hasRoad(d)) continue;
            if (!region.addRoad(a.x, a.z, d)) {
                throw new IllegalStateException("Pathfinder returned a non-buildable road edge at " + a + " dir=" + d);
            }
            added++;
        }
        return added;
    }

    /**
     * Компоненты связности по рёбрам, где дорогу положить можно. Пары из разных компонент
     * заведомо не соединятся, поиск для них не запускаем. -1 для клеток без дорог.
     */
    static int[] labelRoadComponents(RegionData region) {
        int n = region.cellCount();
        int[] comp = new int[n];
        Arrays.fill(comp, -1);
        int label = 0;
        ArrayDeque<CellData> queue = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            CellData start = region.getCell(i);
            if (comp[i] >= 0 || start.isUnderwater() || RoadRules.isMegaflora(start)) continue;
            comp[i] = label;
            queue.add(start);
            while (!queue.isEmpty()) {
                CellData c = queue.poll();
                for (HexDirection d : HexDirection.values()) {
                    CellData nb = region.getNeighbor(c, d);
                    if (nb == null) continue;
                    int ni = indexOf(region, nb);
                    if (comp[ni] >= 0) continue;
                    if (!c.hasRoad(d) && !RoadRules.canPlaceRoad(c, nb, d)) continue;
                    comp[ni] = label;
                    queue.add(nb);
                }
            }
            label++;
        }
        return comp;
    }

    private static int indexOf(RegionData region, CellData c) {
        return region.index(c.x, c.z);
    }

    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int n) {
            parent = new int[n];
            for (int i = 0; i < n; i++) parent[i] = i;
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra != rb) parent[rb] = ra;
        }
    }
}
