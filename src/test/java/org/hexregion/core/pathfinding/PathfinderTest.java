package org.hexregion.core.pathfinding;

import static org.junit.jupiter.api.Assertions.*;

import org.hexregion.core.TestRegions;
import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.util.CancellationToken;
import org.hexregion.core.util.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class PathfinderTest {

    private static HexCoordinates at(int x, int z) {
        return HexCoordinates.fromOffset(x, z);
    }

    @Test
    void testSameCell_ZeroCost() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        PathResult r = pf.findPath(at(3, 3), at(3, 3));
        assertTrue(r.reachable());
        assertEquals(List.of(at(3, 3)), r.path());
        assertEquals(0.0, r.cost());
    }

    @Test
    void testFlatPlains_CostEqualsHexDistance() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        HexCoordinates a = at(0, 0);
        HexCoordinates b = at(9, 9);
        PathResult r = pf.findPath(a, b);

        assertTrue(r.reachable());
        assertEquals(a.distanceTo(b), r.cost(), 1e-9);
        assertEquals(a.distanceTo(b) + 1, r.length());
        assertEquals(a, r.path().get(0));
        assertEquals(b, r.path().get(r.length() - 1));
        for (int i = 1; i < r.length(); i++) {
            assertTrue(r.path().get(i - 1).isNeighborOf(r.path().get(i)));
        }
    }

    @Test
    void testOutOfBounds_NotReachable() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        PathResult r = pf.findPath(at(0, 0), at(10, 0));
        assertFalse(r.reachable());
        assertTrue(r.path().isEmpty());
        assertTrue(Double.isInfinite(r.cost()));
    }

    @Test
    void testGoalSurroundedByWater_NotReachable() {
        RegionData region = TestRegions.flatPlains(10, 10);
        CellData goal = region.getCell(5, 5);
        for (HexDirection d : HexDirection.values()) {
            CellData nb = region.getNeighbor(goal, d);
            TestRegions.makeWater(region, nb.x, nb.z, TerrainType.OCEAN);
        }
        Pathfinder pf = new Pathfinder(region);

        assertFalse(pf.hasPath(at(0, 0), at(5, 5), PathOptions.defaults()));
        assertTrue(pf.hasPath(at(0, 0), at(9, 9), PathOptions.defaults()));
    }

    @Test
    void testWaterGoal_NotReachableByLand_ReachableByNavalWhenConnected() {
        RegionData region = TestRegions.flatPlains(10, 10);
        for (int x = 0; x < 10; x++) {
            TestRegions.makeWater(region, x, 0, TerrainType.OCEAN);
        }
        Pathfinder pf = new Pathfinder(region);

        assertFalse(pf.findPath(at(0, 5), at(4, 0)).reachable());
        PathResult naval = pf.findPath(at(0, 0), at(9, 0), PathOptions.forDomain(UnitDomain.NAVAL));
        assertTrue(naval.reachable());
        assertEquals(9.0, naval.cost(), 1e-9);
    }

    @Test
    void testCostMatchesPathCost() {
        RegionData region = TestRegions.flatPlains(12, 12);
        for (int z = 2; z < 10; z++) {
            region.getCell(6, z).terrainTypeIndex = TerrainType.FOREST.index();
            region.getCell(7, z).elevation = 6;
            region.getCell(7, z).terrainTypeIndex = TerrainType.HILLS.index();
        }
        Pathfinder pf = new Pathfinder(region);
        PathResult r = pf.findPath(at(1, 5), at(10, 6));

        assertTrue(r.reachable());
        assertEquals(pf.pathCost(r.path(), MovementCosts.LAND), r.cost(), 1e-9);
        assertTrue(r.cost() >= at(1, 5).distanceTo(at(10, 6)));
    }

    @Test
    void testOccupiedGoal_RespectsIgnoreUnits() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        UnitOccupancy occupied = c -> c.equals(at(7, 7));
        PathOptions options = PathOptions.defaults().withOccupancy(occupied);

        assertFalse(pf.findPath(at(1, 1), at(7, 7), options).reachable());
        assertTrue(pf.findPath(at(1, 1), at(7, 7), options.withIgnoreUnits(true)).reachable());
    }

    @Test
    void testOccupiedCellsAreAvoided() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        Set<HexCoordinates> blocked = Set.of(at(4, 3), at(4, 4), at(4, 5), at(4, 6));
        PathOptions options = PathOptions.defaults().withOccupancy(blocked::contains);

        PathResult r = pf.findPath(at(1, 5), at(8, 5), options);
        assertTrue(r.reachable());
        for (HexCoordinates c : r.path()) {
            assertFalse(blocked.contains(c), "path goes through occupied " + c);
        }
    }

    @Test
    void testMaxCostCutsSearch() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        HexCoordinates a = at(0, 0);
        HexCoordinates b = at(8, 0);
        assertFalse(pf.findPath(a, b, PathOptions.defaults().withMaxCost(5)).reachable());
        assertTrue(pf.findPath(a, b, PathOptions.defaults().withMaxCost(8)).reachable());
        assertThrows(IllegalArgumentException.class, () -> PathOptions.defaults().withMaxCost(-1));
    }

    @Test
    void testReachableCells_WithinBudget() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        HexCoordinates start = at(5, 5);
        Map<HexCoordinates, Double> cells = pf.getReachableCells(start, 2.0, PathOptions.defaults());

        assertEquals(19, cells.size());
        assertEquals(0.0, cells.get(start));
        for (Map.Entry<HexCoordinates, Double> e : cells.entrySet()) {
            assertEquals(start.distanceTo(e.getKey()), e.getValue(), 1e-9);
        }
    }

    @Test
    void testReachableCells_OutOfBoundsStartIsEmpty() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        assertTrue(pf.getReachableCells(at(-1, 0), 5.0, PathOptions.defaults()).isEmpty());
    }

    @Test
    void testStepCost() {
        RegionData region = TestRegions.flatPlains(10, 10);
        region.getCell(3, 2).terrainTypeIndex = TerrainType.FOREST.index();
        Pathfinder pf = new Pathfinder(region);

        assertEquals(1.5, pf.getStepCost(at(2, 2), at(3, 2), UnitDomain.LAND), 1e-9);
        assertTrue(Double.isInfinite(pf.getStepCost(at(2, 2), at(5, 2), UnitDomain.LAND)));
        assertTrue(Double.isInfinite(pf.getStepCost(at(2, 2), at(3, 2), UnitDomain.NAVAL)));
    }

    @Test
    void testCancelledSearchThrows() {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(100, 100));
        CancellationToken token = new CancellationToken();
        token.cancel();
        PathOptions options = PathOptions.defaults().withCancellation(token);

        assertThrows(OperationCancelledException.class,
                () -> pf.getReachableCells(at(0, 0), Double.POSITIVE_INFINITY, options));
    }

    @Test
    void testAsyncQueries() throws Exception {
        Pathfinder pf = new Pathfinder(TestRegions.flatPlains(10, 10));
        PathResult r = pf.findPathAsync(at(0, 0), at(3, 0), PathOptions.defaults(), Runnable::run).get();
        assertEquals(3.0, r.cost(), 1e-9);
        assertEquals(7, pf.getReachableCellsAsync(at(5, 5), 1.0, PathOptions.defaults(), Runnable::run)
                .get().size());
    }
}
