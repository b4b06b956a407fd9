package org.hexregion.core.topology;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class HexCoordinatesTest {

    @Test
    void testOffsetRoundTrip() {
        for (int z = -3; z < 12; z++) {
            for (int x = -3; x < 12; x++) {
                HexCoordinates c = HexCoordinates.fromOffset(x, z);
                assertEquals(x, c.offsetX(), "x for " + x + "," + z);
                assertEquals(z, c.offsetZ(), "z for " + x + "," + z);
            }
        }
    }

    @Test
    void testNeighborsAreAtDistanceOne() {
        HexCoordinates c = new HexCoordinates(3, -2);
        for (HexDirection d : HexDirection.values()) {
            HexCoordinates n = c.neighbor(d);
            assertEquals(1, c.distanceTo(n));
            assertEquals(d, HexDirection.between(c, n));
            assertEquals(c, n.neighbor(d.opposite()));
        }
    }

    @Test
    void testOffsetNeighborsShiftOddRowsRight() {
        // NE from an even row keeps x, from an odd row moves right
        HexCoordinates even = HexCoordinates.fromOffset(2, 2).neighbor(HexDirection.NE);
        assertEquals(2, even.offsetX());
        assertEquals(3, even.offsetZ());

        HexCoordinates odd = HexCoordinates.fromOffset(2, 3).neighbor(HexDirection.NE);
        assertEquals(3, odd.offsetX());
        assertEquals(4, odd.offsetZ());

        HexCoordinates se = HexCoordinates.fromOffset(2, 2).neighbor(HexDirection.SE);
        assertEquals(2, se.offsetX());
        assertEquals(1, se.offsetZ());
    }

    @Test
    void testDistance() {
        HexCoordinates a = new HexCoordinates(0, 0);
        assertEquals(0, a.distanceTo(a));
        assertEquals(3, a.distanceTo(new HexCoordinates(3, 0)));
        assertEquals(3, a.distanceTo(new HexCoordinates(-3, 3)));
        assertEquals(5, a.distanceTo(new HexCoordinates(2, 3)));
        assertEquals(a.distanceTo(new HexCoordinates(4, -7)), new HexCoordinates(4, -7).distanceTo(a));
    }

    @Test
    void testWorldPosition() {
        WorldPosition origin = new HexCoordinates(0, 0).toWorldPosition(0);
        assertEquals(0.0, origin.x(), 1e-9);
        assertEquals(0.0, origin.z(), 1e-9);

        WorldPosition p = new HexCoordinates(1, 2).toWorldPosition(5);
        assertEquals((1 + 1.0) * HexMetrics.INNER_RADIUS * 2.0, p.x(), 1e-9);
        assertEquals(3.0, p.z(), 1e-9);
        assertEquals(2.0, p.y(), 1e-9);
    }

    @Test
    void testDirectionArithmetic() {
        assertEquals(HexDirection.SW, HexDirection.NE.opposite());
        assertEquals(HexDirection.NE, HexDirection.NW.next());
        assertEquals(HexDirection.NW, HexDirection.NE.previous());
        assertThrows(IllegalArgumentException.class, () -> HexDirection.fromIndex(6));
        assertNull(HexDirection.between(new HexCoordinates(0, 0), new HexCoordinates(2, 0)));
    }
}
