package org.hexregion.core.topology;

/**
 * Шесть направлений гекса в осевых координатах (q, r).
 * Индексы 0..5 совпадают с битами маски дорог и полями направления рек.
 */
public enum HexDirection {
    NE(0, 1),
    E(1, 0),
    SE(1, -1),
    SW(0, -1),
    W(-1, 0),
    NW(-1, 1);

    private static final HexDirection[] VALUES = values();

    public final int dq;
    public final int dr;

    HexDirection(int dq, int dr) {
        this.dq = dq;
        this.dr = dr;
    }

    public int index() {
        return ordinal();
    }

    public HexDirection opposite() {
        return VALUES[(ordinal() + 3) % 6];
    }

    public HexDirection next() {
        return VALUES[(ordinal() + 1) % 6];
    }

    public HexDirection previous() {
        return VALUES[(ordinal() + 5) % 6];
    }

    public static HexDirection fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Direction index out of range: " + index);
        }
        return VALUES[index];
    }

    /** Направление из a в соседний b, либо null если клетки не соседние. */
    public static HexDirection between(HexCoordinates a, HexCoordinates b) {
        int dq = b.q() - a.q();
        int dr = b.r() - a.r();
        for (HexDirection d : VALUES) {
            if (d.dq == dq && d.dr == dr) return d;
        }
        return null;
    }
}
