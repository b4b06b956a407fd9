package org.hexregion.core.topology;

/**
 * Осевые координаты гекса. Хранятся только (q, r), мировая позиция считается на лету.
 * Смещённая раскладка: нечётные строки сдвинуты вправо, q = x - floor(z / 2), r = z.
 */
public record HexCoordinates(int q, int r) {

    public static HexCoordinates fromOffset(int x, int z) {
        return new HexCoordinates(x - Math.floorDiv(z, 2), z);
    }

    public int offsetX() {
        return q + Math.floorDiv(r, 2);
    }

    public int offsetZ() {
        return r;
    }

    public HexCoordinates neighbor(HexDirection direction) {
        return new HexCoordinates(q + direction.dq, r + direction.dr);
    }

    public int distanceTo(HexCoordinates other) {
        int dq = q - other.q;
        int dr = r - other.r;
        return (Math.abs(dq) + Math.abs(dr) + Math.abs(dq + dr)) / 2;
    }

    public boolean isNeighborOf(HexCoordinates other) {
        return distanceTo(other) == 1;
    }

    public WorldPosition toWorldPosition(int elevation) {
        double x = (q + r * 0.5) * HexMetrics.INNER_RADIUS * 2.0;
        double z = r * HexMetrics.OUTER_RADIUS * 1.5;
        double y = elevation * HexMetrics.ELEVATION_STEP;
        return new WorldPosition(x, y, z);
    }

    @Override
    public String toString() {
        return "(" + q + ", " + r + ")";
    }
}
