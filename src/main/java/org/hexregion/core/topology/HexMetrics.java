package org.hexregion.core.topology;

/**
 * Геометрия и высотные константы гексовой сетки.
 */
public final class HexMetrics {

    public static final double OUTER_RADIUS = 1.0;
    public static final double INNER_RADIUS = OUTER_RADIUS * 0.866025404;
    public static final double ELEVATION_STEP = 0.4;

    public static final int MIN_ELEVATION = 0;
    public static final int SEA_LEVEL = 4;
    public static final int LAND_MIN_ELEVATION = 5;
    public static final int MAX_ELEVATION = 13;

    public static final double SOLID_FACTOR = 0.8;
    public static final double BLEND_FACTOR = 1.0 - SOLID_FACTOR;

    // террасы на склонах
    public static final int TERRACES_PER_SLOPE = 2;
    public static final int TERRACE_STEPS = TERRACES_PER_SLOPE * 2 + 1;
    public static final double HORIZONTAL_TERRACE_STEP_SIZE = 1.0 / TERRACE_STEPS;
    public static final double VERTICAL_TERRACE_STEP_SIZE = 1.0 / (TERRACES_PER_SLOPE + 1);

    private HexMetrics() {
    }

    public static HexEdgeType edgeType(int elevation1, int elevation2) {
        if (elevation1 == elevation2) {
            return HexEdgeType.FLAT;
        }
        int delta = Math.abs(elevation2 - elevation1);
        return delta == 1 ? HexEdgeType.SLOPE : HexEdgeType.CLIFF;
    }

    /** Горизонтальная интерполяция террасы: ступенька step из TERRACE_STEPS. */
    public static double terraceLerpHorizontal(double a, double b, int step) {
        double h = step * HORIZONTAL_TERRACE_STEP_SIZE;
        return a + (b - a) * h;
    }

    /** Вертикальная интерполяция: высота меняется только на нечётных ступеньках. */
    public static double terraceLerpVertical(double a, double b, int step) {
        double v = ((step + 1) / 2) * VERTICAL_TERRACE_STEP_SIZE;
        return a + (b - a) * v;
    }

    public static WorldPosition terraceLerp(WorldPosition a, WorldPosition b, int step) {
        return new WorldPosition(
                terraceLerpHorizontal(a.x(), b.x(), step),
                terraceLerpVertical(a.y(), b.y(), step),
                terraceLerpHorizontal(a.z(), b.z(), step)
        );
    }

    public static boolean isValidElevation(int elevation) {
        return elevation >= MIN_ELEVATION && elevation <= MAX_ELEVATION;
    }

    public static int clampElevation(int elevation) {
        return Math.max(MIN_ELEVATION, Math.min(MAX_ELEVATION, elevation));
    }
}
