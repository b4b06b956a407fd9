package org.hexregion.core.generation;

/**
 * Смещения сида по проходам: каждый проход получает свой независимый поток случайных чисел.
 */
public final class SeedOffsets {

    public static final int LAND = 0;
    public static final int MOISTURE = 1000;
    public static final int FEATURES = 2000;
    public static final int RIVERS = 7777;
    public static final int ROADS = 9999;

    private SeedOffsets() {
    }
}
