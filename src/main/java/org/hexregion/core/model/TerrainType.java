package org.hexregion.core.model;

/**
 * Тип местности. Порядок констант фиксирован: ordinal пишется в файл региона.
 */
public enum TerrainType {
    OCEAN,
    COAST,
    PLAINS,
    FOREST,
    HILLS,
    MOUNTAINS,
    SNOW,
    DESERT,
    TUNDRA,
    JUNGLE,
    SAVANNA,
    TAIGA;

    private static final TerrainType[] VALUES = values();

    public int index() {
        return ordinal();
    }

    public boolean isWater() {
        return this == OCEAN || this == COAST;
    }

    public static TerrainType fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Terrain index out of range: " + index);
        }
        return VALUES[index];
    }

    public static boolean isValidIndex(int index) {
        return index >= 0 && index < VALUES.length;
    }
}
