package org.hexregion.core.generation;

public enum StageId {
    LAND,
    CLIMATE,
    BIOMES,
    RIVERS,
    FEATURES,
    ROADS
}
