package org.hexregion.core.generation;

import java.util.EnumSet;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    // Только рельеф и биомы, без рек/объектов/дорог
    public static StageProfile terrainOnly() {
        return new StageProfile(EnumSet.of(
                StageId.LAND,
                StageId.CLIMATE,
                StageId.BIOMES
        ));
    }

    public static StageProfile withoutRoads() {
        return new StageProfile(EnumSet.of(
                StageId.LAND,
                StageId.CLIMATE,
                StageId.BIOMES,
                StageId.RIVERS,
                StageId.FEATURES
        ));
    }
}
