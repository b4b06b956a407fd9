package org.hexregion.core.model;

import java.util.UUID;

/**
 * Связь с соседним регионом (порт отправления и прибытия, время в пути в минутах).
 */
public record RegionConnection(UUID targetRegionId,
                               String targetRegionName,
                               int departurePortIndex,
                               int arrivalPortIndex,
                               float travelTimeMinutes,
                               float dangerLevel) {

    public RegionConnection {
        if (targetRegionId == null) {
            throw new IllegalArgumentException("targetRegionId is null");
        }
        if (targetRegionName == null) {
            targetRegionName = "";
        }
    }
}
