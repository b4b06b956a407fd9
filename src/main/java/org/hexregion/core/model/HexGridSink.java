package org.hexregion.core.model;

import org.hexregion.core.topology.HexDirection;

/**
 * Узкий интерфейс изменения сетки. Через него регион переносится на живую сетку
 * (рендер, редактор) тремя проходами: свойства, реки, дороги.
 */
public interface HexGridSink {

    int width();

    int height();

    void setCellProperties(int x, int z, CellData source);

    void removeRiver(int x, int z);

    void removeRoads(int x, int z);

    /** @return false если реку проложить нельзя (нет соседа, течёт вверх) */
    boolean setOutgoingRiver(int x, int z, HexDirection direction);

    /** @return false если ребро не проходит {@link RoadRules#canPlaceRoad} */
    boolean addRoad(int x, int z, HexDirection direction);
}
