package org.hexregion.core.model;

import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.topology.HexMetrics;

/**
 * Одна клетка региона. Индекс в массиве = z * width + x.
 * Поля открыты: генераторы пишут в них напрямую, как в тайлы планеты.
 * Инварианты рек и дорог поддерживает {@link RegionData}.
 */
public class CellData {

    public final int x;
    public final int z;

    public int elevation;
    public int waterLevel = HexMetrics.LAND_MIN_ELEVATION;
    public int terrainTypeIndex;

    public int urbanLevel;
    public int farmLevel;
    public int plantLevel;
    public int specialIndex;
    public boolean walled;

    public boolean hasIncomingRiver;
    public int incomingRiverDirection;
    public boolean hasOutgoingRiver;
    public int outgoingRiverDirection;

    /** Биты 0..5 = направления NE..NW. */
    public int roadMask;

    public float moisture;

    public CellData(int x, int z) {
        this.x = x;
        this.z = z;
    }

    public HexCoordinates coordinates() {
        return HexCoordinates.fromOffset(x, z);
    }

    public boolean isUnderwater() {
        return waterLevel > elevation;
    }

    public TerrainType terrainType() {
        return TerrainType.fromIndex(terrainTypeIndex);
    }

    public SpecialFeature special() {
        return SpecialFeature.fromIndex(specialIndex);
    }

    public boolean isSpecial() {
        return specialIndex != 0;
    }

    public boolean hasRiver() {
        return hasIncomingRiver || hasOutgoingRiver;
    }

    public boolean hasRiverThroughEdge(HexDirection direction) {
        int d = direction.index();
        return (hasIncomingRiver && incomingRiverDirection == d)
                || (hasOutgoingRiver && outgoingRiverDirection == d);
    }

    /** Река входит и выходит через противоположные рёбра. */
    public boolean hasStraightRiver() {
        return hasIncomingRiver && hasOutgoingRiver
                && (incomingRiverDirection + 3) % 6 == outgoingRiverDirection;
    }

    /** Река входит и выходит, но поворачивает внутри клетки: мост через неё не строим. */
    public boolean hasBentRiver() {
        return hasIncomingRiver && hasOutgoingRiver && !hasStraightRiver();
    }

    public HexDirection outgoingRiver() {
        return hasOutgoingRiver ? HexDirection.fromIndex(outgoingRiverDirection) : null;
    }

    public boolean hasRoad(HexDirection direction) {
        return (roadMask & (1 << direction.index())) != 0;
    }

    public boolean hasRoads() {
        return (roadMask & 0x3F) != 0;
    }

    public int roadCount() {
        return Integer.bitCount(roadMask & 0x3F);
    }

    public void setRoadBit(HexDirection direction, boolean value) {
        int bit = 1 << direction.index();
        roadMask = value ? (roadMask | bit) : (roadMask & ~bit);
    }

    public CellData copy() {
        CellData c = new CellData(x, z);
        c.copyPropertiesFrom(this);
        c.hasIncomingRiver = hasIncomingRiver;
        c.incomingRiverDirection = incomingRiverDirection;
        c.hasOutgoingRiver = hasOutgoingRiver;
        c.outgoingRiverDirection = outgoingRiverDirection;
        c.roadMask = roadMask;
        return c;
    }

    /** Всё, кроме рек и дорог: они зависят от соседей. */
    public void copyPropertiesFrom(CellData src) {
        elevation = src.elevation;
        waterLevel = src.waterLevel;
        terrainTypeIndex = src.terrainTypeIndex;
        urbanLevel = src.urbanLevel;
        farmLevel = src.farmLevel;
        plantLevel = src.plantLevel;
        specialIndex = src.specialIndex;
        walled = src.walled;
        moisture = src.moisture;
    }

    @Override
    public String toString() {
        return "Cell[" + x + "," + z + " e=" + elevation + " t=" + terrainTypeIndex + "]";
    }
}
