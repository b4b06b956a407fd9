package org.hexregion.core.model;

import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.topology.HexDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Регион: плоский массив клеток (index = z * width + x) и метаданные.
 * Соседи вычисляются индексной арифметикой, ссылок между клетками нет.
 * Методы изменения рек и дорог держат инварианты сетки.
 */
public class RegionData implements HexGridSink {

    /** Координаты клеток пишутся в файл как i16. */
    public static final int MAX_DIMENSION = Short.MAX_VALUE;

    private final UUID id;
    private final String name;
    private final int width;
    private final int height;
    private final int seed;
    private Instant generatedAt;
    private final CellData[] cells;
    private final List<CellData> cellView;
    private final List<RegionConnection> connections = new ArrayList<>();

    public RegionData(UUID id, String name, int width, int height, int seed, Instant generatedAt, CellData[] cells) {
        if (id == null) {
            throw new IllegalArgumentException("Region id is null");
        }
        if (width <= 0 || height <= 0 || width > MAX_DIMENSION || height > MAX_DIMENSION) {
            throw new IllegalArgumentException("Invalid region size: " + width + "x" + height);
        }
        if (cells.length != width * height) {
            throw new IllegalArgumentException("Cell array length " + cells.length
                    + " does not match " + width + "x" + height);
        }
        this.id = id;
        this.name = (name == null) ? "" : name;
        this.width = width;
        this.height = height;
        this.seed = seed;
        this.generatedAt = (generatedAt == null) ? Instant.now() : generatedAt;
        this.cells = cells;
        this.cellView = Collections.unmodifiableList(Arrays.asList(cells));
    }

    public static RegionData createEmpty(UUID id, String name, int width, int height, int seed) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid region size: " + width + "x" + height);
        }
        CellData[] cells = new CellData[width * height];
        for (int z = 0; z < height; z++) {
            for (int x = 0; x < width; x++) {
                cells[z * width + x] = new CellData(x, z);
            }
        }
        return new RegionData(id, name, width, height, seed, Instant.now(), cells);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    public int getSeed() {
        return seed;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public int cellCount() {
        return cells.length;
    }

    public List<CellData> cells() {
        return cellView;
    }

    public List<RegionConnection> connections() {
        return connections;
    }

    // --- доступ к клеткам ---

    public boolean inBounds(int x, int z) {
        return x >= 0 && z >= 0 && x < width && z < height;
    }

    public int index(int x, int z) {
        return z * width + x;
    }

    public CellData getCell(int index) {
        if (index < 0 || index >= cells.length) return null;
        return cells[index];
    }

    public CellData getCell(int x, int z) {
        if (!inBounds(x, z)) return null;
        return cells[z * width + x];
    }

    public CellData getCell(HexCoordinates c) {
        return getCell(c.offsetX(), c.offsetZ());
    }

    public CellData getNeighbor(CellData cell, HexDirection direction) {
        return getCell(cell.coordinates().neighbor(direction));
    }

    // --- изменение сетки ---

    @Override
    public void setCellProperties(int x, int z, CellData source) {
        CellData cell = requireCell(x, z);
        cell.copyPropertiesFrom(source);
    }

    /**
     * Ставит особый объект. Клетка с рекой объект не принимает;
     * ненулевой объект убирает дороги клетки.
     */
    public boolean setSpecial(int x, int z, SpecialFeature special) {
        CellData cell = requireCell(x, z);
        if (special != SpecialFeature.NONE && cell.hasRiver()) {
            return false;
        }
        cell.specialIndex = special.index();
        if (special != SpecialFeature.NONE) {
            removeRoads(x, z);
        }
        return true;
    }

    @Override
    public void removeRiver(int x, int z) {
        CellData cell = requireCell(x, z);
        removeOutgoing(cell);
        removeIncoming(cell);
    }

    private void removeOutgoing(CellData cell) {
        if (!cell.hasOutgoingRiver) return;
        HexDirection dir = HexDirection.fromIndex(cell.outgoingRiverDirection);
        cell.hasOutgoingRiver = false;
        CellData n = getNeighbor(cell, dir);
        if (n != null && n.hasIncomingRiver && n.incomingRiverDirection == dir.opposite().index()) {
            n.hasIncomingRiver = false;
        }
    }

    private void removeIncoming(CellData cell) {
        if (!cell.hasIncomingRiver) return;
        HexDirection dir = HexDirection.fromIndex(cell.incomingRiverDirection);
        cell.hasIncomingRiver = false;
        CellData n = getNeighbor(cell, dir);
        if (n != null && n.hasOutgoingRiver && n.outgoingRiverDirection == dir.opposite().index()) {
            n.hasOutgoingRiver = false;
        }
    }

    /**
     * Река из (x, z) в соседа по direction. Вверх по склону не течёт.
     * Если у соседа уже есть входящая река, это слияние: его входящее направление не меняется.
     */
    @Override
    public boolean setOutgoingRiver(int x, int z, HexDirection direction) {
        CellData cell = getCell(x, z);
        if (cell == null) return false;
        CellData n = getNeighbor(cell, direction);
        if (n == null || n.elevation > cell.elevation) {
            return false;
        }
        if (cell.hasOutgoingRiver && cell.outgoingRiverDirection == direction.index()) {
            return true;
        }

        removeOutgoing(cell);
        if (cell.hasIncomingRiver && cell.incomingRiverDirection == direction.index()) {
            removeIncoming(cell);
        }
        if (n.hasOutgoingRiver && n.outgoingRiverDirection == direction.opposite().index()) {
            removeOutgoing(n);
        }

        cell.hasOutgoingRiver = true;
        cell.outgoingRiverDirection = direction.index();
        if (!n.hasIncomingRiver) {
            n.hasIncomingRiver = true;
            n.incomingRiverDirection = direction.opposite().index();
        }

        pruneInvalidRoads(cell);
        pruneInvalidRoads(n);
        return true;
    }

    @Override
    public boolean addRoad(int x, int z, HexDirection direction) {
        CellData cell = getCell(x, z);
        if (cell == null) return false;
        CellData n = getNeighbor(cell, direction);
        if (n == null) return false;
        if (cell.hasRoad(direction)) {
            return true;
        }
        if (!RoadRules.canPlaceRoad(cell, n, direction)) {
            return false;
        }
        cell.setRoadBit(direction, true);
        n.setRoadBit(direction.opposite(), true);
        return true;
    }

    public void removeRoad(int x, int z, HexDirection direction) {
        CellData cell = requireCell(x, z);
        cell.setRoadBit(direction, false);
        CellData n = getNeighbor(cell, direction);
        if (n != null) {
            n.setRoadBit(direction.opposite(), false);
        }
    }

    @Override
    public void removeRoads(int x, int z) {
        CellData cell = requireCell(x, z);
        for (HexDirection d : HexDirection.values()) {
            if (cell.hasRoad(d)) {
                removeRoad(x, z, d);
            }
        }
        // на случай несимметричной маски из внешних данных
        cell.roadMask = 0;
    }

    private void pruneInvalidRoads(CellData cell) {
        for (HexDirection d : HexDirection.values()) {
            if (cell.hasRoad(d) && !RoadRules.canPlaceRoad(cell, getNeighbor(cell, d), d)) {
                removeRoad(cell.x, cell.z, d);
            }
        }
    }

    /**
     * Отвязанная копия текущего состояния сетки (для сохранения отредактированного региона).
     */
    public RegionData snapshot(UUID newId, String newName, int newSeed) {
        CellData[] copy = new CellData[cells.length];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].copy();
        }
        RegionData out = new RegionData(newId, newName, width, height, newSeed, Instant.now(), copy);
        out.connections.addAll(connections);
        return out;
    }

    private CellData requireCell(int x, int z) {
        CellData cell = getCell(x, z);
        if (cell == null) {
            throw new IllegalArgumentException("Cell out of bounds: " + x + "," + z
                    + " (region " + width + "x" + height + ")");
        }
        return cell;
    }
}
