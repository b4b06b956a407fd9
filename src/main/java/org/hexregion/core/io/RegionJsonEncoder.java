package org.hexregion.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionConnection;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RegionMetadata;

import java.util.List;

/**
 * Компактный JSON для внешних потребителей (веб-карта, инструменты).
 * Короткие ключи и строки-массивы, чтобы JSON большого региона оставался небольшим.
 */
public class RegionJsonEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String encodeCatalog(List<RegionMetadata> regions) {
        ArrayNode root = MAPPER.createArrayNode();
        for (RegionMetadata m : regions) {
            root.add(metadataNode(m.id().toString(), m.name(), m.width(), m.height(), m.seed(),
                    m.generatedAt().toString(), m.connections()));
        }
        return write(root);
    }

    /**
     * Регион целиком: метаданные + клетки.
     * Строка клетки: [x, z, elevation, waterLevel, terrain, special, urban, farm, plant, walled,
     * riverIn, riverOut, roadMask, moisture]; направление реки -1, если реки нет.
     */
    public static String encodeRegion(RegionData region) {
        ObjectNode root = metadataNode(region.getId().toString(), region.getName(), region.width(),
                region.height(), region.getSeed(), region.getGeneratedAt().toString(), region.connections());

        ArrayNode cells = root.putArray("cells");
        for (CellData c : region.cells()) {
            ArrayNode row = cells.addArray();
            row.add(c.x);
            row.add(c.z);
            row.add(c.elevation);
            row.add(c.waterLevel);
            row.add(c.terrainTypeIndex);
            row.add(c.specialIndex);
            row.add(c.urbanLevel);
            row.add(c.farmLevel);
            row.add(c.plantLevel);
            row.add(c.walled ? 1 : 0);
            row.add(c.hasIncomingRiver ? c.incomingRiverDirection : -1);
            row.add(c.hasOutgoingRiver ? c.outgoingRiverDirection : -1);
            row.add(c.roadMask);
            // 3 знака
            row.add(Math.round(c.moisture * 1000.0) / 1000.0);
        }
        return write(root);
    }

    private static ObjectNode metadataNode(String id, String name, int w, int h, int seed, String ts,
                                           List<RegionConnection> connections) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", id);
        node.put("name", name);
        node.put("w", w);
        node.put("h", h);
        node.put("seed", seed);
        node.put("ts", ts);
        ArrayNode c = node.putArray("c");
        for (RegionConnection rc : connections) {
            ObjectNode cn = c.addObject();
            cn.put("to", rc.targetRegionId().toString());
            cn.put("name", rc.targetRegionName());
            cn.put("dep", rc.departurePortIndex());
            cn.put("arr", rc.arrivalPortIndex());
            cn.put("min", rc.travelTimeMinutes());
            cn.put("danger", rc.dangerLevel());
        }
        return node;
    }

    private static String write(Object node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode region JSON", e);
        }
    }
}
