package org.hexregion.core.io;

import org.hexregion.core.model.CellData;

import java.nio.ByteBuffer;

/**
 * 16-байтовая упаковка клетки:
 * <pre>
 * x:i16 z:i16 elevation:i8 waterLevel:i8 terrain:u8 special:u8
 * featureFlags:u8 riverFlags:u8 roadFlags:u8 reserved:u8 moisture:f16 padding:u16
 * </pre>
 * featureFlags: биты 0-1 urban, 2-3 farm, 4-5 plant, 6 walled.
 * riverFlags: бит 0 incoming, 1 outgoing, 2-4 направление входа, 5-7 направление выхода.
 */
public record PackedCellData(short x,
                             short z,
                             byte elevation,
                             byte waterLevel,
                             byte terrainTypeIndex,
                             byte specialIndex,
                             byte featureFlags,
                             byte riverFlags,
                             byte roadFlags,
                             short moistureHalf) {

    public static final int SIZE = 16;

    static final int WALLED_BIT = 0x40;
    static final int RIVER_IN_BIT = 0x01;
    static final int RIVER_OUT_BIT = 0x02;

    public static PackedCellData pack(CellData c) {
        int features = (c.urbanLevel & 0x3)
                | ((c.farmLevel & 0x3) << 2)
                | ((c.plantLevel & 0x3) << 4)
                | (c.walled ? WALLED_BIT : 0);
        int rivers = (c.hasIncomingRiver ? RIVER_IN_BIT : 0)
                | (c.hasOutgoingRiver ? RIVER_OUT_BIT : 0)
                | ((c.incomingRiverDirection & 0x7) << 2)
                | ((c.outgoingRiverDirection & 0x7) << 5);
        return new PackedCellData(
                (short) c.x,
                (short) c.z,
                (byte) c.elevation,
                (byte) c.waterLevel,
                (byte) c.terrainTypeIndex,
                (byte) c.specialIndex,
                (byte) features,
                (byte) rivers,
                (byte) (c.roadMask & 0x3F),
                HalfFloat.fromFloat(c.moisture));
    }

    public CellData unpack() {
        CellData c = new CellData(x, z);
        c.elevation = elevation;
        c.waterLevel = waterLevel;
        c.terrainTypeIndex = terrainTypeIndex & 0xFF;
        c.specialIndex = specialIndex & 0xFF;

        int f = featureFlags & 0xFF;
        c.urbanLevel = f & 0x3;
        c.farmLevel = (f >> 2) & 0x3;
        c.plantLevel = (f >> 4) & 0x3;
        c.walled = (f & WALLED_BIT) != 0;

        int r = riverFlags & 0xFF;
        c.hasIncomingRiver = (r & RIVER_IN_BIT) != 0;
        c.hasOutgoingRiver = (r & RIVER_OUT_BIT) != 0;
        c.incomingRiverDirection = (r >> 2) & 0x7;
        c.outgoingRiverDirection = (r >> 5) & 0x7;

        c.roadMask = roadFlags & 0x3F;
        c.moisture = HalfFloat.toFloat(moistureHalf);
        return c;
    }

    public void writeTo(ByteBuffer buf) {
        buf.putShort(x);
        buf.putShort(z);
        buf.put(elevation);
        buf.put(waterLevel);
        buf.put(terrainTypeIndex);
        buf.put(specialIndex);
        buf.put(featureFlags);
        buf.put(riverFlags);
        buf.put(roadFlags);
        buf.put((byte) 0);      // reserved
        buf.putShort(moistureHalf);
        buf.putShort((short) 0); // padding
    }

    public static PackedCellData readFrom(ByteBuffer buf) {
        short x = buf.getShort();
        short z = buf.getShort();
        byte elevation = buf.get();
        byte waterLevel = buf.get();
        byte terrain = buf.get();
        byte special = buf.get();
        byte features = buf.get();
        byte rivers = buf.get();
        byte roads = buf.get();
        buf.get();      // reserved
        short moisture = buf.getShort();
        buf.getShort(); // padding
        return new PackedCellData(x, z, elevation, waterLevel, terrain, special, features, rivers, roads, moisture);
    }
}
