package org.hexregion.core.io;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.UUID;

/**
 * Двоичные представления id и времени, совместимые с файлами, записанными на .NET:
 * GUID в смешанном порядке байт (первые три поля little-endian), время в тиках по 100 нс от 0001-01-01.
 */
public final class GuidCodec {

    public static final int GUID_SIZE = 16;

    /** Секунды между 0001-01-01T00:00Z и 1970-01-01T00:00Z. */
    static final long EPOCH_OFFSET_SECONDS = 62_135_596_800L;
    static final long TICKS_PER_SECOND = 10_000_000L;

    private GuidCodec() {
    }

    public static void writeGuid(ByteBuffer buf, UUID id) {
        long msb = id.getMostSignificantBits();
        long lsb = id.getLeastSignificantBits();
        ByteOrder order = buf.order();
        buf.order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt((int) (msb >>> 32));
        buf.putShort((short) (msb >>> 16));
        buf.putShort((short) msb);
        buf.order(order);
        for (int i = 7; i >= 0; i--) {
            buf.put((byte) (lsb >>> (i * 8)));
        }
    }

    public static UUID readGuid(ByteBuffer buf) {
        ByteOrder order = buf.order();
        buf.order(ByteOrder.LITTLE_ENDIAN);
        long d1 = buf.getInt() & 0xFFFFFFFFL;
        long d2 = buf.getShort() & 0xFFFFL;
        long d3 = buf.getShort() & 0xFFFFL;
        buf.order(order);
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            lsb = (lsb << 8) | (buf.get() & 0xFF);
        }
        long msb = (d1 << 32) | (d2 << 16) | d3;
        return new UUID(msb, lsb);
    }

    public static long toTicks(Instant instant) {
        return (instant.getEpochSecond() + EPOCH_OFFSET_SECONDS) * TICKS_PER_SECOND
                + instant.getNano() / 100;
    }

    public static Instant fromTicks(long ticks) {
        long seconds = Math.floorDiv(ticks, TICKS_PER_SECOND) - EPOCH_OFFSET_SECONDS;
        long nanos = Math.floorMod(ticks, TICKS_PER_SECOND) * 100;
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
