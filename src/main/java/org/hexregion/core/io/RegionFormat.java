package org.hexregion.core.io;

/**
 * Константы двоичного формата .region. Все числа little-endian.
 */
public final class RegionFormat {

    /** "XHRG" в little-endian. */
    public static final int MAGIC = 0x47524858;
    public static final int CURRENT_VERSION = 1;

    /** magic + version + guid + width + height. */
    public static final int HEADER_SIZE = 4 + 4 + GuidCodec.GUID_SIZE + 4 + 4;

    public static final int PROGRESS_INTERVAL = 10_000;

    // защита от мусорных длин в повреждённых файлах
    public static final int MAX_NAME_BYTES = 1 << 16;
    public static final int MAX_CONNECTIONS = 1 << 16;

    private RegionFormat() {
    }
}
