package org.hexregion.core.io;

import java.io.IOException;

/**
 * Файл прочитан, но его содержимое не является допустимым регионом.
 */
public class RegionFormatException extends IOException {

    private final RegionIoStatus status;

    public RegionFormatException(RegionIoStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RegionIoStatus status() {
        return status;
    }
}
