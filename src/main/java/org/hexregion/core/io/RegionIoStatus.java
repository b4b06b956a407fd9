package org.hexregion.core.io;

public enum RegionIoStatus {
    OK,
    INVALID_FORMAT,
    UNSUPPORTED_VERSION,
    IO_ERROR,
    CANCELLED
}
