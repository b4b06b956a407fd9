package org.hexregion.core.io;

import java.nio.file.Path;

public record SaveResult(RegionIoStatus status, Path path, long bytesWritten, String message) {

    public static SaveResult ok(Path path, long bytesWritten) {
        return new SaveResult(RegionIoStatus.OK, path, bytesWritten, null);
    }

    public static SaveResult failure(RegionIoStatus status, Path path, String message) {
        return new SaveResult(status, path, 0L, message);
    }

    public boolean isSuccess() {
        return status == RegionIoStatus.OK;
    }
}
