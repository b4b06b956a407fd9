package org.hexregion.core.io;

/**
 * Результат чтения. При любой ошибке value == null: частично прочитанный регион наружу не отдаём.
 */
public record LoadResult<T>(RegionIoStatus status, T value, String message) {

    public static <T> LoadResult<T> ok(T value) {
        return new LoadResult<>(RegionIoStatus.OK, value, null);
    }

    public static <T> LoadResult<T> failure(RegionIoStatus status, String message) {
        if (status == RegionIoStatus.OK) {
            throw new IllegalArgumentException("failure() with OK status");
        }
        return new LoadResult<>(status, null, message);
    }

    public boolean isSuccess() {
        return status == RegionIoStatus.OK;
    }
}
