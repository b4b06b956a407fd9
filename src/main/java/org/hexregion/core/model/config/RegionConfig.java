package org.hexregion.core.model.config;

/**
 * Размеры регионов и расположение файлов.
 */
public final class RegionConfig {

    public static final int DEFAULT_WIDTH = 200;
    public static final int DEFAULT_HEIGHT = 200;
    public static final int MIN_SIZE = 50;
    public static final int MAX_SIZE = 300;

    public static final String FILE_EXTENSION = ".region";
    public static final String DEFAULT_DIRECTORY = "regions";

    private RegionConfig() {
    }
}
