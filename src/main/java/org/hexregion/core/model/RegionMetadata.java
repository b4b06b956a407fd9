package org.hexregion.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Заголовок и метаданные файла региона без клеток.
 */
public record RegionMetadata(UUID id,
                             String name,
                             int width,
                             int height,
                             int seed,
                             Instant generatedAt,
                             List<RegionConnection> connections,
                             int formatVersion,
                             Path sourcePath) {

    public RegionMetadata {
        connections = List.copyOf(connections);
    }

    public int cellCount() {
        return width * height;
    }
}
