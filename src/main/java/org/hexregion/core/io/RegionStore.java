package org.hexregion.core.io;

import org.hexregion.core.model.RegionMetadata;
import org.hexregion.core.model.config.RegionConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Каталог файлов регионов в одной директории.
 */
public class RegionStore {

    private final Path directory;
    private final RegionSerializer serializer;

    public RegionStore(Path directory, RegionSerializer serializer) {
        this.directory = directory;
        this.serializer = serializer;
    }

    public RegionStore() {
        this(Paths.get(RegionConfig.DEFAULT_DIRECTORY), new RegionSerializer());
    }

    public Path directory() {
        return directory;
    }

    /**
     * Путь для имени файла. Абсолютный путь возвращается как есть, к имени без расширения
     * добавляется {@value RegionConfig#FILE_EXTENSION}.
     */
    public Path resolve(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Region file name is empty");
        }
        String name = fileName.endsWith(RegionConfig.FILE_EXTENSION)
                ? fileName
                : fileName + RegionConfig.FILE_EXTENSION;
        Path p = Paths.get(name);
        return p.isAbsolute() ? p : directory.resolve(p);
    }

    public boolean exists(String fileName) {
        return Files.isRegularFile(resolve(fileName));
    }

    public List<Path> listRegionFiles() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(RegionConfig.FILE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list region directory " + directory, e);
        }
    }

    /**
     * Метаданные всех читаемых файлов. Нечитаемые пропускаются с предупреждением.
     */
    public List<RegionMetadata> catalog() {
        List<RegionMetadata> out = new ArrayList<>();
        for (Path p : listRegionFiles()) {
            LoadResult<RegionMetadata> r = serializer.loadMetadata(p);
            if (r.isSuccess()) {
                out.add(r.value());
            } else {
                System.out.println("[WARN] Skipping region file " + p.getFileName()
                        + ": " + r.status() + " " + r.message());
            }
        }
        return out;
    }
}
