package org.hexregion.core.io;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionConnection;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RegionMetadata;
import org.hexregion.core.model.SpecialFeature;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.util.CancellationToken;
import org.hexregion.core.util.OperationCancelledException;

import java.io.EOFException;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Чтение и запись файлов .region. Ошибки формата, ввода-вывода и отмена возвращаются
 * статусом результата, исключения наружу не выходят.
 */
public class RegionSerializer {

    // --- запись ---

    public SaveResult save(RegionData region, Path path) {
        return save(region, path, ProgressListener.NONE, CancellationToken.none());
    }

    public SaveResult save(RegionData region, Path path, ProgressListener progress, CancellationToken token) {
        ProgressListener p = progress != null ? progress : ProgressListener.NONE;
        CancellationToken t = token != null ? token : CancellationToken.none();
        Path tmp = null;
        try {
            checkLimits(region);
            byte[] bytes = toBytes(region, p, t);

            t.throwIfCancelled("before write");
            p.onProgress("Writing file", 0.8);
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            // у каждой записи свой временный файл, даже если цель общая
            tmp = Files.createTempFile(parent, path.getFileName() + ".", ".tmp");
            Files.write(tmp, bytes, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            moveIntoPlace(tmp, path);

            p.onProgress("Complete", 1.0);
            return SaveResult.ok(path, bytes.length);
        } catch (OperationCancelledException e) {
            deleteQuietly(tmp);
            return SaveResult.failure(RegionIoStatus.CANCELLED, path, e.getMessage());
        } catch (RegionFormatException e) {
            return SaveResult.failure(e.status(), path, e.getMessage());
        } catch (IOException e) {
            deleteQuietly(tmp);
            return SaveResult.failure(RegionIoStatus.IO_ERROR, path,
                    "Failed to write region file " + path + ": " + e.getMessage());
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Те же пределы, что проверяет чтение: иначе записанный файл уже не загрузить.
     */
    static void checkLimits(RegionData region) throws RegionFormatException {
        checkName("Region name", region.getName());
        if (region.connections().size() > RegionFormat.MAX_CONNECTIONS) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT,
                    "Too many connections: " + region.connections().size() + " > " + RegionFormat.MAX_CONNECTIONS);
        }
        for (RegionConnection c : region.connections()) {
            checkName("Connection target name", c.targetRegionName());
        }
    }

    private static void checkName(String what, String value) throws RegionFormatException {
        int len = value.getBytes(StandardCharsets.UTF_8).length;
        if (len > RegionFormat.MAX_NAME_BYTES) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT,
                    what + " is " + len + " bytes, limit " + RegionFormat.MAX_NAME_BYTES);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            System.out.println("[WARN] Could not remove temp file " + tmp + ": " + e.getMessage());
        }
    }

    /**
     * Сериализация в память целиком; файл пишется одним куском.
     */
    public byte[] toBytes(RegionData region, ProgressListener progress, CancellationToken token) {
        progress.onProgress("Preparing", 0.0);

        byte[] name = region.getName().getBytes(StandardCharsets.UTF_8);
        List<byte[]> connectionNames = new ArrayList<>();
        int size = RegionFormat.HEADER_SIZE + 4 + name.length + 4 + 8 + 4;
        for (RegionConnection c : region.connections()) {
            byte[] n = c.targetRegionName().getBytes(StandardCharsets.UTF_8);
            connectionNames.add(n);
            size += GuidCodec.GUID_SIZE + 4 + n.length + 4 + 4 + 4 + 4;
        }
        size += region.cellCount() * PackedCellData.SIZE;

        ByteBuffer buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);

        // header
        buf.putInt(RegionFormat.MAGIC);
        buf.putInt(RegionFormat.CURRENT_VERSION);
        GuidCodec.writeGuid(buf, region.getId());
        buf.putInt(region.width());
        buf.putInt(region.height());
        token.throwIfCancelled("header");

        // metadata
        progress.onProgress("Serializing", 0.1);
        buf.putInt(name.length);
        buf.put(name);
        buf.putInt(region.getSeed());
        buf.putLong(GuidCodec.toTicks(region.getGeneratedAt()));
        buf.putInt(region.connections().size());
        for (int i = 0; i < region.connections().size(); i++) {
            token.throwIfCancelled("connection " + i);
            RegionConnection c = region.connections().get(i);
            byte[] n = connectionNames.get(i);
            GuidCodec.writeGuid(buf, c.targetRegionId());
            buf.putInt(n.length);
            buf.put(n);
            buf.putInt(c.departurePortIndex());
            buf.putInt(c.arrivalPortIndex());
            buf.putFloat(c.travelTimeMinutes());
            buf.putFloat(c.dangerLevel());
        }

        // cells
        int total = region.cellCount();
        for (int i = 0; i < total; i++) {
            if (i % RegionFormat.PROGRESS_INTERVAL == 0) {
                token.throwIfCancelled("cells");
                progress.onProgress("Serializing cells", 0.1 + 0.7 * (i / (double) total));
            }
            PackedCellData.pack(region.getCell(i)).writeTo(buf);
        }
        return buf.array();
    }

    // --- чтение ---

    public LoadResult<RegionData> load(Path path) {
        return load(path, ProgressListener.NONE, CancellationToken.none());
    }

    public LoadResult<RegionData> load(Path path, ProgressListener progress, CancellationToken token) {
        ProgressListener p = progress != null ? progress : ProgressListener.NONE;
        CancellationToken t = token != null ? token : CancellationToken.none();
        try {
            p.onProgress("Reading file", 0.0);
            byte[] bytes = Files.readAllBytes(path);
            t.throwIfCancelled("after read");
            return fromBytes(bytes, p, t);
        } catch (OperationCancelledException e) {
            return LoadResult.failure(RegionIoStatus.CANCELLED, e.getMessage());
        } catch (IOException e) {
            return LoadResult.failure(RegionIoStatus.IO_ERROR,
                    "Failed to read region file " + path + ": " + e.getMessage());
        }
    }

    public LoadResult<RegionData> fromBytes(byte[] bytes, ProgressListener progress, CancellationToken token) {
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        try {
            Header header = readHeader(n -> takeFrom(buf, n));
            token.throwIfCancelled("header");

            progress.onProgress("Deserializing", 0.2);
            Meta meta = readMeta(buf, token);

            long expected = (long) header.width * header.height * PackedCellData.SIZE;
            if (buf.remaining() < expected) {
                throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT,
                        "Truncated cell data: need " + expected + " bytes, have " + buf.remaining());
            }

            int total = header.width * header.height;
            CellData[] cells = new CellData[total];
            for (int i = 0; i < total; i++) {
                if (i % RegionFormat.PROGRESS_INTERVAL == 0) {
                    token.throwIfCancelled("cells");
                    progress.onProgress("Deserializing cells", 0.2 + 0.8 * (i / (double) total));
                }
                CellData c = PackedCellData.readFrom(buf).unpack();
                validateCell(c, i, header.width);
                cells[i] = c;
            }

            RegionData region = new RegionData(header.id, meta.name, header.width, header.height,
                    meta.seed, meta.generatedAt, cells);
            region.connections().addAll(meta.connections);
            progress.onProgress("Complete", 1.0);
            return LoadResult.ok(region);
        } catch (OperationCancelledException e) {
            return LoadResult.failure(RegionIoStatus.CANCELLED, e.getMessage());
        } catch (RegionFormatException e) {
            return LoadResult.failure(e.status(), e.getMessage());
        } catch (BufferUnderflowException | EOFException e) {
            return LoadResult.failure(RegionIoStatus.INVALID_FORMAT, "Truncated region data");
        } catch (IOException e) {
            return LoadResult.failure(RegionIoStatus.IO_ERROR, e.getMessage());
        }
    }

    /**
     * Только заголовок и метаданные: клетки с диска не читаются.
     */
    public LoadResult<RegionMetadata> loadMetadata(Path path) {
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            Header header = readHeader(n -> readExactly(ch, n));
            Meta meta = readMeta(n -> readExactly(ch, n), CancellationToken.none());
            return LoadResult.ok(new RegionMetadata(header.id, meta.name, header.width, header.height,
                    meta.seed, meta.generatedAt, meta.connections, header.version, path));
        } catch (RegionFormatException e) {
            return LoadResult.failure(e.status(), e.getMessage());
        } catch (EOFException e) {
            return LoadResult.failure(RegionIoStatus.INVALID_FORMAT, "Truncated region header in " + path);
        } catch (IOException e) {
            return LoadResult.failure(RegionIoStatus.IO_ERROR,
                    "Failed to read region metadata " + path + ": " + e.getMessage());
        }
    }

    // --- async ---

    public CompletableFuture<SaveResult> saveAsync(RegionData region, Path path, ProgressListener progress,
                                                   CancellationToken token, Executor executor) {
        return CompletableFuture.supplyAsync(() -> save(region, path, progress, token), executor);
    }

    public CompletableFuture<LoadResult<RegionData>> loadAsync(Path path, ProgressListener progress,
                                                               CancellationToken token, Executor executor) {
        return CompletableFuture.supplyAsync(() -> load(path, progress, token), executor);
    }

    // --- разбор ---

    /** Источник байтов: буфер в памяти или канал файла. */
    @FunctionalInterface
    private interface ByteSource {
        ByteBuffer take(int n) throws IOException;
    }

    private record Header(int version, UUID id, int width, int height) {
    }

    private record Meta(String name, int seed, Instant generatedAt, List<RegionConnection> connections) {
    }

    private static Header readHeader(ByteSource src) throws IOException {
        ByteBuffer h = src.take(RegionFormat.HEADER_SIZE);
        int magic = h.getInt();
        if (magic != RegionFormat.MAGIC) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT,
                    String.format("Bad magic 0x%08X, expected 0x%08X", magic, RegionFormat.MAGIC));
        }
        int version = h.getInt();
        if (version > RegionFormat.CURRENT_VERSION) {
            throw new RegionFormatException(RegionIoStatus.UNSUPPORTED_VERSION,
                    "Region format version " + version + " is newer than supported " + RegionFormat.CURRENT_VERSION);
        }
        if (version < 1) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT, "Invalid format version " + version);
        }
        UUID id = GuidCodec.readGuid(h);
        int width = h.getInt();
        int height = h.getInt();
        if (width <= 0 || height <= 0 || width > RegionData.MAX_DIMENSION || height > RegionData.MAX_DIMENSION) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT, "Invalid region size " + width + "x" + height);
        }
        return new Header(version, id, width, height);
    }

    private static Meta readMeta(ByteBuffer buf, CancellationToken token) throws IOException {
        return readMeta(n -> takeFrom(buf, n), token);
    }

    private static Meta readMeta(ByteSource src, CancellationToken token) throws IOException {
        String name = readString(src);
        ByteBuffer fixed = src.take(4 + 8 + 4);
        int seed = fixed.getInt();
        Instant generatedAt = GuidCodec.fromTicks(fixed.getLong());
        int count = fixed.getInt();
        if (count < 0 || count > RegionFormat.MAX_CONNECTIONS) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT, "Invalid connection count " + count);
        }
        List<RegionConnection> connections = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            token.throwIfCancelled("connection " + i);
            UUID target = GuidCodec.readGuid(src.take(GuidCodec.GUID_SIZE));
            String targetName = readString(src);
            ByteBuffer rest = src.take(16);
            connections.add(new RegionConnection(target, targetName,
                    rest.getInt(), rest.getInt(), rest.getFloat(), rest.getFloat()));
        }
        return new Meta(name, seed, generatedAt, connections);
    }

    private static String readString(ByteSource src) throws IOException {
        int len = src.take(4).getInt();
        if (len < 0 || len > RegionFormat.MAX_NAME_BYTES) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT, "Invalid string length " + len);
        }
        ByteBuffer b = src.take(len);
        byte[] bytes = new byte[len];
        b.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static ByteBuffer takeFrom(ByteBuffer buf, int n) throws EOFException {
        if (buf.remaining() < n) {
            throw new EOFException("Need " + n + " bytes, have " + buf.remaining());
        }
        ByteBuffer slice = buf.slice().order(ByteOrder.LITTLE_ENDIAN);
        slice.limit(n);
        buf.position(buf.position() + n);
        return slice;
    }

    private static ByteBuffer readExactly(FileChannel ch, int n) throws IOException {
        ByteBuffer b = ByteBuffer.allocate(n).order(ByteOrder.LITTLE_ENDIAN);
        while (b.hasRemaining()) {
            if (ch.read(b) < 0) {
                throw new EOFException("Unexpected end of file");
            }
        }
        b.flip();
        return b;
    }

    private static void validateCell(CellData c, int index, int width) throws RegionFormatException {
        if (c.x != index % width || c.z != index / width) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT,
                    "Cell " + index + " has coordinates " + c.x + "," + c.z);
        }
        if (!TerrainType.isValidIndex(c.terrainTypeIndex)
                || c.specialIndex >= SpecialFeature.values().length
                || c.incomingRiverDirection > 5 || c.outgoingRiverDirection > 5) {
            throw new RegionFormatException(RegionIoStatus.INVALID_FORMAT, "Cell " + index + " has invalid fields");
        }
    }
}
