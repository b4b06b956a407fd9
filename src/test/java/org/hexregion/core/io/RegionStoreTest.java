package org.hexregion.core.io;

import static org.junit.jupiter.api.Assertions.*;

import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RegionMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public class RegionStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testResolve_AppendsExtension() {
        RegionStore store = new RegionStore(tempDir, new RegionSerializer());
        assertEquals(tempDir.resolve("north.region"), store.resolve("north"));
        assertEquals(tempDir.resolve("north.region"), store.resolve("north.region"));
    }

    @Test
    void testResolve_AbsolutePathIsKept() {
        RegionStore store = new RegionStore(tempDir, new RegionSerializer());
        Path abs = tempDir.resolve("elsewhere").resolve("x.region").toAbsolutePath();
        assertEquals(abs, store.resolve(abs.toString()));
    }

    @Test
    void testResolve_BlankNameRejected() {
        RegionStore store = new RegionStore(tempDir, new RegionSerializer());
        assertThrows(IllegalArgumentException.class, () -> store.resolve(" "));
        assertThrows(IllegalArgumentException.class, () -> store.resolve(null));
    }

    @Test
    void testMissingDirectoryListsNothing() {
        RegionStore store = new RegionStore(tempDir.resolve("absent"), new RegionSerializer());
        assertTrue(store.listRegionFiles().isEmpty());
        assertTrue(store.catalog().isEmpty());
    }

    @Test
    void testCatalog_SkipsForeignAndBrokenFiles() throws IOException {
        RegionSerializer serializer = new RegionSerializer();
        RegionStore store = new RegionStore(tempDir, serializer);

        RegionData b = RegionData.createEmpty(UUID.randomUUID(), "Bravo", 10, 8, 2);
        RegionData a = RegionData.createEmpty(UUID.randomUUID(), "Alpha", 6, 6, 1);
        assertTrue(serializer.save(b, store.resolve("b")).isSuccess());
        assertTrue(serializer.save(a, store.resolve("a")).isSuccess());
        Files.writeString(tempDir.resolve("notes.txt"), "not a region");
        Files.write(tempDir.resolve("broken.region"), new byte[] {1, 2, 3, 4});

        assertTrue(store.exists("a"));
        assertFalse(store.exists("c"));
        assertEquals(3, store.listRegionFiles().size());

        List<RegionMetadata> catalog = store.catalog();
        assertEquals(2, catalog.size());
        assertEquals("Alpha", catalog.get(0).name());
        assertEquals("Bravo", catalog.get(1).name());
        assertEquals(80, catalog.get(1).cellCount());
    }
}
