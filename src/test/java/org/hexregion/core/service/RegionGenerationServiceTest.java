package org.hexregion.core.service;

import static org.junit.jupiter.api.Assertions.*;

import org.hexregion.core.TestRegions;
import org.hexregion.core.generation.GenerationPipeline;
import org.hexregion.core.generation.StageId;
import org.hexregion.core.generation.StageListener;
import org.hexregion.core.generation.StageProfile;
import org.hexregion.core.io.LoadResult;
import org.hexregion.core.io.ProgressListener;
import org.hexregion.core.io.RegionIoStatus;
import org.hexregion.core.io.RegionSerializer;
import org.hexregion.core.io.SaveResult;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.util.CancellationToken;
import org.hexregion.core.util.OperationCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class RegionGenerationServiceTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private RegionGenerationService service;

    private static final StageListener QUIET = new StageListener() {
        @Override
        public void onStageStart(StageId id, String name) {
        }

        @Override
        public void onStageEnd(StageId id, String name, long elapsedMs) {
        }
    };

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, QUIET, false);
        service = new RegionGenerationService(pipeline, new RegionSerializer(), executor);
    }

    @AfterEach
    void tearDown() {
        service.close();
        executor.shutdownNow();
    }

    private static GeneratorSettings settings(int seed) {
        GeneratorSettings s = new GeneratorSettings(seed);
        s.name = "Test";
        s.width = 50;
        s.height = 50;
        return s;
    }

    @Test
    void testGenerateAsyncCompletes() throws Exception {
        GeneratorSettings s = settings(42);
        RegionData region = service.generateAsync(s, CancellationToken.none()).get(60, TimeUnit.SECONDS);

        assertEquals(RegionGenerationService.regionIdFor(s), region.getId());
        assertEquals("Test", region.getName());
        assertEquals(2500, region.cellCount());
        assertFalse(service.isBusy(region.getId()));
    }

    @Test
    void testRegionIdIsStable() {
        assertEquals(RegionGenerationService.regionIdFor(settings(1)), RegionGenerationService.regionIdFor(settings(1)));
        assertNotEquals(RegionGenerationService.regionIdFor(settings(1)), RegionGenerationService.regionIdFor(settings(2)));
    }

    @Test
    void testInvalidSettingsRejectedUpFront() {
        GeneratorSettings s = settings(1);
        s.width = 10;
        assertThrows(IllegalArgumentException.class, () -> service.generateAsync(s, CancellationToken.none()));
    }

    @Test
    void testCancelledGenerationFailsWithCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> service.generateAsync(settings(5), token).get(60, TimeUnit.SECONDS));
        assertInstanceOf(OperationCancelledException.class, e.getCause());
    }

    @Test
    void testSecondOperationOnSameRegionIsRefused() throws Exception {
        RegionData region = TestRegions.flatPlains(50, 50);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProgressListener blocking = (stage, fraction) -> {
            if ("Preparing".equals(stage)) {
                started.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        Path file = tempDir.resolve("busy.region");
        var first = service.saveAsync(region, file, blocking, CancellationToken.none());
        assertTrue(started.await(30, TimeUnit.SECONDS));
        assertTrue(service.isBusy(region.getId()));
        assertThrows(IllegalStateException.class,
                () -> service.saveAsync(region, file, ProgressListener.NONE, CancellationToken.none()));

        release.countDown();
        SaveResult saved = first.get(30, TimeUnit.SECONDS);
        assertTrue(saved.isSuccess());
        assertFalse(service.isBusy(region.getId()));

        assertTrue(service.saveAsync(region, file, ProgressListener.NONE, CancellationToken.none())
                .get(30, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    void testSaveAndLoadAsync() throws Exception {
        RegionData region = service.generate(settings(8), CancellationToken.none());
        Path file = tempDir.resolve("nested").resolve("r.region");

        SaveResult saved = service.saveAsync(region, file, ProgressListener.NONE, CancellationToken.none())
                .get(30, TimeUnit.SECONDS);
        assertTrue(saved.isSuccess(), saved.message());
        assertTrue(Files.exists(file));

        LoadResult<RegionData> loaded = service.loadAsync(file, ProgressListener.NONE, CancellationToken.none())
                .get(30, TimeUnit.SECONDS);
        assertTrue(loaded.isSuccess());
        assertEquals(region.getId(), loaded.value().getId());
    }

    @Test
    void testLoadMissingFileReportsIoError() throws Exception {
        LoadResult<RegionData> r = service.loadAsync(tempDir.resolve("missing.region"), ProgressListener.NONE,
                CancellationToken.none()).get(30, TimeUnit.SECONDS);
        assertEquals(RegionIoStatus.IO_ERROR, r.status());
    }

    @Test
    void testCloseDoesNotShutDownForeignExecutor() {
        service.close();
        assertFalse(executor.isShutdown());
    }
}
