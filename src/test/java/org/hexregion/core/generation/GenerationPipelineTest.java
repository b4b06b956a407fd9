package org.hexregion.core.generation;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.hexregion.core.io.PackedCellData;
import org.hexregion.core.io.ProgressListener;
import org.hexregion.core.io.RegionSerializer;
import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.util.CancellationToken;
import org.hexregion.core.util.OperationCancelledException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.UUID;

@ExtendWith(MockitoExtension.class)
public class GenerationPipelineTest {

    @Mock(strictness = Mock.Strictness.LENIENT)
    StageListener listener;

    private static GeneratorSettings settings(int seed) {
        GeneratorSettings s = new GeneratorSettings(seed);
        s.width = 50;
        s.height = 50;
        return s;
    }

    private static RegionData run(GenerationPipeline pipeline, GeneratorSettings s, CancellationToken token) {
        RegionData region = RegionData.createEmpty(UUID.randomUUID(), s.name, s.width, s.height, s.seed);
        pipeline.run(new GenerationContext(region, s, token));
        return region;
    }

    @Test
    void testSameSeedGivesSameRegion() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener, false);
        RegionData a = run(pipeline, settings(42), CancellationToken.none());
        RegionData b = run(pipeline, settings(42), CancellationToken.none());

        // упакованная клетка покрывает все сохраняемые поля, влажность сверяем ещё и без округления
        for (int i = 0; i < a.cellCount(); i++) {
            CellData x = a.getCell(i);
            CellData y = b.getCell(i);
            assertEquals(PackedCellData.pack(x), PackedCellData.pack(y), "cell " + x.x + "," + x.z);
            assertEquals(Float.floatToIntBits(x.moisture), Float.floatToIntBits(y.moisture));
        }
        assertArrayEquals(cellSection(a), cellSection(b));
    }

    private static byte[] cellSection(RegionData region) {
        byte[] all = new RegionSerializer().toBytes(region, ProgressListener.NONE, CancellationToken.none());
        int cells = region.cellCount() * PackedCellData.SIZE;
        return Arrays.copyOfRange(all, all.length - cells, all.length);
    }

    @Test
    void testDifferentSeedsDiffer() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.terrainOnly(), false, listener, false);
        RegionData a = run(pipeline, settings(1), CancellationToken.none());
        RegionData b = run(pipeline, settings(2), CancellationToken.none());

        int diff = 0;
        for (int i = 0; i < a.cellCount(); i++) {
            if (a.getCell(i).elevation != b.getCell(i).elevation) diff++;
        }
        assertTrue(diff > 0);
    }

    @Test
    void testSeed42HasLandAndWaterAndPassesChecks() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener, false);
        RegionData region = run(pipeline, settings(42), CancellationToken.none());

        RegionStats stats = RegionStats.compute(region);
        assertTrue(stats.landCount > 0);
        assertTrue(stats.waterCount > 0);
        assertEquals(0.5, stats.landRatio(), 0.02);
        assertTrue(stats.elevationMin >= 0 && stats.elevationMax <= 13);
        Validation.checkRivers(region);
        Validation.checkRoads(region);
    }

    @Test
    void testListenerSeesEveryStageInOrder() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener, false);
        run(pipeline, settings(7), CancellationToken.none());

        InOrder order = inOrder(listener);
        for (StageId id : StageId.values()) {
            order.verify(listener).onStageStart(eq(id), anyString());
            order.verify(listener).onStageEnd(eq(id), anyString(), anyLong());
        }
    }

    @Test
    void testTerrainOnlyProfileSkipsLaterStages() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.terrainOnly(), true, listener, false);
        RegionData region = run(pipeline, settings(7), CancellationToken.none());

        verify(listener, times(3)).onStageStart(any(StageId.class), anyString());
        verify(listener, never()).onStageStart(eq(StageId.RIVERS), anyString());
        verify(listener, never()).onStageStart(eq(StageId.ROADS), anyString());
        for (CellData c : region.cells()) {
            assertFalse(c.hasRiver());
            assertFalse(c.hasRoads());
            assertEquals(0, c.urbanLevel);
        }
    }

    @Test
    void testWithoutRoadsProfile() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.withoutRoads(), true, listener, false);
        RegionData region = run(pipeline, settings(7), CancellationToken.none());
        for (CellData c : region.cells()) {
            assertFalse(c.hasRoads());
        }
        verify(listener, never()).onStageStart(eq(StageId.ROADS), anyString());
    }

    @Test
    void testCancelledBeforeStartThrows() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener, false);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(OperationCancelledException.class, () -> run(pipeline, settings(3), token));
        verify(listener, never()).onStageStart(any(StageId.class), anyString());
    }

    @Test
    void testCancelledMidRunIsNotWrapped() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener, false);
        CancellationToken token = new CancellationToken();
        doAnswer(inv -> {
            token.cancel();
            return null;
        }).when(listener).onStageStart(eq(StageId.CLIMATE), anyString());

        assertThrows(OperationCancelledException.class, () -> run(pipeline, settings(3), token));
        verify(listener).onStageEnd(eq(StageId.CLIMATE), anyString(), anyLong());
        verify(listener, never()).onStageStart(eq(StageId.BIOMES), anyString());
    }

    @Test
    void testStagesAreFixedOrder() {
        GenerationPipeline pipeline = new GenerationPipeline();
        StageId[] ids = pipeline.stages().stream().map(GenerationStage::id).toArray(StageId[]::new);
        assertArrayEquals(StageId.values(), ids);
    }
}
