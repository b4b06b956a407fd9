package org.hexregion.core.generation;

import org.hexregion.core.generation.stages.BiomeStage;
import org.hexregion.core.generation.stages.ClimateStage;
import org.hexregion.core.generation.stages.FeatureStage;
import org.hexregion.core.generation.stages.LandStage;
import org.hexregion.core.generation.stages.RiverStage;
import org.hexregion.core.generation.stages.RoadStage;
import org.hexregion.core.util.OperationCancelledException;

import java.util.ArrayList;
import java.util.List;

public class GenerationPipeline {

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;
    private final boolean printStats;

    public GenerationPipeline(StageProfile profile,
                              boolean enableValidation,
                              StageListener listener,
                              boolean printStats) {
        this.profile = (profile != null) ? profile : StageProfile.full();
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();
        this.printStats = printStats;

        // Порядок фиксирован: реки читают высоты, дороги читают реки и поселения
        stages.add(new LandStage());
        stages.add(new ClimateStage());
        stages.add(new BiomeStage());
        stages.add(new RiverStage());
        stages.add(new FeatureStage());
        stages.add(new RoadStage());
    }

    /**
     * Полный профиль, проверки включены, вывод в консоль.
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new ConsoleStageListener(), true);
    }

    public List<GenerationStage> stages() {
        return List.copyOf(stages);
    }

    public RegionStats run(GenerationContext ctx) {
        for (GenerationStage stage : stages) {
            ctx.checkCancelled("before stage " + stage.id());

            if (!profile.isEnabled(stage.id())) {
                System.out.println("[STAGE SKIP]  " + stage.id() + " - " + stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                stage.apply(ctx);

                if (enableValidation && ctx.settings.validation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }
        ctx.checkCancelled("after generation");

        RegionStats stats = RegionStats.compute(ctx.region);
        if (printStats) {
            RegionStatsReport.print(stats);
        }
        return stats;
    }

    private void runValidation(StageId id, GenerationContext ctx) {
        switch (id) {
            case LAND -> Validation.afterLand(ctx);
            case CLIMATE -> Validation.afterClimate(ctx);
            case BIOMES -> Validation.afterBiomes(ctx);
            case RIVERS -> Validation.afterRivers(ctx);
            case FEATURES -> Validation.afterFeatures(ctx);
            case ROADS -> Validation.afterRoads(ctx);
        }
    }
}
