package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.BiomeClassifier;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class BiomeStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.BIOMES;
    }

    @Override
    public String name() {
        return "Biomes";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new BiomeClassifier().apply(ctx.region);
    }
}
