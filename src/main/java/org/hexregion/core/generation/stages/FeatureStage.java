package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.FeatureGenerator;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class FeatureStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.FEATURES;
    }

    @Override
    public String name() {
        return "Features";
    }

    @Override
    public void apply(GenerationContext ctx) {
        // объекты ставятся после рек: клетки с рекой остаются пустыми
        new FeatureGenerator().generate(ctx.region, ctx.seed,
                ctx.settings.settlementChance, ctx.settings.specialChance, ctx.token);
    }
}
