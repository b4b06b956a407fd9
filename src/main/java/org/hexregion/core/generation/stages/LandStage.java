package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.LandGenerator;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class LandStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.LAND;
    }

    @Override
    public String name() {
        return "Land";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new LandGenerator().generate(ctx.region, ctx.seed, ctx.settings.landFraction,
                ctx.settings.landNoiseFrequency, ctx.settings.landNoiseOctaves, ctx.token);
    }
}
