package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.ClimateGenerator;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class ClimateStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.CLIMATE;
    }

    @Override
    public String name() {
        return "Climate";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new ClimateGenerator().generate(ctx.region, ctx.seed,
                ctx.settings.moistureNoiseFrequency, ctx.settings.moistureNoiseOctaves, ctx.token);
    }
}
