package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.RiverGenerator;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class RiverStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.RIVERS;
    }

    @Override
    public String name() {
        return "Rivers";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new RiverGenerator().generate(ctx.region, ctx.seed, ctx.settings.riverFraction, ctx.token);
    }
}
