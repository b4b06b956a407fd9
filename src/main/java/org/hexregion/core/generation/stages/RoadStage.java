package org.hexregion.core.generation.stages;

import org.hexregion.core.generation.RoadGenerator;
import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationStage;
import org.hexregion.core.generation.StageId;

public class RoadStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.ROADS;
    }

    @Override
    public String name() {
        return "Roads";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new RoadGenerator().generate(ctx.region, ctx.seed, ctx.settings.maxRoadDistance, ctx.token);
    }
}
