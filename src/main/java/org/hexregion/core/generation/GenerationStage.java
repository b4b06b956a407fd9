package org.hexregion.core.generation;

public interface GenerationStage {
    StageId id();
    String name();
    void apply(GenerationContext ctx);
}
