package org.hexregion.core.generation;

import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.util.CancellationToken;

/**
 * Контекст одной генерации региона (один запуск = один контекст).
 * Регион принадлежит запуску целиком, пока пайплайн не закончит.
 */
public class GenerationContext {

    public final RegionData region;
    public final GeneratorSettings settings;
    public final CancellationToken token;

    /** Базовый сид; каждый проход добавляет своё смещение из {@link SeedOffsets}. */
    public final int seed;

    public GenerationContext(RegionData region, GeneratorSettings settings, CancellationToken token) {
        this.region = region;
        this.settings = settings;
        this.token = (token != null) ? token : CancellationToken.none();
        this.seed = settings.seed;
    }

    public void checkCancelled(String where) {
        token.throwIfCancelled(where);
    }
}
