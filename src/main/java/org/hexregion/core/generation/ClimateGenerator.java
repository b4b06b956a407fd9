package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.topology.WorldPosition;
import org.hexregion.core.util.CancellationToken;

/**
 * Влажность: отдельное шумовое поле (seed + 1000), от высот не зависит.
 */
public class ClimateGenerator {

    public void generate(RegionData region, int seed, double frequency, int octaves, CancellationToken token) {
        ValueNoise noise = new ValueNoise(seed + SeedOffsets.MOISTURE);
        double[] m = new double[region.cellCount()];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < m.length; i++) {
            if ((i % region.width()) == 0) {
                token.throwIfCancelled("climate row " + (i / region.width()));
            }
            CellData c = region.getCell(i);
            WorldPosition p = c.coordinates().toWorldPosition(0);
            m[i] = noise.sample(p.x(), p.z(), frequency, octaves);
            min = Math.min(min, m[i]);
            max = Math.max(max, m[i]);
        }

        double range = max - min;
        for (int i = 0; i < m.length; i++) {
            double v = (range < 1e-12) ? 0.5 : (m[i] - min) / range;
            region.getCell(i).moisture = (float) Math.max(0.0, Math.min(1.0, v));
        }
    }
}
