package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.topology.HexMetrics;
import org.hexregion.core.topology.WorldPosition;
import org.hexregion.core.util.CancellationToken;

import java.util.Arrays;
import java.util.Locale;

/**
 * Высоты из шумового поля. Порог воды берётся квантилем выборки, чтобы доля суши
 * попадала в landFraction настолько точно, насколько позволяет сетка.
 */
public class LandGenerator {

    public void generate(RegionData region, int seed, double landFraction,
                         double frequency, int octaves, CancellationToken token) {
        ValueNoise noise = new ValueNoise(seed + SeedOffsets.LAND);
        int w = region.width();
        int h = region.height();
        double[] v = new double[w * h];

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int z = 0; z < h; z++) {
            token.throwIfCancelled("land row " + z);
            for (int x = 0; x < w; x++) {
                CellData c = region.getCell(x, z);
                WorldPosition p = c.coordinates().toWorldPosition(0);
                double n = noise.sample(p.x(), p.z(), frequency, octaves);
                v[z * w + x] = n;
                if (n < min) min = n;
                if (n > max) max = n;
            }
        }

        // нормализация в [0, 1] по наблюдаемому диапазону
        double range = max - min;
        for (int i = 0; i < v.length; i++) {
            v[i] = (range < 1e-12) ? 0.5 : (v[i] - min) / range;
        }

        double threshold = waterThreshold(v, landFraction);

        int land = 0;
        for (int i = 0; i < v.length; i++) {
            CellData c = region.getCell(i);
            c.elevation = elevationFor(v[i], threshold);
            c.waterLevel = HexMetrics.LAND_MIN_ELEVATION;
            if (!c.isUnderwater()) land++;
        }

        System.out.println(String.format(Locale.ROOT,
                "[LAND] threshold=%.4f land=%d/%d (target %.2f)", threshold, land, v.length, landFraction));
    }

    /**
     * Квантиль (1 - landFraction) нормализованной выборки. Всё, что не ниже порога, становится сушей.
     */
    static double waterThreshold(double[] normalized, double landFraction) {
        int n = normalized.length;
        int k = (int) Math.round((1.0 - landFraction) * n);
        if (k <= 0) {
            return 0.0;
        }
        if (k >= n) {
            return Double.POSITIVE_INFINITY;
        }
        double[] sorted = normalized.clone();
        Arrays.sort(sorted);
        return sorted[k];
    }

    static int elevationFor(double v, double threshold) {
        if (v < threshold) {
            double t = Double.isInfinite(threshold) ? 1.0 : threshold;
            int e = (int) Math.round(v / t * HexMetrics.SEA_LEVEL);
            return Math.max(HexMetrics.MIN_ELEVATION, Math.min(HexMetrics.SEA_LEVEL, e));
        }
        double span = 1.0 - threshold;
        double rel = span <= 1e-12 ? 0.0 : (v - threshold) / span;
        int e = HexMetrics.LAND_MIN_ELEVATION
                + (int) Math.floor(rel * (HexMetrics.MAX_ELEVATION - HexMetrics.LAND_MIN_ELEVATION));
        return Math.min(HexMetrics.MAX_ELEVATION, e);
    }
}
