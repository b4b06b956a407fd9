package org.hexregion.core.generation;

/**
 * Многооктавный value noise: решётка хешированных значений со сглаживанием smoothstep.
 * Результат в [0, 1]. Детерминирован по сиду.
 */
public class ValueNoise {

    private final long seed;

    public ValueNoise(long seed) {
        this.seed = seed;
    }

    public double sample(double x, double z, double frequency, int octaves) {
        double amplitude = 1.0;
        double freq = frequency;
        double sum = 0.0;
        double norm = 0.0;
        for (int o = 0; o < octaves; o++) {
            sum += lattice(x * freq, z * freq, o) * amplitude;
            norm += amplitude;
            amplitude *= 0.5;
            freq *= 2.0;
        }
        return norm == 0.0 ? 0.0 : sum / norm;
    }

    private double lattice(double x, double z, int octave) {
        int x0 = (int) Math.floor(x);
        int z0 = (int) Math.floor(z);
        double fx = smooth(x - x0);
        double fz = smooth(z - z0);

        double v00 = noise01(x0, z0, octave);
        double v10 = noise01(x0 + 1, z0, octave);
        double v01 = noise01(x0, z0 + 1, octave);
        double v11 = noise01(x0 + 1, z0 + 1, octave);

        double a = v00 + (v10 - v00) * fx;
        double b = v01 + (v11 - v01) * fx;
        return a + (b - a) * fz;
    }

    private static double smooth(double t) {
        return t * t * (3.0 - 2.0 * t);
    }

    private double noise01(int ix, int iz, int octave) {
        long id = (ix * 374_761_393L) ^ (iz * 668_265_263L) ^ (octave * 1_013_904_223L);
        long x = seed + id * 0x9E3779B97F4A7C15L;
        x ^= (x >>> 27);
        x *= 0x3C79AC492BA7B653L;
        x ^= (x >>> 33);
        x *= 0x1C69B3F74AC4AE35L;
        x ^= (x >>> 27);
        long v = x & 0xFFFFFFFFL;
        return v / (double) 0xFFFFFFFFL;
    }
}
