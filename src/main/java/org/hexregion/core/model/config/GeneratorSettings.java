package org.hexregion.core.model.config;

import java.util.Locale;

/**
 * Параметры одной генерации региона. Значения по умолчанию можно перекрыть
 * локальным файлом ({@link GeneratorSettingsLoader}) и затем системными свойствами / env.
 */
public class GeneratorSettings {

    public String name = "Region";
    public int width = RegionConfig.DEFAULT_WIDTH;
    public int height = RegionConfig.DEFAULT_HEIGHT;
    public int seed;

    // Доля суши 0..1
    public double landFraction = 0.5;
    // Бюджет рек: доля клеток суши
    public double riverFraction = 0.1;

    // --- шум ---
    public double landNoiseFrequency = 0.04;
    public int landNoiseOctaves = 4;
    public double moistureNoiseFrequency = 0.03;
    public int moistureNoiseOctaves = 4;

    // --- поселения и объекты ---
    public double settlementChance = 0.3;
    public double specialChance = 0.02;

    // Пары поселений дальше этого (в гексах) дорогой не соединяем
    public int maxRoadDistance = 20;

    // Проверки инвариантов после каждой стадии
    public boolean validation = true;

    public GeneratorSettings(int seed) {
        this.seed = seed;
    }

    public void applyOverridesFromSystem() {
        name = pick(System.getProperty("region.name"), System.getenv("REGION_NAME"), name);
        width = pickInt(width, System.getProperty("region.width"), System.getenv("REGION_WIDTH"));
        height = pickInt(height, System.getProperty("region.height"), System.getenv("REGION_HEIGHT"));
        seed = pickInt(seed, System.getProperty("region.seed"), System.getenv("REGION_SEED"));
        landFraction = pickDouble(landFraction,
                System.getProperty("region.landFraction"), System.getenv("REGION_LAND_FRACTION"));
        riverFraction = pickDouble(riverFraction,
                System.getProperty("region.riverFraction"), System.getenv("REGION_RIVER_FRACTION"));
        maxRoadDistance = pickInt(maxRoadDistance,
                System.getProperty("region.maxRoadDistance"), System.getenv("REGION_MAX_ROAD_DISTANCE"));
        String v = pick(System.getProperty("region.validation"), System.getenv("REGION_VALIDATION"));
        if (v != null) {
            validation = Boolean.parseBoolean(v);
        }
    }

    public void validate() {
        if (width < RegionConfig.MIN_SIZE || width > RegionConfig.MAX_SIZE
                || height < RegionConfig.MIN_SIZE || height > RegionConfig.MAX_SIZE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Region size %dx%d outside [%d..%d]", width, height,
                    RegionConfig.MIN_SIZE, RegionConfig.MAX_SIZE));
        }
        requireFraction("landFraction", landFraction);
        requireFraction("riverFraction", riverFraction);
        requireFraction("settlementChance", settlementChance);
        requireFraction("specialChance", specialChance);
        if (landNoiseOctaves < 1 || moistureNoiseOctaves < 1) {
            throw new IllegalArgumentException("Noise octaves must be >= 1");
        }
        if (maxRoadDistance < 1) {
            throw new IllegalArgumentException("maxRoadDistance must be >= 1: " + maxRoadDistance);
        }
    }

    private static void requireFraction(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be in [0, 1]: " + value);
        }
    }

    static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) {
                String trimmed = value.trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }

    static int pickInt(int fallback, String... values) {
        String v = pick(values);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + v, e);
        }
    }

    static double pickDouble(double fallback, String... values) {
        String v = pick(values);
        if (v == null) return fallback;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + v, e);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "GeneratorSettings[%s %dx%d seed=%d land=%.2f rivers=%.2f]",
                name, width, height, seed, landFraction, riverFraction);
    }
}
