package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.SpecialFeature;
import org.hexregion.core.model.TerrainType;
import org.hexregion.core.util.CancellationToken;

import java.util.Random;

/**
 * Растительность, фермы, застройка и особые объекты (замки, зиккураты, мегафлора).
 * Клетки под водой и с реками пропускаются.
 */
public class FeatureGenerator {

    private static final int CASTLE_MIN_ELEVATION = 7;
    private static final double MEGAFLORA_MIN_MOISTURE = 0.85;

    public void generate(RegionData region, int seed, double settlementChance, double specialChance,
                         CancellationToken token) {
        Random rng = new Random(seed + SeedOffsets.FEATURES);

        int planted = 0;
        int urban = 0;
        int specials = 0;

        int i = 0;
        for (CellData c : region.cells()) {
            if ((i++ % 10_000) == 0) {
                token.throwIfCancelled("features");
            }
            c.urbanLevel = 0;
            c.farmLevel = 0;
            c.plantLevel = 0;
            c.specialIndex = 0;
            c.walled = false;

            if (c.isUnderwater() || c.hasRiver()) {
                continue;
            }

            TerrainType terrain = c.terrainType();

            double plantChance = plantChance(terrain);
            if (plantChance > 0 && rng.nextDouble() < plantChance) {
                c.plantLevel = 1 + rng.nextInt(3);
                planted++;
            }

            if (rng.nextDouble() < settlementChance) {
                assignSettlement(c, terrain, rng);
                if (c.urbanLevel > 0) urban++;
            }

            if (rng.nextDouble() < specialChance) {
                SpecialFeature special = pickSpecial(c, terrain);
                if (special != SpecialFeature.NONE) {
                    c.specialIndex = special.index();
                    c.urbanLevel = 0;
                    c.farmLevel = 0;
                    c.plantLevel = 0;
                    c.walled = false;
                    specials++;
                }
            }
        }

        System.out.println("[FEATURES] planted=" + planted + " urban=" + urban + " specials=" + specials);
    }

    private static double plantChance(TerrainType terrain) {
        return switch (terrain) {
            case FOREST -> 0.7;
            case JUNGLE -> 0.85;
            case PLAINS -> 0.15;
            case SAVANNA -> 0.1;
            case HILLS -> 0.2;
            case MOUNTAINS -> 0.05;
            case TAIGA -> 0.4;
            case TUNDRA -> 0.05;
            default -> 0.0;
        };
    }

    private static void assignSettlement(CellData c, TerrainType terrain, Random rng) {
        switch (terrain) {
            case PLAINS, SAVANNA -> {
                c.urbanLevel = 1 + rng.nextInt(3);
                if (c.moisture >= 0.3 && c.moisture <= 0.7) {
                    c.farmLevel = 1 + rng.nextInt(2);
                }
            }
            case FOREST, TAIGA -> {
                c.urbanLevel = rng.nextInt(3);
                c.farmLevel = rng.nextInt(2);
            }
            case HILLS, DESERT, TUNDRA -> c.urbanLevel = rng.nextInt(3);
            default -> {
                // джунгли, горы, снег: не застраиваем
            }
        }
        c.walled = c.urbanLevel == 3;
    }

    private static SpecialFeature pickSpecial(CellData c, TerrainType terrain) {
        if (terrain == TerrainType.DESERT) {
            return SpecialFeature.ZIGGURAT;
        }
        if ((terrain == TerrainType.PLAINS || terrain == TerrainType.SAVANNA || terrain == TerrainType.HILLS)
                && c.elevation >= CASTLE_MIN_ELEVATION) {
            return SpecialFeature.CASTLE;
        }
        if (terrain == TerrainType.JUNGLE && c.moisture > MEGAFLORA_MIN_MOISTURE) {
            return SpecialFeature.MEGAFLORA;
        }
        return SpecialFeature.NONE;
    }
}
