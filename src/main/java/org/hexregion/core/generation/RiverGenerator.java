package org.hexregion.core.generation;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.topology.HexMetrics;
import org.hexregion.core.util.CancellationToken;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Реки от влажных возвышенностей вниз по склону до воды, слияния или локального минимума.
 * Один RNG (seed + 7777) на весь проход.
 */
public class RiverGenerator {

    static final double MIN_SOURCE_FITNESS = 0.25;
    static final int MIN_RIVER_LENGTH = 3;
    static final int MAX_RIVER_STEPS = 100;
    static final double STEEPNESS_WEIGHT = 3.0;

    /** Итог прохода: сколько рек и клеток с рекой добавлено. */
    public record Result(int rivers, int riverCells, int attempts, int budget) {
    }

    public Result generate(RegionData region, int seed, double riverFraction, CancellationToken token) {
        Random rng = new Random(seed + SeedOffsets.RIVERS);

        int landCells = 0;
        for (CellData c : region.cells()) {
            if (!c.isUnderwater()) landCells++;
        }
        int budget = (int) Math.floor(landCells * riverFraction);

        List<CellData> sources = new ArrayList<>();
        List<Integer> weights = new ArrayList<>();
        for (CellData c : region.cells()) {
            if (isEligibleSource(region, c)) {
                sources.add(c);
                weights.add(weightFor(fitness(c)));
            }
        }

        int maxAttempts = sources.size() * 2;
        int attempts = 0;
        int riverCells = 0;
        int rivers = 0;

        while (riverCells < budget && !sources.isEmpty() && attempts < maxAttempts) {
            attempts++;
            token.throwIfCancelled("river attempt " + attempts);

            int pick = pickWeighted(weights, rng);
            CellData source = sources.remove(pick);
            weights.remove(pick);

            // за время прохода соседи могли обзавестись рекой
            if (!isEligibleSource(region, source)) {
                continue;
            }

            List<CellData> path = new ArrayList<>();
            List<HexDirection> dirs = new ArrayList<>();
            trace(region, source, rng, path, dirs);

            if (dirs.size() < MIN_RIVER_LENGTH) {
                continue;
            }
            commit(path, dirs);
            rivers++;
            riverCells += dirs.size();
        }

        System.out.println("[RIVERS] rivers=" + rivers + " cells=" + riverCells
                + " budget=" + budget + " attempts=" + attempts);
        return new Result(rivers, riverCells, attempts, budget);
    }

    static double fitness(CellData c) {
        double h = (c.elevation - HexMetrics.SEA_LEVEL)
                / (double) (HexMetrics.MAX_ELEVATION - HexMetrics.SEA_LEVEL);
        return c.moisture * h;
    }

    static int weightFor(double fitness) {
        if (fitness >= 0.75) return 4;
        if (fitness >= 0.5) return 2;
        return 1;
    }

    static boolean isEligibleSource(RegionData region, CellData c) {
        if (c.isUnderwater() || c.hasRiver()) return false;
        if (fitness(c) < MIN_SOURCE_FITNESS) return false;
        for (HexDirection d : HexDirection.values()) {
            CellData n = region.getNeighbor(c, d);
            if (n == null) continue;
            if (n.isUnderwater() || n.hasRiver()) return false;
        }
        return true;
    }

    private static int pickWeighted(List<Integer> weights, Random rng) {
        int total = 0;
        for (int w : weights) total += w;
        int roll = rng.nextInt(total);
        for (int i = 0; i < weights.size(); i++) {
            roll -= weights.get(i);
            if (roll < 0) return i;
        }
        return weights.size() - 1;
    }

    /**
     * Строго вниз по склону; шаг выбирается с весом 1 + 3 * перепад.
     * Шаг в воду или в клетку с рекой включается в трассу и заканчивает её.
     */
    private void trace(RegionData region, CellData source, Random rng,
                       List<CellData> path, List<HexDirection> dirs) {
        Set<CellData> visited = new HashSet<>();
        CellData current = source;
        path.add(current);
        visited.add(current);

        List<HexDirection> options = new ArrayList<>(6);
        List<Double> optionWeights = new ArrayList<>(6);

        for (int step = 0; step < MAX_RIVER_STEPS; step++) {
            options.clear();
            optionWeights.clear();
            double total = 0.0;
            for (HexDirection d : HexDirection.values()) {
                CellData n = region.getNeighbor(current, d);
                if (n == null || visited.contains(n) || n.elevation >= current.elevation) continue;
                double w = 1.0 + STEEPNESS_WEIGHT * (current.elevation - n.elevation);
                options.add(d);
                optionWeights.add(w);
                total += w;
            }
            if (options.isEmpty()) {
                return;
            }

            double roll = rng.nextDouble() * total;
            HexDirection chosen = options.get(options.size() - 1);
            for (int i = 0; i < options.size(); i++) {
                roll -= optionWeights.get(i);
                if (roll < 0) {
                    chosen = options.get(i);
                    break;
                }
            }

            CellData next = region.getNeighbor(current, chosen);
            path.add(next);
            dirs.add(chosen);
            visited.add(next);

            if (next.isUnderwater() || next.hasRiver()) {
                return; // устье или слияние
            }
            current = next;
        }
    }

    private void commit(List<CellData> path, List<HexDirection> dirs) {
        for (int i = 0; i < dirs.size(); i++) {
            CellData from = path.get(i);
            CellData to = path.get(i + 1);
            HexDirection d = dirs.get(i);
            from.hasOutgoingRiver = true;
            from.outgoingRiverDirection = d.index();
            if (!to.hasIncomingRiver) {
                to.hasIncomingRiver = true;
                to.incomingRiverDirection = d.opposite().index();
            }
        }
    }
}
