package org.hexregion.core.service;

import org.hexregion.core.model.CellData;
import org.hexregion.core.model.HexGridSink;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.topology.HexDirection;
import org.hexregion.core.util.CancellationToken;

import java.util.UUID;

/**
 * Перенос региона на сетку и обратно.
 * Три прохода, потому что реки и дороги зависят от соседей: сначала свойства всех клеток,
 * затем реки, затем дороги.
 */
public final class RegionGridApplier {

    private RegionGridApplier() {
    }

    public static void apply(RegionData source, HexGridSink target) {
        apply(source, target, CancellationToken.none());
    }

    public static void apply(RegionData source, HexGridSink target, CancellationToken token) {
        if (source.width() != target.width() || source.height() != target.height()) {
            throw new IllegalArgumentException("Grid size " + target.width() + "x" + target.height()
                    + " does not match region " + source.width() + "x" + source.height());
        }

        // 1: свойства, старые реки и дороги убираем
        for (CellData c : source.cells()) {
            target.setCellProperties(c.x, c.z, c);
            target.removeRiver(c.x, c.z);
            target.removeRoads(c.x, c.z);
        }
        token.throwIfCancelled("apply properties");

        // 2: реки. Сначала рёбра, которые источник записал как входящие у соседа,
        // потом притоки слияний: так входящее направление у клетки слияния совпадает с источником.
        int skipped = 0;
        for (int pass = 0; pass < 2; pass++) {
            for (CellData c : source.cells()) {
                if (!c.hasOutgoingRiver) continue;
                HexDirection d = HexDirection.fromIndex(c.outgoingRiverDirection);
                CellData n = source.getNeighbor(c, d);
                if (n == null) continue;
                boolean primary = n.hasIncomingRiver && n.incomingRiverDirection == d.opposite().index();
                if (primary != (pass == 0)) continue;
                if (!target.setOutgoingRiver(c.x, c.z, d)) skipped++;
            }
        }
        token.throwIfCancelled("apply rivers");

        // 3: дороги
        for (CellData c : source.cells()) {
            for (HexDirection d : HexDirection.values()) {
                if (c.hasRoad(d) && !target.addRoad(c.x, c.z, d)) {
                    skipped++;
                }
            }
        }
        token.throwIfCancelled("apply roads");

        if (skipped > 0) {
            System.out.println("[WARN] Grid rejected " + skipped + " river/road edges while applying region "
                    + source.getName());
        }
    }

    /**
     * Текущее состояние сетки как новый регион.
     */
    public static RegionData extract(RegionData grid, UUID id, String name, int seed) {
        return grid.snapshot(id, name, seed);
    }
}
