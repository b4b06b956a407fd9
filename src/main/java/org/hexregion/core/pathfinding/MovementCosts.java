package org.hexregion.core.pathfinding;

/**
 * Стандартные функции стоимости. Все без состояния, их можно делить между потоками.
 */
public final class MovementCosts {

    public static final LandMovementCost LAND = new LandMovementCost();
    public static final NavalMovementCost NAVAL = new NavalMovementCost();
    public static final AmphibiousMovementCost AMPHIBIOUS = new AmphibiousMovementCost(LAND, NAVAL);
    public static final RoadBuildCost ROAD = new RoadBuildCost();

    private MovementCosts() {
    }

    public static MovementCostFunction forDomain(UnitDomain domain) {
        return switch (domain) {
            case LAND -> LAND;
            case NAVAL -> NAVAL;
            case AMPHIBIOUS -> AMPHIBIOUS;
        };
    }
}
