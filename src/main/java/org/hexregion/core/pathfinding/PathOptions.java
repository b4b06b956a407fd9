package org.hexregion.core.pathfinding;

import org.hexregion.core.util.CancellationToken;

/**
 * Параметры запроса. Неизменяемый, with* возвращают копию.
 */
public final class PathOptions {

    private static final PathOptions DEFAULTS = new PathOptions(false, Double.POSITIVE_INFINITY,
            UnitDomain.LAND, null, UnitOccupancy.NONE, null);

    private final boolean ignoreUnits;
    private final double maxCost;
    private final UnitDomain domain;
    private final MovementCostFunction costFunction;
    private final UnitOccupancy occupancy;
    private final CancellationToken token;

    private PathOptions(boolean ignoreUnits, double maxCost, UnitDomain domain,
                        MovementCostFunction costFunction, UnitOccupancy occupancy, CancellationToken token) {
        this.ignoreUnits = ignoreUnits;
        this.maxCost = maxCost;
        this.domain = domain;
        this.costFunction = costFunction;
        this.occupancy = occupancy;
        this.token = token;
    }

    public static PathOptions defaults() {
        return DEFAULTS;
    }

    public static PathOptions forDomain(UnitDomain domain) {
        return DEFAULTS.withDomain(domain);
    }

    public PathOptions withIgnoreUnits(boolean value) {
        return new PathOptions(value, maxCost, domain, costFunction, occupancy, token);
    }

    public PathOptions withMaxCost(double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException("maxCost must be >= 0: " + value);
        }
        return new PathOptions(ignoreUnits, value, domain, costFunction, occupancy, token);
    }

    public PathOptions withDomain(UnitDomain value) {
        if (value == null) {
            throw new IllegalArgumentException("domain is null");
        }
        return new PathOptions(ignoreUnits, maxCost, value, costFunction, occupancy, token);
    }

    /** Явная функция стоимости вместо стандартной для домена. */
    public PathOptions withCostFunction(MovementCostFunction value) {
        return new PathOptions(ignoreUnits, maxCost, domain, value, occupancy, token);
    }

    public PathOptions withOccupancy(UnitOccupancy value) {
        return new PathOptions(ignoreUnits, maxCost, domain, costFunction,
                value != null ? value : UnitOccupancy.NONE, token);
    }

    public PathOptions withCancellation(CancellationToken value) {
        return new PathOptions(ignoreUnits, maxCost, domain, costFunction, occupancy, value);
    }

    public boolean ignoreUnits() {
        return ignoreUnits;
    }

    public double maxCost() {
        return maxCost;
    }

    public UnitDomain domain() {
        return domain;
    }

    public MovementCostFunction costFunction() {
        return costFunction != null ? costFunction : MovementCosts.forDomain(domain);
    }

    public UnitOccupancy occupancy() {
        return occupancy;
    }

    public CancellationToken token() {
        return token;
    }
}
