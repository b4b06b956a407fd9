package org.hexregion.core.pathfinding;

public enum UnitDomain {
    LAND,
    NAVAL,
    AMPHIBIOUS
}
