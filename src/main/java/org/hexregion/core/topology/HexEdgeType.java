package org.hexregion.core.topology;

public enum HexEdgeType {
    FLAT,
    SLOPE,
    CLIFF
}
