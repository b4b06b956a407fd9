package org.hexregion.core.model;

public enum SpecialFeature {
    NONE,
    CASTLE,
    ZIGGURAT,
    MEGAFLORA;

    private static final SpecialFeature[] VALUES = values();

    public int index() {
        return ordinal();
    }

    /** Замок и зиккурат считаются поселениями для дорожной сети. */
    public boolean isSettlement() {
        return this == CASTLE || this == ZIGGURAT;
    }

    public static SpecialFeature fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Special index out of range: " + index);
        }
        return VALUES[index];
    }
}
