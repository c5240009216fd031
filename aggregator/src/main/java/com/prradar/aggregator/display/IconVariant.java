package com.prradar.aggregator.display;

/**
 * Icon shown next to an item. The presentation layer maps each variant to an asset.
 */
public enum IconVariant {
    NORMAL,
    OWN,
    APPROVED,
    OWN_APPROVED,
    ERROR;

    public static IconVariant of(PrType type, boolean own) {
        if (type == PrType.APPROVED) {
            return own ? OWN_APPROVED : APPROVED;
        }
        return own ? OWN : NORMAL;
    }
}
