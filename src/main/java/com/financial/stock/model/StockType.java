package com.financial.stock.model;

import java.util.Locale;

/**
 * Dividend-calculation variant of a stock.
 *
 * COMMON stocks pay their last declared dividend.
 * PREFERRED stocks pay a fixed rate of their par value.
 */
public enum StockType {
    COMMON,
    PREFERRED;

    /**
     * Parses human-supplied type text such as "common" or " Preferred ".
     *
     * @param text the type name, case-insensitive
     * @return the matching type
     * @throws IllegalArgumentException if text is null or names no type
     */
    public static StockType fromText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("stock type cannot be null");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (StockType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unknown stock type '" + text + "', expected common or preferred");
    }
}
