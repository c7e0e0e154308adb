package com.financial.stock.model;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable static definition of a listed stock.
 *
 * DESIGN DECISIONS:
 * - COMMON vs PREFERRED is a tag, not a subclass. The fixed dividend rate
 *   is present if and only if the type is PREFERRED.
 * - Symbols are stored upper-cased and are the unique key in a registry.
 * - Monetary amounts (last dividend, par value) are longs in minor units.
 *
 * Trade history lives in a ledger, not here, so a Stock can be shared freely.
 */
public final class Stock {
    private final String symbol;
    private final StockType type;
    private final long lastDividend;
    private final Double fixedDividendRate;
    private final long parValue;

    /**
     * Creates a new stock definition.
     *
     * @param symbol alphabetic symbol, e.g. "TEA"; upper-cased on construction
     * @param type COMMON or PREFERRED
     * @param lastDividend last paid dividend in minor units, non-negative
     * @param fixedDividendRate rate in [0, 1] for PREFERRED stocks, null for COMMON
     * @param parValue par value in minor units, non-negative
     * @throws NullPointerException if symbol or type is null
     * @throws IllegalArgumentException if any value violates the rules above
     */
    public Stock(String symbol, StockType type, long lastDividend,
                 Double fixedDividendRate, long parValue) {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");

        if (symbol.isEmpty() || !symbol.chars().allMatch(Character::isLetter)) {
            throw new IllegalArgumentException("stock symbol '" + symbol + "' is not alphabetic");
        }
        if (lastDividend < 0) {
            throw new IllegalArgumentException(
                    "lastDividend must be non-negative, was " + lastDividend);
        }
        if (parValue < 0) {
            throw new IllegalArgumentException("parValue must be non-negative, was " + parValue);
        }
        if (type == StockType.PREFERRED) {
            if (fixedDividendRate == null) {
                throw new IllegalArgumentException(
                        "preferred stock " + symbol + " requires a fixed dividend rate");
            }
            if (fixedDividendRate.isNaN() || fixedDividendRate < 0.0 || fixedDividendRate > 1.0) {
                throw new IllegalArgumentException(
                        "fixed dividend rate must be in [0, 1], was " + fixedDividendRate);
            }
        } else if (fixedDividendRate != null) {
            throw new IllegalArgumentException(
                    "common stock " + symbol + " cannot have a fixed dividend rate");
        }

        this.symbol = symbol.toUpperCase(Locale.ROOT);
        this.lastDividend = lastDividend;
        this.fixedDividendRate = fixedDividendRate;
        this.parValue = parValue;
    }

    public static Stock common(String symbol, long lastDividend, long parValue) {
        return new Stock(symbol, StockType.COMMON, lastDividend, null, parValue);
    }

    public static Stock preferred(String symbol, long lastDividend,
                                  double fixedDividendRate, long parValue) {
        return new Stock(symbol, StockType.PREFERRED, lastDividend, fixedDividendRate, parValue);
    }

    public String getSymbol() {
        return symbol;
    }

    public StockType getType() {
        return type;
    }

    public long getLastDividend() {
        return lastDividend;
    }

    /**
     * @return the fixed dividend rate, empty for COMMON stocks
     */
    public OptionalDouble getFixedDividendRate() {
        return fixedDividendRate == null ? OptionalDouble.empty() : OptionalDouble.of(fixedDividendRate);
    }

    public long getParValue() {
        return parValue;
    }

    /**
     * Dividend base shared by the yield and P/E formulas.
     *
     * @return lastDividend for COMMON, fixedDividendRate * parValue for PREFERRED
     */
    public double dividend() {
        switch (type) {
            case PREFERRED:
                return fixedDividendRate * parValue;
            case COMMON:
            default:
                return lastDividend;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Stock that = (Stock) o;
        return lastDividend == that.lastDividend &&
                parValue == that.parValue &&
                Objects.equals(symbol, that.symbol) &&
                type == that.type &&
                Objects.equals(fixedDividendRate, that.fixedDividendRate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, type, lastDividend, fixedDividendRate, parValue);
    }

    @Override
    public String toString() {
        return "Stock{" +
                "symbol='" + symbol + '\'' +
                ", type=" + type +
                ", lastDividend=" + lastDividend +
                ", fixedDividendRate=" + fixedDividendRate +
                ", parValue=" + parValue +
                '}';
    }
}
