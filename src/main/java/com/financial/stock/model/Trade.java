package com.financial.stock.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a single executed trade.
 * Thread-safe by design - once created, cannot be modified.
 *
 * Prices are in minor currency units (e.g. pennies). The product
 * price * quantity must fit in a long; see {@link #value()}.
 */
public final class Trade {
    private final TradeDirection direction;
    private final long quantity;
    private final long price;
    private final Instant timestamp;

    /**
     * Creates a new trade.
     *
     * @param direction buy or sell
     * @param quantity number of shares traded, strictly positive
     * @param price trade price per share in minor units, non-negative
     * @param timestamp when the trade was executed
     * @throws NullPointerException if direction or timestamp is null
     * @throws IllegalArgumentException if quantity or price is out of range
     */
    public Trade(TradeDirection direction, long quantity, long price, Instant timestamp) {
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive, was " + quantity);
        }
        if (price < 0) {
            throw new IllegalArgumentException("price cannot be negative, was " + price);
        }
        this.quantity = quantity;
        this.price = price;
    }

    public TradeDirection getDirection() {
        return direction;
    }

    public long getQuantity() {
        return quantity;
    }

    public long getPrice() {
        return price;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Traded value, price * quantity.
     *
     * @return the value in minor units
     * @throws ArithmeticException if the product overflows a long
     */
    public long value() {
        return Math.multiplyExact(price, quantity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Trade that = (Trade) o;
        return quantity == that.quantity &&
                price == that.price &&
                direction == that.direction &&
                Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, quantity, price, timestamp);
    }

    @Override
    public String toString() {
        return "Trade{" +
                "direction=" + direction +
                ", quantity=" + quantity +
                ", price=" + price +
                ", timestamp=" + timestamp +
                '}';
    }
}
