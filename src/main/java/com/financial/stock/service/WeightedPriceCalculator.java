package com.financial.stock.service;

import com.financial.stock.model.Trade;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Volume-weighted average price over a trailing time window.
 *
 * ==================================================================================
 * TRADE SELECTION:
 * ==================================================================================
 * 1. No trades at all: the par value is returned.
 * 2. The window normally ends at "now". If the newest trade is older than the
 *    window, the window is re-anchored to end at that newest trade instead, so
 *    a quiet stock still prices off its last burst of activity.
 * 3. Trades with timestamp in [anchor - window, anchor] are selected (inclusive).
 * 4. The result is sum(price * quantity) / sum(quantity) over the selection,
 *    or the par value if the selection is empty.
 *
 * The newest trade is found by timestamp, not by insertion order: trades may be
 * recorded out of chronological order.
 *
 * Stateless and thread-safe.
 */
public final class WeightedPriceCalculator {

    private WeightedPriceCalculator() {
    }

    /**
     * Computes the windowed volume-weighted price.
     *
     * @param trades trade history in any order
     * @param window length of the trailing window, non-negative
     * @param now the current instant
     * @param parValue fallback price when no trade qualifies
     * @return the weighted mean price, or parValue
     * @throws IllegalArgumentException if window is null or negative
     * @throws ArithmeticException if the traded value or volume overflows a long
     */
    public static double weightedPrice(List<Trade> trades, Duration window, Instant now, long parValue) {
        requireValidWindow(window);
        Objects.requireNonNull(now, "now cannot be null");

        if (trades.isEmpty()) {
            return parValue;
        }

        Instant anchor = windowEnd(trades, window, now);
        // Clamp so an arbitrarily long window cannot step past Instant.MIN
        Instant start = Duration.between(Instant.MIN, anchor).compareTo(window) < 0
                ? Instant.MIN
                : anchor.minus(window);

        long totalValue = 0;
        long totalQuantity = 0;
        for (Trade trade : trades) {
            Instant at = trade.getTimestamp();
            if (at.isBefore(start) || at.isAfter(anchor)) {
                continue;
            }
            totalValue = Math.addExact(totalValue, trade.value());
            totalQuantity = Math.addExact(totalQuantity, trade.getQuantity());
        }

        if (totalQuantity == 0) {
            return parValue;
        }
        return (double) totalValue / totalQuantity;
    }

    /**
     * Picks where the window ends: now if the newest trade is within the window
     * of now, otherwise the newest trade's timestamp.
     *
     * @param trades non-empty trade history
     */
    static Instant windowEnd(List<Trade> trades, Duration window, Instant now) {
        Instant latest = trades.get(0).getTimestamp();
        for (Trade trade : trades) {
            if (trade.getTimestamp().isAfter(latest)) {
                latest = trade.getTimestamp();
            }
        }
        return Duration.between(latest, now).compareTo(window) <= 0 ? now : latest;
    }

    static void requireValidWindow(Duration window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (window.isNegative()) {
            throw new IllegalArgumentException("window cannot be negative, was " + window);
        }
    }
}
