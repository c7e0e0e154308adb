package com.financial.stock.service;

import com.financial.stock.model.Stock;
import com.financial.stock.model.Trade;
import com.financial.stock.model.TradeDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Trade ledger for a single stock, and the metrics derived from its trades.
 *
 * THREAD SAFETY: All methods are thread-safe. Recording is serialized per
 * ledger; queries never block and always see a consistent set of trades.
 *
 * USAGE:
 * Writers:
 *   - recordTrade(direction, quantity, price, timestamp), or buy()/sell()
 *
 * Readers:
 *   - price() → volume-weighted price over the last 15 minutes
 *   - dividendYield(), priceEarningsRatio() → ratios derived from price()
 *
 * Every query has an overload taking an explicit window.
 */
public interface StockLedger {

    /**
     * Window used by the no-argument queries.
     */
    Duration DEFAULT_WINDOW = Duration.ofMinutes(15);

    /**
     * @return the static definition of the stock this ledger tracks
     */
    Stock getStock();

    /**
     * Appends a trade to the ledger.
     *
     * A trade is rejected, and the ledger left unchanged, when:
     * - quantity is zero or negative
     * - price is negative
     * - timestamp is strictly after the current instant (no future-dated trades)
     * - direction or timestamp is null
     *
     * Trades may be recorded out of chronological order.
     *
     * @param direction buy or sell
     * @param quantity number of shares, strictly positive
     * @param price price per share in minor units, non-negative
     * @param timestamp execution time, not in the future
     * @return the recorded trade
     * @throws InvalidTradeException if the trade is rejected
     */
    Trade recordTrade(TradeDirection direction, long quantity, long price, Instant timestamp);

    /**
     * Records a buy executed now.
     *
     * @throws InvalidTradeException if the trade is rejected
     */
    Trade buy(long quantity, long price);

    /**
     * Records a buy executed at the given time.
     *
     * @throws InvalidTradeException if the trade is rejected
     */
    default Trade buy(long quantity, long price, Instant timestamp) {
        return recordTrade(TradeDirection.BUY, quantity, price, timestamp);
    }

    /**
     * Records a sell executed now.
     *
     * @throws InvalidTradeException if the trade is rejected
     */
    Trade sell(long quantity, long price);

    /**
     * Records a sell executed at the given time.
     *
     * @throws InvalidTradeException if the trade is rejected
     */
    default Trade sell(long quantity, long price, Instant timestamp) {
        return recordTrade(TradeDirection.SELL, quantity, price, timestamp);
    }

    /**
     * Volume-weighted average trade price over the default window.
     *
     * @see #price(Duration)
     */
    default double price() {
        return price(DEFAULT_WINDOW);
    }

    /**
     * Volume-weighted average trade price over a trailing window.
     *
     * "Last" is determined by trade timestamp, not recording order. If no trade
     * falls within the window ending now, the window is re-anchored to end at
     * the newest trade. With no trades at all, or no trades in the window, the
     * par value is returned.
     *
     * Never fails for a valid window.
     *
     * @param window length of the trailing window, non-negative
     * @return the weighted price in minor units
     * @throws IllegalArgumentException if window is null or negative
     */
    double price(Duration window);

    /**
     * Dividend yield over the default window.
     *
     * @see #dividendYield(Duration)
     */
    default double dividendYield() {
        return dividendYield(DEFAULT_WINDOW);
    }

    /**
     * Dividend yield: the stock's dividend divided by price(window).
     *
     * - COMMON: lastDividend / price
     * - PREFERRED: (fixedDividendRate * parValue) / price
     *
     * @param window length of the trailing window used for the price
     * @return the yield
     * @throws DivisionUndefinedException if the price is 0
     */
    double dividendYield(Duration window);

    /**
     * P/E ratio over the default window.
     *
     * @see #priceEarningsRatio(Duration)
     */
    default double priceEarningsRatio() {
        return priceEarningsRatio(DEFAULT_WINDOW);
    }

    /**
     * Price/earnings ratio: price(window) divided by the stock's dividend.
     *
     * @param window length of the trailing window used for the price
     * @return the ratio
     * @throws DivisionUndefinedException if the dividend is 0
     */
    double priceEarningsRatio(Duration window);

    /**
     * Returns every recorded trade in recording order.
     *
     * @return immutable snapshot of the trade history
     */
    List<Trade> getTrades();

    /**
     * @return number of recorded trades
     */
    int getTradeCount();
}
