package com.financial.stock.service;

import com.financial.stock.model.Stock;
import com.financial.stock.model.Trade;
import com.financial.stock.model.TradeDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * In-memory implementation of StockLedger.
 *
 * ==================================================================================
 * CONCURRENCY MODEL:
 * ==================================================================================
 * - Single writer: recordTrade() appends under the ledger's monitor
 * - Copy-on-write: each append publishes a new immutable list via a volatile write
 * - Readers take one volatile read and compute over that snapshot, lock-free
 * - Readers never see a half-appended trade
 *
 * ==================================================================================
 * TIME:
 * ==================================================================================
 * - "Now" always comes from the injected Clock, never from Instant.now()
 * - The clock is read once per operation
 *
 * Trade histories are expected to be small (one stock, a trading session), so the
 * O(n) copy per append is cheaper than locking every read.
 */
public class InMemoryStockLedger implements StockLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStockLedger.class);

    private final Stock stock;
    private final Clock clock;
    private final Duration defaultWindow;

    /**
     * Recorded trades in recording order.
     * Never mutated in place; replaced wholesale on every append.
     */
    private volatile List<Trade> trades;

    /**
     * Sums of price * quantity and of quantity over every recorded trade.
     * Any window selects a subset, so keeping these within a long keeps every
     * windowed sum within a long. Guarded by this ledger's monitor.
     */
    private long totalValue;
    private long totalQuantity;

    /**
     * Creates a ledger on the system UTC clock with the 15 minute default window.
     *
     * @param stock the stock whose trades this ledger records
     */
    public InMemoryStockLedger(Stock stock) {
        this(stock, Clock.systemUTC(), DEFAULT_WINDOW);
    }

    /**
     * Creates a ledger with an explicit time source and default window.
     *
     * @param stock the stock whose trades this ledger records
     * @param clock source of the current instant
     * @param defaultWindow window used by the no-argument queries
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if defaultWindow is negative
     */
    public InMemoryStockLedger(Stock stock, Clock clock, Duration defaultWindow) {
        this.stock = Objects.requireNonNull(stock, "stock cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        Objects.requireNonNull(defaultWindow, "defaultWindow cannot be null");
        WeightedPriceCalculator.requireValidWindow(defaultWindow);
        this.defaultWindow = defaultWindow;
        this.trades = List.of();
        log.info("Ledger initialized for {} ({}), default window {}",
                stock.getSymbol(), stock.getType(), defaultWindow);
    }

    @Override
    public Stock getStock() {
        return stock;
    }

    @Override
    public Trade recordTrade(TradeDirection direction, long quantity, long price, Instant timestamp) {
        // Input validation
        if (direction == null) {
            throw reject("direction cannot be null");
        }
        if (timestamp == null) {
            throw reject("timestamp cannot be null");
        }
        if (quantity <= 0) {
            throw reject("quantity must be positive, was " + quantity);
        }
        if (price < 0) {
            throw reject("price cannot be negative, was " + price);
        }
        Instant now = clock.instant();
        if (timestamp.isAfter(now)) {
            throw reject("timestamp " + timestamp + " is in the future (now " + now + ")");
        }

        Trade trade = new Trade(direction, quantity, price, timestamp);
        long value;
        try {
            value = trade.value();
        } catch (ArithmeticException e) {
            throw reject("trade value " + price + " x " + quantity + " overflows a long", e);
        }
        append(trade, value);
        log.debug("Recorded {} {} x {} @ {} for {}",
                direction, quantity, price, timestamp, stock.getSymbol());
        return trade;
    }

    @Override
    public Trade buy(long quantity, long price) {
        return recordTrade(TradeDirection.BUY, quantity, price, clock.instant());
    }

    @Override
    public Trade sell(long quantity, long price) {
        return recordTrade(TradeDirection.SELL, quantity, price, clock.instant());
    }

    @Override
    public double price() {
        return price(defaultWindow);
    }

    @Override
    public double price(Duration window) {
        // Single volatile read: the whole computation sees one snapshot
        List<Trade> snapshot = trades;
        double price = WeightedPriceCalculator.weightedPrice(
                snapshot, window, clock.instant(), stock.getParValue());
        log.debug("Price of {} over {} from {} trades: {}",
                stock.getSymbol(), window, snapshot.size(), price);
        return price;
    }

    @Override
    public double dividendYield() {
        return dividendYield(defaultWindow);
    }

    @Override
    public double dividendYield(Duration window) {
        double price = price(window);
        if (price == 0.0) {
            throw new DivisionUndefinedException(
                    "Dividend yield of " + stock.getSymbol() + " is undefined at price 0");
        }
        return stock.dividend() / price;
    }

    @Override
    public double priceEarningsRatio() {
        return priceEarningsRatio(defaultWindow);
    }

    @Override
    public double priceEarningsRatio(Duration window) {
        double dividend = stock.dividend();
        if (dividend == 0.0) {
            throw new DivisionUndefinedException(
                    "P/E ratio of " + stock.getSymbol() + " is undefined with dividend 0");
        }
        return price(window) / dividend;
    }

    @Override
    public List<Trade> getTrades() {
        return trades;
    }

    @Override
    public int getTradeCount() {
        return trades.size();
    }

    /**
     * Publishes a new trade list containing the given trade.
     * Synchronized so concurrent appends never lose a trade.
     *
     * @throws InvalidTradeException if the ledger's totals would overflow a long
     */
    private synchronized void append(Trade trade, long value) {
        long newValue;
        long newQuantity;
        try {
            newValue = Math.addExact(totalValue, value);
            newQuantity = Math.addExact(totalQuantity, trade.getQuantity());
        } catch (ArithmeticException e) {
            throw reject("traded value or volume of " + stock.getSymbol() + " would overflow a long", e);
        }
        totalValue = newValue;
        totalQuantity = newQuantity;

        List<Trade> updated = new ArrayList<>(trades.size() + 1);
        updated.addAll(trades);
        updated.add(trade);
        this.trades = Collections.unmodifiableList(updated);
    }

    private InvalidTradeException reject(String reason) {
        return reject(reason, null);
    }

    private InvalidTradeException reject(String reason, ArithmeticException cause) {
        log.warn("Rejected trade for {}: {}", stock.getSymbol(), reason);
        return new InvalidTradeException(reason, cause);
    }

    @Override
    public String toString() {
        return "InMemoryStockLedger{" +
                "stock=" + stock +
                ", trades=" + trades.size() +
                '}';
    }
}
