package com.financial.stock.service;

import com.financial.stock.model.Stock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the stocks known to a caller, each with its own ledger.
 *
 * Registries are plain objects: any number may coexist, e.g. one per test.
 * Every ledger created here shares the registry's clock and default window.
 *
 * THREAD SAFETY: backed by a ConcurrentHashMap; registration and lookup may
 * run concurrently.
 */
public class StockRegistry {

    private static final Logger log = LoggerFactory.getLogger(StockRegistry.class);

    private final ConcurrentHashMap<String, StockLedger> ledgers;
    private final Clock clock;
    private final Duration defaultWindow;

    public StockRegistry() {
        this(Clock.systemUTC(), StockLedger.DEFAULT_WINDOW);
    }

    /**
     * @param clock time source handed to every ledger
     * @param defaultWindow window handed to every ledger
     */
    public StockRegistry(Clock clock, Duration defaultWindow) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.defaultWindow = Objects.requireNonNull(defaultWindow, "defaultWindow cannot be null");
        WeightedPriceCalculator.requireValidWindow(defaultWindow);
        this.ledgers = new ConcurrentHashMap<>();
        log.info("StockRegistry initialized");
    }

    /**
     * Registers a stock and creates an empty ledger for it.
     *
     * Symbols are unique. Registering a symbol that already exists replaces the
     * previous ledger, and its trade history, with a fresh one.
     *
     * @param stock the stock definition
     * @return the new ledger
     */
    public StockLedger register(Stock stock) {
        Objects.requireNonNull(stock, "stock cannot be null");
        StockLedger ledger = new InMemoryStockLedger(stock, clock, defaultWindow);
        StockLedger previous = ledgers.put(stock.getSymbol(), ledger);
        if (previous != null) {
            log.warn("Replaced existing ledger for {} ({} trades discarded)",
                    stock.getSymbol(), previous.getTradeCount());
        } else {
            log.debug("Registered {}", stock.getSymbol());
        }
        return ledger;
    }

    /**
     * Looks up a ledger by symbol, ignoring case.
     *
     * @param symbol the stock symbol
     * @return the ledger, or Optional.empty() if the symbol is unknown, null or empty
     */
    public Optional<StockLedger> getLedger(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(ledgers.get(symbol.toUpperCase(Locale.ROOT)));
    }

    /**
     * @return immutable snapshot of all registered ledgers
     */
    public Collection<StockLedger> getLedgers() {
        return List.copyOf(ledgers.values());
    }

    /**
     * @return the window every ledger in this registry uses by default
     */
    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public int size() {
        return ledgers.size();
    }
}
