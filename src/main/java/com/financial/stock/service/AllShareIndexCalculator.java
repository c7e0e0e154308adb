package com.financial.stock.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * All Share Index: the geometric mean of the windowed prices of a set of stocks.
 *
 * The mean is taken in log space, exp(sum(log p) / n), so large sets of stocks
 * or extreme price ratios neither overflow nor underflow.
 *
 * Stocks priced at exactly 0 are left out of the mean instead of collapsing it
 * to 0. Callers that care about exclusions must inspect the prices themselves.
 */
public final class AllShareIndexCalculator {

    private static final Logger log = LoggerFactory.getLogger(AllShareIndexCalculator.class);

    private AllShareIndexCalculator() {
    }

    /**
     * Index over every ledger in the registry, using the registry's default window.
     */
    public static double geometricMeanIndex(StockRegistry registry) {
        Objects.requireNonNull(registry, "registry cannot be null");
        return geometricMeanIndex(registry.getLedgers(), registry.getDefaultWindow());
    }

    /**
     * Index over the given ledgers, default window.
     */
    public static double geometricMeanIndex(Iterable<? extends StockLedger> ledgers) {
        return geometricMeanIndex(ledgers, StockLedger.DEFAULT_WINDOW);
    }

    /**
     * Geometric mean of price(window) over the given ledgers.
     *
     * @param ledgers the stocks in the index
     * @param window window passed to each ledger's price query
     * @return the geometric mean of the non-zero prices, or 0 if every price is 0
     *         (or there are no ledgers)
     */
    public static double geometricMeanIndex(Iterable<? extends StockLedger> ledgers, Duration window) {
        Objects.requireNonNull(ledgers, "ledgers cannot be null");
        WeightedPriceCalculator.requireValidWindow(window);

        double logSum = 0.0;
        int total = 0;
        int zeros = 0;
        for (StockLedger ledger : ledgers) {
            total++;
            double price = ledger.price(window);
            if (price == 0.0) {
                log.warn("Excluding {} from index: price is 0", ledger.getStock().getSymbol());
                zeros++;
                continue;
            }
            logSum += Math.log(price);
        }

        // Covers the empty set too
        if (zeros == total) {
            return 0.0;
        }

        double index = Math.exp(logSum / (total - zeros));
        log.debug("All share index over {} stocks ({} excluded): {}", total, zeros, index);
        return index;
    }
}
