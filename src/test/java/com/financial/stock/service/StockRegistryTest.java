package com.financial.stock.service;

import com.financial.stock.model.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StockRegistryTest {

    private MutableClock clock;
    private StockRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        registry = new StockRegistry(clock, StockLedger.DEFAULT_WINDOW);
    }

    @Test
    @DisplayName("Should register stocks and look them up by symbol")
    void testRegisterAndLookup() {
        StockLedger ledger = registry.register(Stock.common("ALE", 23, 60));

        Optional<StockLedger> found = registry.getLedger("ALE");
        assertTrue(found.isPresent());
        assertSame(ledger, found.get());
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Symbol lookup should ignore case")
    void testCaseInsensitiveLookup() {
        registry.register(Stock.common("pop", 8, 100));

        assertTrue(registry.getLedger("POP").isPresent());
        assertTrue(registry.getLedger("Pop").isPresent());
    }

    @Test
    @DisplayName("Should return empty for unknown, null and empty symbols")
    void testMissingSymbols() {
        assertFalse(registry.getLedger("JOE").isPresent());
        assertFalse(registry.getLedger(null).isPresent());
        assertFalse(registry.getLedger("").isPresent());
    }

    @Test
    @DisplayName("Re-registering a symbol should replace its ledger")
    void testReplaceExisting() {
        StockLedger first = registry.register(Stock.common("TEA", 0, 100));
        first.buy(10, 95);

        StockLedger second = registry.register(Stock.common("TEA", 5, 120));

        assertEquals(1, registry.size());
        assertSame(second, registry.getLedger("TEA").orElseThrow());
        assertEquals(0, second.getTradeCount());
        assertEquals(5, second.getStock().getLastDividend());
    }

    @Test
    @DisplayName("Ledgers should share the registry's clock and default window")
    void testLedgersShareClock() {
        StockRegistry hourly = new StockRegistry(clock, Duration.ofHours(1));
        StockLedger ledger = hourly.register(Stock.common("GIN", 8, 100));

        ledger.buy(1, 10);
        ledger.buy(1, 30, clock.instant().minus(Duration.ofMinutes(45)));
        assertEquals(20.0, ledger.price());

        clock.advance(Duration.ofMinutes(1));
        assertThrows(InvalidTradeException.class,
                () -> ledger.buy(1, 10, clock.instant().plusSeconds(1)));
    }

    @Test
    @DisplayName("Independent registries should not share stocks")
    void testIndependentRegistries() {
        StockRegistry other = new StockRegistry();
        registry.register(Stock.common("ALE", 23, 60));

        assertEquals(0, other.size());
        assertFalse(other.getLedger("ALE").isPresent());
    }

    @Test
    @DisplayName("Ledger snapshot should be immutable")
    void testLedgersSnapshot() {
        registry.register(Stock.common("ALE", 23, 60));
        Collection<StockLedger> ledgers = registry.getLedgers();

        registry.register(Stock.common("JOE", 13, 250));

        assertEquals(1, ledgers.size());
        assertThrows(UnsupportedOperationException.class, () -> ledgers.clear());
        assertEquals(2, registry.getLedgers().size());
    }
}
