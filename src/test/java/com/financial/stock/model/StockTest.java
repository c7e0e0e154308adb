package com.financial.stock.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Construction rules for stock and trade records.
 */
class StockTest {

    @Test
    @DisplayName("Should construct the sample GBCE stocks")
    void testValidStocks() {
        Stock tea = Stock.common("TEA", 0, 100);
        Stock gin = Stock.preferred("GIN", 8, 0.02, 100);

        assertEquals(StockType.COMMON, tea.getType());
        assertFalse(tea.getFixedDividendRate().isPresent(), "Common stocks carry no fixed rate");
        assertEquals(StockType.PREFERRED, gin.getType());
        assertEquals(0.02, gin.getFixedDividendRate().getAsDouble());
        assertEquals(100, gin.getParValue());
    }

    @Test
    @DisplayName("Symbol should be stored upper-cased")
    void testSymbolUpperCased() {
        assertEquals("ALE", Stock.common("ale", 23, 60).getSymbol());
    }

    @Test
    @DisplayName("Should reject invalid stock attributes")
    void testInvalidStocks() {
        assertThrows(IllegalArgumentException.class, () -> Stock.common("TEA", 0, -14),
                "Par value must not be negative");
        assertThrows(IllegalArgumentException.class, () -> Stock.common("TEA", -41, 100),
                "Last dividend must not be negative");
        assertThrows(IllegalArgumentException.class, () -> Stock.common("a2vn52", 0, 100),
                "Symbol must be alphabetic");
        assertThrows(IllegalArgumentException.class, () -> Stock.common("", 0, 100));
        assertThrows(IllegalArgumentException.class, () -> Stock.preferred("GIN", 8, 1.01, 100),
                "Fixed rate must not exceed 1");
        assertThrows(IllegalArgumentException.class, () -> Stock.preferred("GIN", 8, -0.1, 100));
        assertThrows(IllegalArgumentException.class, () -> Stock.preferred("GIN", 8, Double.NaN, 100));
        assertThrows(IllegalArgumentException.class,
                () -> new Stock("TEA", StockType.COMMON, 0, 0.5, 100),
                "Common stocks must not carry a fixed rate");
        assertThrows(IllegalArgumentException.class,
                () -> new Stock("GIN", StockType.PREFERRED, 8, null, 100),
                "Preferred stocks require a fixed rate");
        assertThrows(NullPointerException.class, () -> new Stock(null, StockType.COMMON, 0, null, 100));
        assertThrows(NullPointerException.class, () -> new Stock("TEA", null, 0, null, 100));
    }

    @Test
    @DisplayName("Dividend base should depend on the stock type")
    void testDividendBase() {
        assertEquals(23.0, Stock.common("ALE", 23, 60).dividend());
        assertEquals(2.0, Stock.preferred("GIN", 8, 0.02, 100).dividend(), 1e-12);
    }

    @Test
    @DisplayName("Should parse stock type text case-insensitively")
    void testParseStockType() {
        assertEquals(StockType.COMMON, StockType.fromText("common"));
        assertEquals(StockType.PREFERRED, StockType.fromText(" Preferred "));
        assertThrows(IllegalArgumentException.class, () -> StockType.fromText("best_stock"));
        assertThrows(IllegalArgumentException.class, () -> StockType.fromText(null));
    }

    @Test
    @DisplayName("Trade should reject out-of-range values and compute its value")
    void testTrade() {
        Instant at = Instant.parse("2024-01-01T10:00:00Z");
        Trade trade = new Trade(TradeDirection.SELL, 300, 15, at);

        assertEquals(4500, trade.value());
        assertEquals(new Trade(TradeDirection.SELL, 300, 15, at), trade);
        assertThrows(IllegalArgumentException.class, () -> new Trade(TradeDirection.BUY, 0, 15, at));
        assertThrows(IllegalArgumentException.class, () -> new Trade(TradeDirection.BUY, 1, -1, at));
        assertThrows(NullPointerException.class, () -> new Trade(TradeDirection.BUY, 1, 1, null));
        assertThrows(ArithmeticException.class,
                () -> new Trade(TradeDirection.BUY, Long.MAX_VALUE, 2, at).value());
    }
}
