package com.financial.stock.model;

/**
 * Side of a trade.
 */
public enum TradeDirection {
    BUY(1),
    SELL(-1);

    private final int sign;

    TradeDirection(int sign) {
        this.sign = sign;
    }

    /**
     * @return +1 for a buy, -1 for a sell
     */
    public int sign() {
        return sign;
    }
}
