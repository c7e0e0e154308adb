package com.financial.stock.service;

/**
 * Thrown when a trade is rejected before being recorded: non-positive
 * quantity, negative price, missing fields, or a timestamp in the future.
 * A rejected trade never reaches the ledger.
 */
public class InvalidTradeException extends IllegalArgumentException {

    public InvalidTradeException(String message) {
        super(message);
    }

    public InvalidTradeException(String message, Throwable cause) {
        super(message, cause);
    }
}
